package tech.charforge.generationworker.worker;

public enum HealthLevel {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
