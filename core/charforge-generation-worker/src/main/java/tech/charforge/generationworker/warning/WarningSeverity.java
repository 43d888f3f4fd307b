package tech.charforge.generationworker.warning;

public enum WarningSeverity {
    INFO,
    WARN,
    ERROR,
    CRITICAL
}
