package tech.charforge.generationworker.warning;

public enum WarningCategory {
    /** Provider credentials or endpoint misconfigured. */
    CONFIGURATION,
    /** Jobs stuck or failing at an unusual rate. */
    PROCESSING,
    /** Worker health degraded. */
    HEALTH
}
