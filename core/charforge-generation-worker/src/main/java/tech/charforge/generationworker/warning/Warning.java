package tech.charforge.generationworker.warning;

import java.time.Instant;

/**
 * Operator-facing warning raised by the worker or its provider integration.
 */
public record Warning(
    String id,
    WarningCategory category,
    WarningSeverity severity,
    String message,
    Instant timestamp,
    String source,
    boolean acknowledged
) {

    Warning acknowledge() {
        return new Warning(id, category, severity, message, timestamp, source, true);
    }
}
