package tech.charforge.generationworker.warning;

import java.time.Duration;
import java.util.List;

/**
 * Collects warnings for the monitoring endpoint.
 */
public interface WarningService {

    void addWarning(WarningCategory category, WarningSeverity severity, String message, String source);

    /**
     * All warnings, newest first.
     */
    List<Warning> getAllWarnings();

    List<Warning> getUnacknowledgedWarnings();

    boolean acknowledgeWarning(String warningId);

    /**
     * Remove warnings raised before {@code now - age}.
     *
     * @return number of warnings removed
     */
    int clearOlderThan(Duration age);

    void clearAllWarnings();
}
