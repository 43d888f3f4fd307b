package tech.charforge.generationworker.warning;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Bounded in-memory warning store. When full, the oldest warning is evicted.
 */
@ApplicationScoped
public class InMemoryWarningService implements WarningService {

    private static final Logger LOG = Logger.getLogger(InMemoryWarningService.class);
    static final int MAX_WARNINGS = 1000;

    private static final Comparator<Warning> NEWEST_FIRST =
        Comparator.comparing(Warning::timestamp).reversed();

    private final ConcurrentMap<String, Warning> warnings = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryWarningService() {
        this(Clock.systemUTC());
    }

    public InMemoryWarningService(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void addWarning(WarningCategory category, WarningSeverity severity, String message, String source) {
        if (warnings.size() >= MAX_WARNINGS) {
            warnings.values().stream()
                .min(Comparator.comparing(Warning::timestamp))
                .ifPresent(oldest -> warnings.remove(oldest.id()));
        }

        Warning warning = new Warning(UUID.randomUUID().toString(), category, severity, message,
            clock.instant(), source, false);
        warnings.put(warning.id(), warning);
        LOG.infof("Warning added: [%s] %s - %s - %s", severity, category, source, message);
    }

    @Override
    public List<Warning> getAllWarnings() {
        return warnings.values().stream().sorted(NEWEST_FIRST).toList();
    }

    @Override
    public List<Warning> getUnacknowledgedWarnings() {
        return warnings.values().stream()
            .filter(w -> !w.acknowledged())
            .sorted(NEWEST_FIRST)
            .toList();
    }

    @Override
    public boolean acknowledgeWarning(String warningId) {
        Warning updated = warnings.computeIfPresent(warningId, (id, existing) -> existing.acknowledge());
        return updated != null;
    }

    @Override
    public int clearOlderThan(Duration age) {
        Instant threshold = clock.instant().minus(age);
        List<String> expired = warnings.values().stream()
            .filter(w -> w.timestamp().isBefore(threshold))
            .map(Warning::id)
            .toList();
        expired.forEach(warnings::remove);
        if (!expired.isEmpty()) {
            LOG.debugf("Cleared %d warnings older than %s", expired.size(), age);
        }
        return expired.size();
    }

    @Override
    public void clearAllWarnings() {
        int count = warnings.size();
        warnings.clear();
        LOG.infof("Cleared all warnings: %d warnings removed", count);
    }
}
