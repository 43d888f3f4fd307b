package tech.charforge.generationworker.lifecycle;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.charforge.generationworker.config.GenerationWorkerConfig;
import tech.charforge.generationworker.event.WorkerEvent;
import tech.charforge.generationworker.event.WorkerEventBus;
import tech.charforge.generationworker.metrics.MicrometerWorkerMetrics;
import tech.charforge.generationworker.warning.WarningCategory;
import tech.charforge.generationworker.warning.WarningService;
import tech.charforge.generationworker.warning.WarningSeverity;
import tech.charforge.generationworker.worker.HealthLevel;
import tech.charforge.generationworker.worker.QueueWorker;

import java.util.ArrayList;
import java.util.List;

/**
 * Starts the queue worker with the application and stops it on shutdown.
 * Also turns worker events into operator warnings.
 */
@ApplicationScoped
public class GenerationWorkerLifecycle {

    private static final Logger LOG = Logger.getLogger(GenerationWorkerLifecycle.class);
    private static final String SOURCE = "QueueWorker";

    @Inject
    GenerationWorkerConfig config;

    @Inject
    QueueWorker worker;

    @Inject
    WorkerEventBus events;

    @Inject
    WarningService warningService;

    @Inject
    MicrometerWorkerMetrics workerMetrics;

    private final List<WorkerEventBus.Subscription> subscriptions = new ArrayList<>();
    private volatile HealthLevel lastReportedHealth = HealthLevel.HEALTHY;

    void onStart(@Observes StartupEvent event) {
        if (!config.enabled()) {
            LOG.info("Generation worker is disabled");
            return;
        }

        subscriptions.add(events.subscribe(WorkerEvent.HealthCheck.class, this::onHealthCheck));
        subscriptions.add(events.subscribe(WorkerEvent.UncaughtError.class, this::onUncaughtError));
        subscriptions.add(events.subscribe(WorkerEvent.JobFailed.class, this::onJobFailed));

        worker.start();
        LOG.infof("Generation worker started with %d event listeners", events.listenerCount());
    }

    void onShutdown(@Observes ShutdownEvent event) {
        if (!worker.isRunning()) {
            return;
        }
        LOG.info("Application shutting down, stopping generation worker");
        worker.stop();
        subscriptions.forEach(WorkerEventBus.Subscription::cancel);
        subscriptions.clear();
        workerMetrics.unbind();
    }

    void onHealthCheck(WorkerEvent.HealthCheck event) {
        HealthLevel level = event.health().status();
        // Warn on transitions only
        if (level != lastReportedHealth && level != HealthLevel.HEALTHY) {
            warningService.addWarning(
                WarningCategory.HEALTH,
                level == HealthLevel.UNHEALTHY ? WarningSeverity.CRITICAL : WarningSeverity.WARN,
                String.format("Generation worker is %s: errorRate=%.1f%%, activeJobs=%d, staleJobs=%d, lastError=%s",
                    level, event.health().errorRate(), event.health().activeJobs(),
                    event.metrics().queueHealth().stale(), event.health().lastError()),
                SOURCE
            );
        } else if (level != lastReportedHealth) {
            LOG.infof("Generation worker recovered, health is %s", level);
        }
        lastReportedHealth = level;
    }

    void onUncaughtError(WorkerEvent.UncaughtError event) {
        warningService.addWarning(
            WarningCategory.PROCESSING,
            WarningSeverity.ERROR,
            String.format("Uncaught error in %s: %s", event.source(), event.error()),
            SOURCE
        );
    }

    void onJobFailed(WorkerEvent.JobFailed event) {
        if ("CIRCUIT_BREAKER_OPEN".equals(event.error().code())) {
            warningService.addWarning(
                WarningCategory.PROCESSING,
                WarningSeverity.WARN,
                String.format("Job %s failed because the provider circuit breaker is open", event.jobId()),
                SOURCE
            );
        }
    }
}
