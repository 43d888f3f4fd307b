package tech.charforge.generationworker.maintenance;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.charforge.generationworker.config.GenerationQueueConfig;
import tech.charforge.generationworker.warning.WarningCategory;
import tech.charforge.generationworker.warning.WarningService;
import tech.charforge.generationworker.warning.WarningSeverity;
import tech.charforge.generationworker.worker.QueueWorker;
import tech.charforge.queue.GenerationQueueService;

/**
 * Periodic queue housekeeping: fails jobs stuck in PROCESSING and deletes
 * old terminal jobs. Runs only while the worker owns the queue.
 */
@ApplicationScoped
public class QueueMaintenanceScheduler {

    private static final Logger LOG = Logger.getLogger(QueueMaintenanceScheduler.class);

    @Inject
    GenerationQueueConfig config;

    @Inject
    GenerationQueueService queueService;

    @Inject
    QueueWorker worker;

    @Inject
    WarningService warningService;

    @Scheduled(every = "${generation-queue.stale-check-interval:5m}", identity = "generation-queue-stale-check",
        concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void failStaleJobs() {
        if (!worker.isRunning()) {
            return;
        }

        try {
            int failed = queueService.processStaleJobs(config.staleJobThreshold());
            if (failed > 0) {
                LOG.warnf("Marked %d stale jobs as failed (threshold %s)", failed, config.staleJobThreshold());
                warningService.addWarning(
                    WarningCategory.PROCESSING,
                    WarningSeverity.WARN,
                    String.format("%d generation jobs timed out in PROCESSING after %d minutes",
                        failed, config.staleJobThreshold().toMinutes()),
                    "QueueMaintenanceScheduler"
                );
            }
        } catch (Exception e) {
            LOG.errorf(e, "Error processing stale generation jobs");
        }
    }

    @Scheduled(every = "${generation-queue.cleanup-interval:1h}", identity = "generation-queue-cleanup",
        concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void cleanupOldJobs() {
        if (!worker.isRunning()) {
            return;
        }

        try {
            int deleted = queueService.cleanup(config.retention());
            if (deleted > 0) {
                LOG.infof("Deleted %d terminal jobs older than %s", deleted, config.retention());
            }
        } catch (Exception e) {
            LOG.errorf(e, "Error cleaning up generation jobs");
        }
    }
}
