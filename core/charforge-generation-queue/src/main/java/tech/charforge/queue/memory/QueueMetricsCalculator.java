package tech.charforge.queue.memory;

import tech.charforge.queue.model.GenerationJob;
import tech.charforge.queue.model.JobStatus;
import tech.charforge.queue.model.QueueMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;

/**
 * Folds a job collection into {@link QueueMetrics}.
 */
final class QueueMetricsCalculator {

    private QueueMetricsCalculator() {
    }

    static QueueMetrics calculate(Collection<GenerationJob> jobs, Instant now) {
        long pending = 0;
        long processing = 0;
        long completed = 0;
        long failed = 0;
        long waitTotal = 0;
        long waitCount = 0;
        long processingTotal = 0;
        long processingCount = 0;
        long completedLastHour = 0;
        Instant hourAgo = now.minus(Duration.ofHours(1));

        for (GenerationJob job : jobs) {
            switch (job.status()) {
                case PENDING, QUEUED -> pending++;
                case PROCESSING -> processing++;
                case COMPLETED -> completed++;
                case FAILED, CANCELLED -> failed++;
            }

            if (job.startedAt() != null) {
                waitTotal += Duration.between(job.createdAt(), job.startedAt()).toMillis();
                waitCount++;
            }
            if (job.startedAt() != null && job.completedAt() != null) {
                processingTotal += Duration.between(job.startedAt(), job.completedAt()).toMillis();
                processingCount++;
            }
            if (job.completedAt() != null && job.completedAt().isAfter(hourAgo)
                    && job.status() == JobStatus.COMPLETED) {
                completedLastHour++;
            }
        }

        return new QueueMetrics(
            pending,
            processing,
            completed,
            failed,
            waitCount > 0 ? waitTotal / waitCount : 0,
            processingCount > 0 ? processingTotal / processingCount : 0,
            completedLastHour
        );
    }
}
