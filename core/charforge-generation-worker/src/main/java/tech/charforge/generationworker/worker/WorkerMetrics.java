package tech.charforge.generationworker.worker;

import java.time.Instant;

public record WorkerMetrics(
    long processed,
    long successful,
    long failed,
    long retried,
    double averageProcessingTimeMs,
    long uptimeSeconds,
    double currentLoad,
    Instant lastProcessedAt,
    QueueHealth queueHealth
) {

    /**
     * @param pending    jobs waiting in the queue
     * @param processing jobs in PROCESSING according to the queue
     * @param stale      active jobs running longer than the stale threshold
     */
    public record QueueHealth(long pending, long processing, int stale) {
    }
}
