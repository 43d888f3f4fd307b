package tech.charforge.generationworker.worker;

import java.time.Instant;

/**
 * Health verdict of the worker.
 *
 * @param status     overall level
 * @param activeJobs jobs currently processing
 * @param queueSize  jobs waiting in the queue at the last refresh
 * @param errorRate  failed over processed, in percent
 * @param lastError  message of the most recent job failure, may be null
 * @param lastErrorAt when it happened, may be null
 */
public record WorkerHealth(
    HealthLevel status,
    int activeJobs,
    long queueSize,
    double errorRate,
    String lastError,
    Instant lastErrorAt
) {
}
