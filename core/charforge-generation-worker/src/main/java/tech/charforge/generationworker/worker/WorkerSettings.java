package tech.charforge.generationworker.worker;

/**
 * Tuning for {@link QueueWorker}.
 *
 * @param concurrency           jobs processed at the same time
 * @param pollIntervalMs        delay between the end of one poll and the start of the next
 * @param maxRetries            attempts a job gets before it is failed for good
 * @param retryDelayMs          minimum wait before a failed job is picked up again
 * @param healthCheckIntervalMs period of the health loop
 * @param staleJobThresholdMs   processing time after which an active job counts as stale
 * @param shutdownTimeoutMs     how long {@code stop()} waits for active jobs
 * @param degradedErrorRate     error rate percentage above which health is DEGRADED
 * @param unhealthyErrorRate    error rate percentage above which health is UNHEALTHY
 */
public record WorkerSettings(
    int concurrency,
    long pollIntervalMs,
    int maxRetries,
    long retryDelayMs,
    long healthCheckIntervalMs,
    long staleJobThresholdMs,
    long shutdownTimeoutMs,
    double degradedErrorRate,
    double unhealthyErrorRate
) {

    public WorkerSettings {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, was " + concurrency);
        }
        if (pollIntervalMs < 1 || healthCheckIntervalMs < 1) {
            throw new IllegalArgumentException("poll and health check intervals must be positive");
        }
    }

    public static WorkerSettings defaults() {
        return new WorkerSettings(4, 5000, 3, 10000, 30000, 300000, 30000, 20, 50);
    }
}
