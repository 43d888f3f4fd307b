package tech.charforge.generationworker.worker;

/**
 * Point-in-time snapshot returned by {@link QueueWorker#getStatus()}.
 */
public record WorkerStatus(
    boolean running,
    WorkerState state,
    int activeJobs,
    WorkerMetrics metrics,
    WorkerHealth health
) {
}
