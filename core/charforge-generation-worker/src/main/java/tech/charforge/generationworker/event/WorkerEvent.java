package tech.charforge.generationworker.event;

import tech.charforge.generationworker.worker.WorkerHealth;
import tech.charforge.generationworker.worker.WorkerMetrics;
import tech.charforge.queue.model.GenerationJob;
import tech.charforge.queue.model.JobError;
import tech.charforge.queue.model.JobResult;

import java.time.Instant;

/**
 * Lifecycle notifications published by the queue worker.
 */
public sealed interface WorkerEvent {

    Instant timestamp();

    record WorkerStarted(Instant timestamp) implements WorkerEvent {
    }

    record WorkerStopped(boolean forced, int abandonedJobs, Instant timestamp) implements WorkerEvent {
    }

    record JobStarted(String jobId, GenerationJob job, Instant timestamp) implements WorkerEvent {
    }

    record JobCompleted(String jobId, GenerationJob job, JobResult result, long processingTimeMs,
                        Instant timestamp) implements WorkerEvent {
    }

    record JobRetried(String jobId, GenerationJob job, JobError error, int retryCount, Instant nextEligibleAt,
                      Instant timestamp) implements WorkerEvent {
    }

    record JobFailed(String jobId, GenerationJob job, JobError error, Throwable cause,
                     Instant timestamp) implements WorkerEvent {
    }

    record HealthCheck(WorkerHealth health, WorkerMetrics metrics, Instant timestamp) implements WorkerEvent {
    }

    /**
     * A scheduler tick or worker thread failed outside any job.
     */
    record UncaughtError(String source, Throwable error, Instant timestamp) implements WorkerEvent {
    }

    /**
     * A job task failed while recording its own outcome.
     */
    record UnhandledRejection(String jobId, Throwable reason, Instant timestamp) implements WorkerEvent {
    }
}
