package tech.charforge.queue;

import tech.charforge.queue.model.GenerationJob;
import tech.charforge.queue.model.JobQuery;
import tech.charforge.queue.model.JobUpdate;
import tech.charforge.queue.model.NewGenerationJob;
import tech.charforge.queue.model.QueueMetrics;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable collection of generation jobs.
 *
 * <p>The queue knows nothing about how jobs are executed. A worker pulls
 * eligible jobs with {@link #getNextJobs(int)}, takes ownership of each one
 * with {@link #claimJob(String)} and drives it through the rest of its
 * lifecycle with {@link #updateJob(String, JobUpdate)}.
 *
 * <p>{@code getNextJobs} does not claim jobs. Two workers may see the same
 * candidate; only one of them wins the claim.
 */
public interface GenerationQueueService {

    /**
     * Connect to the backing store. Safe to call more than once.
     *
     * @throws QueueInitException if the store is unreachable
     */
    void initialize();

    /**
     * Validate and store a new job. Jobs scheduled in the future are stored
     * as QUEUED, all others as PENDING.
     *
     * @throws JobValidationException if the request is invalid or the queue is full
     */
    GenerationJob enqueue(NewGenerationJob request);

    Optional<GenerationJob> getJob(String id);

    /**
     * Up to {@code limit} PENDING jobs that are eligible now, highest priority
     * first, oldest first within a priority. Due QUEUED jobs are promoted to
     * PENDING before selection.
     */
    List<GenerationJob> getNextJobs(int limit);

    /**
     * Move a PENDING job to PROCESSING as a single compare-and-set.
     *
     * @return the claimed job, or empty if the job does not exist or is no
     *         longer PENDING, for example because another worker claimed it
     */
    Optional<GenerationJob> claimJob(String id);

    /**
     * Apply a partial update.
     *
     * @return the updated job, or empty if the job no longer exists. A status
     *         change out of a terminal state is refused and the unchanged job is returned.
     */
    Optional<GenerationJob> updateJob(String id, JobUpdate update);

    /**
     * Cancel a PENDING or QUEUED job owned by {@code userId}.
     *
     * @return the cancelled job, or empty if it does not exist
     * @throws JobCancellationException if the job is not cancellable or not owned by the user
     */
    Optional<GenerationJob> cancelJob(String id, String userId);

    /**
     * Jobs owned by a user, newest first.
     */
    List<GenerationJob> getUserJobs(String userId, JobQuery query);

    QueueMetrics getMetrics();

    /**
     * Fail PROCESSING jobs that started more than {@code threshold} ago.
     *
     * @return number of jobs marked as failed
     */
    int processStaleJobs(Duration threshold);

    /**
     * Delete terminal jobs not updated within {@code olderThan}.
     *
     * @return number of jobs deleted
     */
    int cleanup(Duration olderThan);

    /**
     * Release store resources. Safe to call more than once.
     */
    void shutdown();
}
