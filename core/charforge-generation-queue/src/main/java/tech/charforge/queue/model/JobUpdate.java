package tech.charforge.queue.model;

import java.time.Instant;

/**
 * Partial update applied to a job. Null fields are left untouched.
 *
 * @param status         new status, or null to keep the current one
 * @param error          error to record, or null to keep the current one
 * @param result         result to record, or null to keep the current one
 * @param nextEligibleAt earliest time a PENDING job may be handed out again
 */
public record JobUpdate(
    JobStatus status,
    JobError error,
    JobResult result,
    Instant nextEligibleAt
) {

    public static JobUpdate processing() {
        return new JobUpdate(JobStatus.PROCESSING, null, null, null);
    }

    public static JobUpdate completed(JobResult result) {
        return new JobUpdate(JobStatus.COMPLETED, null, result, null);
    }

    public static JobUpdate retry(JobError error, Instant nextEligibleAt) {
        return new JobUpdate(JobStatus.PENDING, error, null, nextEligibleAt);
    }

    public static JobUpdate failed(JobError error) {
        return new JobUpdate(JobStatus.FAILED, error, null, null);
    }

    public static JobUpdate cancelled() {
        return new JobUpdate(JobStatus.CANCELLED, null, null, null);
    }
}
