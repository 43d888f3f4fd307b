package tech.charforge.queue.model;

import java.time.Instant;
import java.util.Map;

/**
 * A unit of image generation work and its lifecycle state.
 *
 * <p>Jobs are immutable snapshots. Stores produce a new snapshot for every
 * update through {@link #apply(JobUpdate, Instant)}.
 */
public record GenerationJob(
    String id,
    String userId,
    JobType type,
    JobStatus status,
    JobPriority priority,
    Map<String, Object> payload,
    JobError error,
    JobResult result,
    Instant createdAt,
    Instant updatedAt,
    Instant scheduledAt,
    Instant nextEligibleAt,
    Instant startedAt,
    Instant completedAt
) {

    public GenerationJob {
        payload = payload == null ? Map.of() : payload;
        priority = priority == null ? JobPriority.NORMAL : priority;
    }

    /**
     * Number of failed attempts recorded so far.
     */
    public int retryCount() {
        return error == null ? 0 : error.retryCount();
    }

    /**
     * Whether the job may be handed to a worker at the given instant.
     */
    public boolean isEligibleAt(Instant now) {
        return status == JobStatus.PENDING
            && (nextEligibleAt == null || !nextEligibleAt.isAfter(now));
    }

    /**
     * Whether a QUEUED job has reached its scheduled time.
     */
    public boolean isDueAt(Instant now) {
        return status == JobStatus.QUEUED
            && (scheduledAt == null || !scheduledAt.isAfter(now));
    }

    /**
     * Returns a copy with the update applied. Status transitions maintain
     * {@code startedAt} and {@code completedAt}; {@code updatedAt} is always refreshed.
     */
    public GenerationJob apply(JobUpdate update, Instant now) {
        JobStatus newStatus = update.status() != null ? update.status() : status;
        Instant newStartedAt = startedAt;
        Instant newCompletedAt = completedAt;
        Instant newNextEligibleAt = update.nextEligibleAt() != null ? update.nextEligibleAt() : nextEligibleAt;

        if (update.status() != null && update.status() != status) {
            switch (newStatus) {
                case PROCESSING -> newStartedAt = now;
                case PENDING -> newStartedAt = null;
                case COMPLETED, FAILED, CANCELLED -> newCompletedAt = now;
                default -> {
                    // QUEUED carries no timestamps of its own
                }
            }
        }

        return new GenerationJob(
            id,
            userId,
            type,
            newStatus,
            priority,
            payload,
            update.error() != null ? update.error() : error,
            update.result() != null ? update.result() : result,
            createdAt,
            now,
            scheduledAt,
            newNextEligibleAt,
            newStartedAt,
            newCompletedAt
        );
    }

    /**
     * Returns a copy with the given status, used for QUEUED to PENDING promotion.
     */
    public GenerationJob withStatus(JobStatus newStatus, Instant now) {
        return new GenerationJob(id, userId, type, newStatus, priority, payload, error, result,
            createdAt, now, scheduledAt, nextEligibleAt, startedAt, completedAt);
    }
}
