package tech.charforge.queue.model;

import java.time.Instant;
import java.util.Map;

/**
 * Request to enqueue a new job.
 *
 * @param userId      owner of the job
 * @param type        job type
 * @param priority    dequeue priority, NORMAL when null
 * @param payload     request body as a JSON-compatible map
 * @param scheduledAt optional time before which the job must not run
 */
public record NewGenerationJob(
    String userId,
    JobType type,
    JobPriority priority,
    Map<String, Object> payload,
    Instant scheduledAt
) {

    public NewGenerationJob {
        priority = priority == null ? JobPriority.NORMAL : priority;
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static NewGenerationJob of(String userId, JobType type, Map<String, Object> payload) {
        return new NewGenerationJob(userId, type, JobPriority.NORMAL, payload, null);
    }
}
