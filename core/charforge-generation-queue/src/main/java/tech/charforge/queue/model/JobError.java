package tech.charforge.queue.model;

import java.time.Instant;

/**
 * Error recorded on a job after a failed attempt.
 *
 * @param code        classification tag (e.g. NETWORK_ERROR, RATE_LIMITED, TIMEOUT)
 * @param message     human readable description
 * @param retryable   whether the job was returned to the queue for another attempt
 * @param retryCount  number of failed attempts so far, never decreases
 * @param lastRetryAt when the most recent failed attempt was recorded, may be null
 */
public record JobError(
    String code,
    String message,
    boolean retryable,
    int retryCount,
    Instant lastRetryAt
) {

    public static JobError retryable(String code, String message, int retryCount, Instant at) {
        return new JobError(code, message, true, retryCount, at);
    }

    public static JobError permanent(String code, String message, int retryCount, Instant at) {
        return new JobError(code, message, false, retryCount, at);
    }
}
