package tech.charforge.queue;

/**
 * Limits enforced by queue stores on enqueue.
 *
 * @param maxQueueSize maximum number of PENDING plus QUEUED jobs
 * @param maxBatchSize maximum number of requests in a BATCH job
 */
public record QueueSettings(int maxQueueSize, int maxBatchSize) {

    public static final int DEFAULT_MAX_QUEUE_SIZE = 100;
    public static final int DEFAULT_MAX_BATCH_SIZE = 4;

    public QueueSettings {
        if (maxQueueSize <= 0) {
            throw new IllegalArgumentException("maxQueueSize must be positive");
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be positive");
        }
    }

    public static QueueSettings defaults() {
        return new QueueSettings(DEFAULT_MAX_QUEUE_SIZE, DEFAULT_MAX_BATCH_SIZE);
    }
}
