package tech.charforge.queue.model;

/**
 * Point-in-time aggregate over the job store.
 *
 * @param pending                 PENDING plus QUEUED jobs
 * @param processing              jobs currently PROCESSING
 * @param completed               COMPLETED jobs
 * @param failed                  FAILED plus CANCELLED jobs
 * @param averageWaitTimeMs       mean time from creation to processing start
 * @param averageProcessingTimeMs mean time from processing start to completion
 * @param throughputPerHour       jobs completed during the last hour
 */
public record QueueMetrics(
    long pending,
    long processing,
    long completed,
    long failed,
    long averageWaitTimeMs,
    long averageProcessingTimeMs,
    long throughputPerHour
) {

    public static QueueMetrics empty() {
        return new QueueMetrics(0, 0, 0, 0, 0, 0, 0);
    }

    public long total() {
        return pending + processing + completed + failed;
    }
}
