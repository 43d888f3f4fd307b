package tech.charforge.queue.model;

/**
 * Lifecycle status of a generation job.
 *
 * <p>QUEUED jobs are scheduled for a future time and become PENDING once due.
 * COMPLETED, FAILED and CANCELLED are terminal.
 */
public enum JobStatus {
    PENDING,
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isCancellable() {
        return this == PENDING || this == QUEUED;
    }
}
