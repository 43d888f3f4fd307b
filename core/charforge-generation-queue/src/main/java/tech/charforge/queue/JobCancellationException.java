package tech.charforge.queue;

/**
 * Thrown when a job cannot be cancelled by the caller.
 */
public class JobCancellationException extends QueueException {

    public enum Reason {
        NOT_CANCELLABLE,
        UNAUTHORIZED
    }

    private final Reason reason;

    public JobCancellationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static JobCancellationException notCancellable() {
        return new JobCancellationException(Reason.NOT_CANCELLABLE, "Job cannot be cancelled in its current state");
    }

    public static JobCancellationException unauthorized() {
        return new JobCancellationException(Reason.UNAUTHORIZED, "Unauthorized to cancel this job");
    }

    public Reason reason() {
        return reason;
    }
}
