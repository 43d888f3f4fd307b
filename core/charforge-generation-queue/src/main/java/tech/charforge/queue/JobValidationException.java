package tech.charforge.queue;

/**
 * Thrown when an enqueue request is rejected.
 */
public class JobValidationException extends QueueException {

    public JobValidationException(String message) {
        super(message);
    }
}
