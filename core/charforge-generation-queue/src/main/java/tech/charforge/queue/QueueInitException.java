package tech.charforge.queue;

/**
 * Thrown when the backing store cannot be reached during initialization.
 */
public class QueueInitException extends QueueException {

    public QueueInitException(String message) {
        super(message);
    }

    public QueueInitException(String message, Throwable cause) {
        super(message, cause);
    }
}
