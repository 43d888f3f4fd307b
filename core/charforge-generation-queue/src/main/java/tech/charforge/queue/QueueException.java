package tech.charforge.queue;

/**
 * Base exception for generation queue failures.
 */
public class QueueException extends RuntimeException {

    public QueueException(String message) {
        super(message);
    }

    public QueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
