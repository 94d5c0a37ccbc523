package tech.queuekit.queue;

/**
 * Base exception for QueueKit errors.
 */
public class QueueKitException extends RuntimeException {

    public QueueKitException(String message) {
        super(message);
    }

    public QueueKitException(String message, Throwable cause) {
        super(message, cause);
    }
}
