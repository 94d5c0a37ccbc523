package tech.queuekit.runtime.exception;

import tech.queuekit.queue.QueueKitException;

/**
 * Thrown when an outbound message cannot be sent as given: missing id or body,
 * out-of-range delay, missing FIFO fields, or a body Jackson cannot serialize.
 */
public class InvalidMessageException extends QueueKitException {

    public InvalidMessageException(String message) {
        super(message);
    }

    public InvalidMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
