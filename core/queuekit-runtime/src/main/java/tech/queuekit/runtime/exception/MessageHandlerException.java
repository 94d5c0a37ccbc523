package tech.queuekit.runtime.exception;

import tech.queuekit.queue.QueueKitException;

/**
 * Wraps an exception thrown by a message handler.
 *
 * <p>Never escapes a consumer loop; it is delivered to {@code processing_error}
 * listeners together with the message that failed.
 */
public class MessageHandlerException extends QueueKitException {

    public MessageHandlerException(Throwable cause) {
        super("Unexpected message handler failure: " + cause.getMessage(), cause);
    }
}
