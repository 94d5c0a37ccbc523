package tech.queuekit.runtime.exception;

import tech.queuekit.queue.TransportException;

/**
 * Thrown when sending to a queue fails in the transport. Not retried;
 * the caller decides whether to send again.
 */
public class SendException extends TransportException {

    private final String queueName;

    public SendException(String queueName, TransportException cause) {
        super("Failed to send to queue [" + queueName + "]: " + cause.getMessage(),
            cause.getErrorCode(), cause.isAuthenticationFailure(), cause);
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
