package tech.queuekit.runtime.exception;

/**
 * Thrown when a second message handler is registered for a queue.
 */
public class DuplicateHandlerException extends ConfigurationException {

    private final String queueName;

    public DuplicateHandlerException(String queueName) {
        super("A message handler is already registered for queue [" + queueName + "]");
        this.queueName = queueName;
    }

    public String getQueueName() {
        return queueName;
    }
}
