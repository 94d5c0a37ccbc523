package tech.queuekit.runtime.exception;

/**
 * Thrown when an operation names a queue that was never registered.
 */
public class UnknownQueueException extends ConfigurationException {

    private final String queueName;

    public UnknownQueueException(String message, String queueName) {
        super(message);
        this.queueName = queueName;
    }

    public static UnknownQueueException noHandler(String queueName) {
        return new UnknownQueueException("No message handler registered for queue [" + queueName + "]", queueName);
    }

    public static UnknownQueueException noProducer(String queueName) {
        return new UnknownQueueException("Producer does not exist: " + queueName, queueName);
    }

    public static UnknownQueueException noQueue(String queueName) {
        return new UnknownQueueException("Queue does not exist: " + queueName, queueName);
    }

    public String getQueueName() {
        return queueName;
    }
}
