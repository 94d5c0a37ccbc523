package tech.queuekit.runtime.metrics;

/**
 * Per-queue consumer counters.
 */
public interface QueueMetricsService {

    /**
     * Record a message received from a queue.
     */
    void recordMessageReceived(String queueName);

    /**
     * Record a message that was processed, successfully or not.
     */
    void recordMessageProcessed(String queueName, boolean success);

    /**
     * Record a failed poll.
     */
    void recordPollError(String queueName);
}
