package tech.queuekit.queue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Narrow contract to a queue service, addressed by queue URL.
 * Implementations support different queue types (SQS, embedded).
 *
 * <p>Every operation fails with {@link TransportException}.
 */
public interface QueueClient {

    /**
     * Receive up to {@code maxMessages} messages, waiting up to {@code waitTimeSeconds}
     * for at least one to become available (long polling).
     *
     * @param messageAttributeNames user message attributes to fetch; {@code All} fetches every one
     * @return received messages, empty when the wait expired
     */
    List<ReceivedMessage> receiveMessages(String queueUrl, int maxMessages, int waitTimeSeconds,
                                          Collection<String> messageAttributeNames);

    /**
     * Delete a received message (ACK).
     */
    void deleteMessage(String queueUrl, String receiptHandle);

    /**
     * Change how long a received message stays hidden. Zero makes it visible immediately.
     */
    void changeMessageVisibility(String queueUrl, String receiptHandle, int timeoutSeconds);

    /**
     * Send a single message.
     *
     * @return queue-assigned message id
     */
    String sendMessage(String queueUrl, QueueMessage message);

    /**
     * Send several messages. The default sends them one by one.
     *
     * @return queue-assigned message ids, in input order
     */
    default List<String> sendMessageBatch(String queueUrl, List<QueueMessage> messages) {
        List<String> ids = new ArrayList<>(messages.size());
        for (QueueMessage message : messages) {
            ids.add(sendMessage(queueUrl, message));
        }
        return ids;
    }

    /**
     * Remove every message from the queue. Purging an empty queue is not an error.
     */
    void purgeQueue(String queueUrl);

    /**
     * Read queue attributes such as {@link QueueAttributes#APPROXIMATE_NUMBER_OF_MESSAGES}.
     */
    Map<String, String> getQueueAttributes(String queueUrl, Collection<String> attributeNames);

    /**
     * Get the queue type this client talks to.
     */
    QueueType getQueueType();

    /**
     * Close any connections. Called on shutdown.
     */
    default void close() {
        // Default no-op for implementations that don't need cleanup
    }
}
