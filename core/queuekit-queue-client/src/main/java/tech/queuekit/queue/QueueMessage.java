package tech.queuekit.queue;

import java.util.Map;

/**
 * A serialized message to be sent to a queue.
 *
 * @param messageId Caller-assigned identifier (used as the batch entry id)
 * @param body Message body content (typically JSON)
 * @param delaySeconds Seconds before the message becomes visible
 * @param messageGroupId Message group ID for FIFO ordering (required for FIFO queues)
 * @param deduplicationId Deduplication ID to prevent duplicate messages
 * @param messageAttributes String message attributes
 */
public record QueueMessage(
    String messageId,
    String body,
    int delaySeconds,
    String messageGroupId,
    String deduplicationId,
    Map<String, String> messageAttributes
) {
    public QueueMessage {
        messageAttributes = messageAttributes == null ? Map.of() : Map.copyOf(messageAttributes);
    }

    /**
     * Create a message with no message group (for standard queues).
     */
    public static QueueMessage standard(String messageId, String body) {
        return new QueueMessage(messageId, body, 0, null, null, Map.of());
    }

    /**
     * Create a FIFO message that uses its id as the deduplication ID.
     */
    public static QueueMessage of(String messageId, String messageGroupId, String body) {
        return new QueueMessage(messageId, body, 0, messageGroupId, messageId, Map.of());
    }
}
