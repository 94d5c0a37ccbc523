package tech.queuekit.queue;

import java.util.Map;
import java.util.Optional;

/**
 * A message received from a queue.
 *
 * <p>The receipt handle identifies this particular receive; it is what
 * {@link QueueClient#deleteMessage} and {@link QueueClient#changeMessageVisibility}
 * need. Handlers get the message for the duration of one dispatch only.
 *
 * @param messageId Queue-assigned message id
 * @param body Raw message body
 * @param receiptHandle Token for acknowledging this receive
 * @param attributes System attributes (ApproximateReceiveCount, SentTimestamp, ...)
 * @param messageAttributes User message attributes requested by name
 */
public record ReceivedMessage(
    String messageId,
    String body,
    String receiptHandle,
    Map<String, String> attributes,
    Map<String, String> messageAttributes
) {
    public ReceivedMessage {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        messageAttributes = messageAttributes == null ? Map.of() : Map.copyOf(messageAttributes);
    }

    public Optional<String> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public Optional<String> messageAttribute(String name) {
        return Optional.ofNullable(messageAttributes.get(name));
    }

    /**
     * How many times the queue has handed this message out, 1 on first delivery.
     */
    public int receiveCount() {
        return attribute(QueueAttributes.APPROXIMATE_RECEIVE_COUNT).map(Integer::parseInt).orElse(1);
    }
}
