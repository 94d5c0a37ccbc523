package tech.queuekit.runtime.model;

import java.util.Map;

/**
 * A message to send through the producer.
 *
 * <p>A {@link String} body is sent as-is; anything else is written as JSON.
 *
 * @param id Caller-assigned id, required
 * @param body Payload, required
 * @param delaySeconds Seconds before the message becomes visible, 0..900
 * @param groupId Message group, required for FIFO queues
 * @param deduplicationId Deduplication id, required for FIFO queues without content-based deduplication
 * @param messageAttributes String message attributes
 */
public record OutboundMessage<T>(
    String id,
    T body,
    int delaySeconds,
    String groupId,
    String deduplicationId,
    Map<String, String> messageAttributes
) {
    public OutboundMessage {
        messageAttributes = messageAttributes == null ? Map.of() : Map.copyOf(messageAttributes);
    }

    public static <T> OutboundMessage<T> of(String id, T body) {
        return new OutboundMessage<>(id, body, 0, null, null, Map.of());
    }

    public static <T> OutboundMessage<T> fifo(String id, T body, String groupId, String deduplicationId) {
        return new OutboundMessage<>(id, body, 0, groupId, deduplicationId, Map.of());
    }

    public OutboundMessage<T> withDelay(int seconds) {
        return new OutboundMessage<>(id, body, seconds, groupId, deduplicationId, messageAttributes);
    }

    public OutboundMessage<T> withAttributes(Map<String, String> attributes) {
        return new OutboundMessage<>(id, body, delaySeconds, groupId, deduplicationId, attributes);
    }
}
