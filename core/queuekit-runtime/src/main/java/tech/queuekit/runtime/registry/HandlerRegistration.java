package tech.queuekit.runtime.registry;

/**
 * The message handler bound to a queue. Exactly one of the two handlers is set.
 */
public record HandlerRegistration(
    String queueName,
    MessageHandler messageHandler,
    BatchMessageHandler batchHandler
) {
    public static HandlerRegistration single(String queueName, MessageHandler handler) {
        return new HandlerRegistration(queueName, handler, null);
    }

    public static HandlerRegistration batch(String queueName, BatchMessageHandler handler) {
        return new HandlerRegistration(queueName, null, handler);
    }

    public boolean isBatch() {
        return batchHandler != null;
    }
}
