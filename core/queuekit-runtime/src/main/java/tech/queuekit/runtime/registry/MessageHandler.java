package tech.queuekit.runtime.registry;

import tech.queuekit.queue.ReceivedMessage;

/**
 * Handles one message. Returning normally deletes the message;
 * throwing leaves it on the queue for redelivery.
 */
@FunctionalInterface
public interface MessageHandler {

    void handleMessage(ReceivedMessage message) throws Exception;
}
