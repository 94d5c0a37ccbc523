package tech.queuekit.runtime.registry;

import tech.queuekit.queue.ReceivedMessage;

import java.util.List;

/**
 * Handles every message of one poll in a single call. The batch succeeds or fails as a whole.
 */
@FunctionalInterface
public interface BatchMessageHandler {

    void handleMessageBatch(List<ReceivedMessage> messages) throws Exception;
}
