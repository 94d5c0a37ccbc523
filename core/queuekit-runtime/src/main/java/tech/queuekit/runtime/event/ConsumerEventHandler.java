package tech.queuekit.runtime.event;

/**
 * Listener for consumer lifecycle events. Called on the consumer thread;
 * exceptions are logged and do not affect the loop.
 */
@FunctionalInterface
public interface ConsumerEventHandler {

    void handle(ConsumerEvent event);
}
