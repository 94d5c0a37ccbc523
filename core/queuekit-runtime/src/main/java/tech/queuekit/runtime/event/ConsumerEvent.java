package tech.queuekit.runtime.event;

import tech.queuekit.queue.ReceivedMessage;
import tech.queuekit.runtime.exception.MessageHandlerException;

import java.util.List;
import java.util.Optional;

/**
 * Sealed interface representing the lifecycle events of a consumer loop.
 *
 * <ul>
 *   <li>{@link MessageReceived} - before dispatch</li>
 *   <li>{@link MessageProcessed} - handler succeeded, message deleted</li>
 *   <li>{@link ProcessingError} - handler failed, message left for redelivery</li>
 *   <li>{@link ConsumerError} - transport failure while polling, deleting or changing visibility</li>
 *   <li>{@link Empty} - poll returned nothing</li>
 *   <li>{@link ResponseProcessed} - all messages of one poll handled</li>
 *   <li>{@link Stopped} - loop exited</li>
 * </ul>
 */
public sealed interface ConsumerEvent permits
    ConsumerEvent.MessageReceived,
    ConsumerEvent.MessageProcessed,
    ConsumerEvent.ProcessingError,
    ConsumerEvent.ConsumerError,
    ConsumerEvent.Empty,
    ConsumerEvent.ResponseProcessed,
    ConsumerEvent.Stopped {

    /**
     * Name of the queue whose loop emitted the event.
     */
    String queueName();

    EventKind kind();

    record MessageReceived(String queueName, ReceivedMessage message) implements ConsumerEvent {
        @Override
        public EventKind kind() {
            return EventKind.MESSAGE_RECEIVED;
        }
    }

    record MessageProcessed(String queueName, ReceivedMessage message) implements ConsumerEvent {
        @Override
        public EventKind kind() {
            return EventKind.MESSAGE_PROCESSED;
        }
    }

    /**
     * @param error wraps what the handler threw; its message contains the original message
     * @param message the message that was not deleted
     */
    record ProcessingError(String queueName, MessageHandlerException error, ReceivedMessage message)
        implements ConsumerEvent {
        @Override
        public EventKind kind() {
            return EventKind.PROCESSING_ERROR;
        }
    }

    /**
     * @param error the transport failure, or what ended the loop unexpectedly
     * @param message the message being deleted or released, null for poll failures
     */
    record ConsumerError(String queueName, Throwable error, ReceivedMessage message) implements ConsumerEvent {
        @Override
        public EventKind kind() {
            return EventKind.ERROR;
        }

        public Optional<ReceivedMessage> optionalMessage() {
            return Optional.ofNullable(message);
        }
    }

    record Empty(String queueName) implements ConsumerEvent {
        @Override
        public EventKind kind() {
            return EventKind.EMPTY;
        }
    }

    record ResponseProcessed(String queueName, List<ReceivedMessage> messages) implements ConsumerEvent {
        public ResponseProcessed {
            messages = List.copyOf(messages);
        }

        @Override
        public EventKind kind() {
            return EventKind.RESPONSE_PROCESSED;
        }
    }

    record Stopped(String queueName) implements ConsumerEvent {
        @Override
        public EventKind kind() {
            return EventKind.STOPPED;
        }
    }
}
