package tech.queuekit.runtime.registry;

import org.jboss.logging.Logger;
import tech.queuekit.runtime.event.ConsumerEventHandler;
import tech.queuekit.runtime.event.EventKind;
import tech.queuekit.runtime.exception.DuplicateHandlerException;
import tech.queuekit.runtime.exception.UnknownQueueException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Maps queue names to their message handler and event listeners.
 *
 * <p>Each queue has at most one message handler, single or batch, and any number
 * of listeners per {@link EventKind}, kept in registration order. Once frozen
 * the registry is read-only and safe to read from every consumer thread.
 */
public class HandlerRegistry {

    private static final Logger LOG = Logger.getLogger(HandlerRegistry.class);

    private final Map<String, HandlerRegistration> handlers = new ConcurrentHashMap<>();
    private final Map<String, Map<EventKind, List<ConsumerEventHandler>>> eventHandlers = new ConcurrentHashMap<>();
    private volatile boolean frozen;

    public void register(String queueName, MessageHandler handler) {
        Objects.requireNonNull(handler, "handler");
        bind(HandlerRegistration.single(queueName, handler));
    }

    public void registerBatch(String queueName, BatchMessageHandler handler) {
        Objects.requireNonNull(handler, "handler");
        bind(HandlerRegistration.batch(queueName, handler));
    }

    /**
     * Add a listener for one kind of event on a queue. Listeners of the same key
     * run in the order they were added.
     */
    public void registerEvent(String queueName, EventKind kind, ConsumerEventHandler handler) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(handler, "handler");
        checkNotFrozen();
        eventHandlers
            .computeIfAbsent(queueName, name -> new ConcurrentHashMap<>())
            .computeIfAbsent(kind, k -> new CopyOnWriteArrayList<>())
            .add(handler);
        LOG.debugf("Registered [%s] listener for queue [%s]", kind.wireName(), queueName);
    }

    public HandlerRegistration lookup(String queueName) {
        HandlerRegistration registration = handlers.get(queueName);
        if (registration == null) {
            throw UnknownQueueException.noHandler(queueName);
        }
        return registration;
    }

    public boolean has(String queueName) {
        return handlers.containsKey(queueName);
    }

    /**
     * Snapshot of the listeners for a queue and event kind, empty when there are none.
     */
    public List<ConsumerEventHandler> eventHandlers(String queueName, EventKind kind) {
        Map<EventKind, List<ConsumerEventHandler>> byKind = eventHandlers.get(queueName);
        if (byKind == null) {
            return List.of();
        }
        List<ConsumerEventHandler> listeners = byKind.get(kind);
        return listeners == null ? List.of() : List.copyOf(listeners);
    }

    /**
     * Make the registry read-only. Further registrations fail.
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void bind(HandlerRegistration registration) {
        checkNotFrozen();
        if (registration.queueName() == null || registration.queueName().isBlank()) {
            throw new IllegalArgumentException("Queue name is required");
        }
        if (handlers.putIfAbsent(registration.queueName(), registration) != null) {
            throw new DuplicateHandlerException(registration.queueName());
        }
        LOG.debugf("Registered %s handler for queue [%s]",
            registration.isBatch() ? "batch" : "message", registration.queueName());
    }

    private void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Handler registry is frozen; register handlers before starting the runtime");
        }
    }
}
