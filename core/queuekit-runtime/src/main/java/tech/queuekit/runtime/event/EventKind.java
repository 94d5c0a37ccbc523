package tech.queuekit.runtime.event;

import java.util.Arrays;

/**
 * Lifecycle events emitted by a consumer loop. Listeners subscribe per queue and kind.
 */
public enum EventKind {
    /** A message was received and is about to be handed to the handler. */
    MESSAGE_RECEIVED("message_received"),
    /** The handler succeeded and the message was deleted. */
    MESSAGE_PROCESSED("message_processed"),
    /** The handler failed; the message was left on the queue. */
    PROCESSING_ERROR("processing_error"),
    /** Polling, deleting or changing visibility failed. */
    ERROR("error"),
    /** A poll returned no messages. */
    EMPTY("empty"),
    /** Every message of a non-empty poll response has been handled. */
    RESPONSE_PROCESSED("response_processed"),
    /** The loop has stopped. */
    STOPPED("stopped");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Look up a kind by its wire name, e.g. {@code processing_error}.
     */
    public static EventKind fromWireName(String wireName) {
        return Arrays.stream(values())
            .filter(kind -> kind.wireName.equals(wireName))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown consumer event: " + wireName));
    }
}
