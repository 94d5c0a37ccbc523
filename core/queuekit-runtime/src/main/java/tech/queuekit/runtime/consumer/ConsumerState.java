package tech.queuekit.runtime.consumer;

public enum ConsumerState {
    STOPPED,
    /** Waiting on a receive, or pausing between polls. */
    POLLING,
    /** Handing received messages to the handler. */
    DISPATCHING
}
