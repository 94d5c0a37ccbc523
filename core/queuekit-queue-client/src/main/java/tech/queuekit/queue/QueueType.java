package tech.queuekit.queue;

/**
 * Supported queue client implementations.
 */
public enum QueueType {
    /**
     * AWS Simple Queue Service (SQS).
     * Supports both standard and FIFO queues.
     */
    SQS,

    /**
     * In-process queue with SQS semantics.
     * Useful for development and tests.
     */
    EMBEDDED
}
