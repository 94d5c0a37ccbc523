package tech.queuekit.queue.embedded;

import java.util.Optional;

/**
 * Settings for a queue held by {@link InMemoryQueueClient}.
 *
 * @param visibilityTimeoutSeconds How long a received message stays hidden
 * @param fifo Whether messages are grouped and delivered in order per group
 * @param contentBasedDeduplication Whether the body is used when no deduplication ID is given (FIFO only)
 * @param deadLetterQueueUrl Queue that receives messages once {@code maxReceiveCount} is exceeded
 * @param maxReceiveCount Receives allowed before a message is moved to the dead-letter queue
 */
public record EmbeddedQueueSettings(
    int visibilityTimeoutSeconds,
    boolean fifo,
    boolean contentBasedDeduplication,
    Optional<String> deadLetterQueueUrl,
    int maxReceiveCount
) {
    public static final int DEFAULT_VISIBILITY_TIMEOUT_SECONDS = 30;

    public EmbeddedQueueSettings {
        if (visibilityTimeoutSeconds < 0) {
            throw new IllegalArgumentException("visibilityTimeoutSeconds must be >= 0");
        }
        if (deadLetterQueueUrl.isPresent() && maxReceiveCount < 1) {
            throw new IllegalArgumentException("maxReceiveCount must be >= 1 when a dead-letter queue is set");
        }
    }

    /**
     * Create settings for a standard queue.
     */
    public static EmbeddedQueueSettings standard() {
        return new EmbeddedQueueSettings(DEFAULT_VISIBILITY_TIMEOUT_SECONDS, false, false, Optional.empty(), 0);
    }

    /**
     * Create settings for a FIFO queue.
     */
    public static EmbeddedQueueSettings fifoQueue() {
        return new EmbeddedQueueSettings(DEFAULT_VISIBILITY_TIMEOUT_SECONDS, true, false, Optional.empty(), 0);
    }

    /**
     * Settings used when a queue is first touched without being created: FIFO when the URL ends in {@code .fifo}.
     */
    public static EmbeddedQueueSettings defaultsFor(String queueUrl) {
        return queueUrl.endsWith(".fifo") ? fifoQueue() : standard();
    }

    public EmbeddedQueueSettings withVisibilityTimeout(int seconds) {
        return new EmbeddedQueueSettings(seconds, fifo, contentBasedDeduplication, deadLetterQueueUrl, maxReceiveCount);
    }

    public EmbeddedQueueSettings withContentBasedDeduplication() {
        return new EmbeddedQueueSettings(visibilityTimeoutSeconds, fifo, true, deadLetterQueueUrl, maxReceiveCount);
    }

    public EmbeddedQueueSettings withDeadLetterQueue(String queueUrl, int maxReceiveCount) {
        return new EmbeddedQueueSettings(visibilityTimeoutSeconds, fifo, contentBasedDeduplication,
            Optional.of(queueUrl), maxReceiveCount);
    }
}
