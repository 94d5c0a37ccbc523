package tech.queuekit.runtime.config;

import tech.queuekit.queue.QueueClient;
import tech.queuekit.runtime.exception.ConfigurationException;
import tech.queuekit.runtime.model.QueueDescriptor;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * How a consumer loop polls its queue.
 *
 * @param queue Queue to poll
 * @param waitTimeSeconds Long-poll wait per receive, 0..20
 * @param batchSize Messages per receive, 1..10
 * @param terminateVisibilityTimeout Make a failed message visible again immediately
 * @param messageAttributeNames User message attributes to fetch
 * @param pollingWaitTime Pause between polls
 * @param errorBackoff Pause after a failed poll
 * @param authenticationErrorBackoff Pause after a poll failed on credentials or a missing queue
 */
public record ConsumerOptions(
    QueueDescriptor queue,
    int waitTimeSeconds,
    int batchSize,
    boolean terminateVisibilityTimeout,
    Set<String> messageAttributeNames,
    Duration pollingWaitTime,
    Duration errorBackoff,
    Duration authenticationErrorBackoff
) {
    public static final int DEFAULT_WAIT_TIME_SECONDS = 20;
    public static final int DEFAULT_BATCH_SIZE = 1;
    public static final Duration DEFAULT_ERROR_BACKOFF = Duration.ofSeconds(1);
    public static final Duration DEFAULT_AUTHENTICATION_ERROR_BACKOFF = Duration.ofSeconds(10);

    public ConsumerOptions {
        Objects.requireNonNull(queue, "queue");
        if (waitTimeSeconds < 0 || waitTimeSeconds > 20) {
            throw new ConfigurationException(
                "waitTimeSeconds must be between 0 and 20 for queue [" + queue.name() + "], got " + waitTimeSeconds);
        }
        if (batchSize < 1 || batchSize > 10) {
            throw new ConfigurationException(
                "batchSize must be between 1 and 10 for queue [" + queue.name() + "], got " + batchSize);
        }
        requireNonNegative(queue, "pollingWaitTime", pollingWaitTime);
        requireNonNegative(queue, "errorBackoff", errorBackoff);
        requireNonNegative(queue, "authenticationErrorBackoff", authenticationErrorBackoff);
        messageAttributeNames = messageAttributeNames == null ? Set.of() : Set.copyOf(messageAttributeNames);
    }

    public String name() {
        return queue.name();
    }

    public static Builder builder(String name, String queueUrl, QueueClient client) {
        return new Builder(QueueDescriptor.of(name, queueUrl, client));
    }

    public static Builder builder(QueueDescriptor queue) {
        return new Builder(queue);
    }

    private static void requireNonNegative(QueueDescriptor queue, String field, Duration value) {
        if (value == null || value.isNegative()) {
            throw new ConfigurationException(field + " must be zero or positive for queue [" + queue.name() + "]");
        }
    }

    public static final class Builder {
        private final QueueDescriptor queue;
        private int waitTimeSeconds = DEFAULT_WAIT_TIME_SECONDS;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private boolean terminateVisibilityTimeout;
        private final Set<String> messageAttributeNames = new LinkedHashSet<>();
        private Duration pollingWaitTime = Duration.ZERO;
        private Duration errorBackoff = DEFAULT_ERROR_BACKOFF;
        private Duration authenticationErrorBackoff = DEFAULT_AUTHENTICATION_ERROR_BACKOFF;

        private Builder(QueueDescriptor queue) {
            this.queue = queue;
        }

        public Builder waitTimeSeconds(int waitTimeSeconds) {
            this.waitTimeSeconds = waitTimeSeconds;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder terminateVisibilityTimeout(boolean terminateVisibilityTimeout) {
            this.terminateVisibilityTimeout = terminateVisibilityTimeout;
            return this;
        }

        public Builder messageAttributeNames(String... names) {
            this.messageAttributeNames.addAll(Arrays.asList(names));
            return this;
        }

        public Builder messageAttributeNames(Set<String> names) {
            this.messageAttributeNames.addAll(names);
            return this;
        }

        public Builder pollingWaitTime(Duration pollingWaitTime) {
            this.pollingWaitTime = pollingWaitTime;
            return this;
        }

        public Builder errorBackoff(Duration errorBackoff) {
            this.errorBackoff = errorBackoff;
            return this;
        }

        public Builder authenticationErrorBackoff(Duration authenticationErrorBackoff) {
            this.authenticationErrorBackoff = authenticationErrorBackoff;
            return this;
        }

        public ConsumerOptions build() {
            return new ConsumerOptions(queue, waitTimeSeconds, batchSize, terminateVisibilityTimeout,
                messageAttributeNames, pollingWaitTime, errorBackoff, authenticationErrorBackoff);
        }
    }
}
