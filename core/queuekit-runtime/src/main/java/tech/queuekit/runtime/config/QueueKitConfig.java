package tech.queuekit.runtime.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Queue runtime configuration, read from {@code queuekit.*} properties.
 *
 * <pre>
 * queuekit.client.type=sqs
 * queuekit.client.region=eu-west-1
 * queuekit.consumers.orders.queue-url=https://sqs.eu-west-1.amazonaws.com/123456789012/orders
 * queuekit.consumers.orders.batch-size=10
 * queuekit.producers.orders.queue-url=https://sqs.eu-west-1.amazonaws.com/123456789012/orders
 * </pre>
 */
@ConfigMapping(prefix = "queuekit")
public interface QueueKitConfig {

    /**
     * Client shared by every configured queue.
     */
    ClientConfig client();

    /**
     * Consumers keyed by queue name.
     */
    Map<String, ConsumerConfig> consumers();

    /**
     * Producers keyed by queue name.
     */
    Map<String, ProducerConfig> producers();

    interface ClientConfig {

        /**
         * Queue type. Options: sqs, embedded
         */
        @WithDefault("sqs")
        String type();

        @WithDefault("us-east-1")
        String region();

        /**
         * Alternative SQS endpoint, e.g. LocalStack.
         */
        Optional<String> endpointOverride();

        Optional<String> accessKeyId();

        Optional<String> secretAccessKey();
    }

    interface ConsumerConfig {

        String queueUrl();

        @WithDefault("20")
        int waitTimeSeconds();

        @WithDefault("1")
        int batchSize();

        @WithDefault("false")
        boolean terminateVisibilityTimeout();

        Optional<List<String>> messageAttributeNames();

        /**
         * Overrides FIFO detection from the {@code .fifo} URL suffix.
         */
        Optional<Boolean> fifo();

        @WithDefault("PT0S")
        Duration pollingWait();

        @WithDefault("PT1S")
        Duration errorBackoff();

        @WithDefault("PT10S")
        Duration authenticationErrorBackoff();
    }

    interface ProducerConfig {

        String queueUrl();

        Optional<Boolean> fifo();

        @WithDefault("false")
        boolean contentBasedDeduplication();
    }
}
