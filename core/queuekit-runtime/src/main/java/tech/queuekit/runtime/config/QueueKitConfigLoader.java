package tech.queuekit.runtime.config;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.jboss.logging.Logger;
import tech.queuekit.queue.QueueClient;
import tech.queuekit.queue.QueueClientFactory;
import tech.queuekit.queue.QueueClientSettings;
import tech.queuekit.queue.QueueType;
import tech.queuekit.runtime.exception.ConfigurationException;
import tech.queuekit.runtime.model.QueueDescriptor;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads {@link QueueKitConfig} and turns it into {@link QueueRuntimeOptions}.
 */
public final class QueueKitConfigLoader {

    private static final Logger LOG = Logger.getLogger(QueueKitConfigLoader.class);

    private QueueKitConfigLoader() {
    }

    /**
     * Load from system properties, environment variables and
     * {@code META-INF/microprofile-config.properties}.
     */
    public static QueueKitConfig load() {
        return build(new SmallRyeConfigBuilder().addDefaultSources());
    }

    /**
     * Load from the given properties only.
     */
    public static QueueKitConfig load(Map<String, String> properties) {
        return build(new SmallRyeConfigBuilder()
            .withSources(new PropertiesConfigSource(properties, "queuekit-properties", 500)));
    }

    private static QueueKitConfig build(SmallRyeConfigBuilder builder) {
        try {
            SmallRyeConfig config = builder.withMapping(QueueKitConfig.class).build();
            return config.getConfigMapping(QueueKitConfig.class);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Invalid queuekit configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Build runtime options, creating one client for all queues.
     */
    public static QueueRuntimeOptions toOptions(QueueKitConfig config, QueueClientFactory clientFactory) {
        QueueClient client = clientFactory.create(toClientSettings(config.client()));
        QueueRuntimeOptions.Builder options = QueueRuntimeOptions.builder();

        config.consumers().forEach((name, consumer) -> {
            QueueDescriptor queue = new QueueDescriptor(name, consumer.queueUrl(), client,
                consumer.fifo().orElse(consumer.queueUrl().endsWith(".fifo")), false);
            ConsumerOptions.Builder builder = ConsumerOptions.builder(queue)
                .waitTimeSeconds(consumer.waitTimeSeconds())
                .batchSize(consumer.batchSize())
                .terminateVisibilityTimeout(consumer.terminateVisibilityTimeout())
                .pollingWaitTime(consumer.pollingWait())
                .errorBackoff(consumer.errorBackoff())
                .authenticationErrorBackoff(consumer.authenticationErrorBackoff());
            consumer.messageAttributeNames().ifPresent(names -> builder.messageAttributeNames(Set.copyOf(names)));
            options.consumer(builder.build());
        });

        config.producers().forEach((name, producer) -> options.producer(new ProducerOptions(
            new QueueDescriptor(name, producer.queueUrl(), client,
                producer.fifo().orElse(producer.queueUrl().endsWith(".fifo")),
                producer.contentBasedDeduplication()))));

        QueueRuntimeOptions result = options.build();
        LOG.infof("Loaded %d consumer(s) and %d producer(s) from configuration",
            result.consumers().size(), result.producers().size());
        return result;
    }

    static QueueClientSettings toClientSettings(QueueKitConfig.ClientConfig client) {
        QueueType type;
        try {
            type = QueueType.valueOf(client.type().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown queuekit.client.type: " + client.type(), e);
        }
        if (type == QueueType.EMBEDDED) {
            return QueueClientSettings.embedded();
        }
        return new QueueClientSettings(type, client.region(), client.endpointOverride(),
            client.accessKeyId(), client.secretAccessKey());
    }
}
