package tech.queuekit.queue;

import org.jboss.logging.Logger;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.SqsClientBuilder;
import tech.queuekit.queue.embedded.InMemoryQueueClient;
import tech.queuekit.queue.sqs.SqsQueueClient;

import java.net.URI;

/**
 * Factory for creating QueueClient instances based on configuration.
 *
 * <p>Every embedded client created by one factory is the same instance, so
 * producers and consumers configured separately still share their queues.
 */
public class QueueClientFactory {

    private static final Logger LOG = Logger.getLogger(QueueClientFactory.class);

    private final InMemoryQueueClient embeddedClient;

    public QueueClientFactory() {
        this(new InMemoryQueueClient());
    }

    public QueueClientFactory(InMemoryQueueClient embeddedClient) {
        this.embeddedClient = embeddedClient;
    }

    /**
     * Create a QueueClient based on the provided settings.
     *
     * @param settings Client settings
     * @return QueueClient instance
     */
    public QueueClient create(QueueClientSettings settings) {
        return switch (settings.queueType()) {
            case SQS -> createSqsClient(settings);
            case EMBEDDED -> {
                LOG.debug("Using embedded in-memory queue client");
                yield embeddedClient;
            }
        };
    }

    public InMemoryQueueClient embeddedClient() {
        return embeddedClient;
    }

    private QueueClient createSqsClient(QueueClientSettings settings) {
        SqsClientBuilder builder = SqsClient.builder()
            .region(Region.of(settings.region()))
            .credentialsProvider(credentialsProvider(settings));

        settings.endpointOverride().ifPresent(endpoint -> builder.endpointOverride(URI.create(endpoint)));

        LOG.infof("Creating SQS client for region [%s] (endpoint=%s)",
            settings.region(), settings.endpointOverride().orElse("default"));

        return new SqsQueueClient(builder.build(), true);
    }

    private static AwsCredentialsProvider credentialsProvider(QueueClientSettings settings) {
        if (settings.accessKeyId().isPresent() && settings.secretAccessKey().isPresent()) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(
                settings.accessKeyId().get(), settings.secretAccessKey().get()));
        }
        return DefaultCredentialsProvider.create();
    }
}
