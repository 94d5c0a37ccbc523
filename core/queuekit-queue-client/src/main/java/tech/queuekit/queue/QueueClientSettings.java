package tech.queuekit.queue;

import java.util.Optional;

/**
 * Settings for creating a {@link QueueClient}.
 *
 * @param queueType The type of queue (SQS, Embedded)
 * @param region AWS region (SQS only)
 * @param endpointOverride Alternative endpoint, e.g. LocalStack or ElasticMQ (SQS only)
 * @param accessKeyId Static access key; the default credentials chain is used when absent (SQS only)
 * @param secretAccessKey Static secret key, paired with {@code accessKeyId} (SQS only)
 */
public record QueueClientSettings(
    QueueType queueType,
    String region,
    Optional<String> endpointOverride,
    Optional<String> accessKeyId,
    Optional<String> secretAccessKey
) {
    /**
     * Create settings for SQS using the default credentials chain.
     */
    public static QueueClientSettings sqs(String region) {
        return new QueueClientSettings(QueueType.SQS, region, Optional.empty(), Optional.empty(), Optional.empty());
    }

    /**
     * Create settings for an SQS-compatible endpoint with static credentials.
     */
    public static QueueClientSettings sqs(String region, String endpointOverride, String accessKeyId, String secretAccessKey) {
        return new QueueClientSettings(
            QueueType.SQS,
            region,
            Optional.of(endpointOverride),
            Optional.of(accessKeyId),
            Optional.of(secretAccessKey)
        );
    }

    /**
     * Create settings for the in-process embedded queue.
     */
    public static QueueClientSettings embedded() {
        return new QueueClientSettings(QueueType.EMBEDDED, "none", Optional.empty(), Optional.empty(), Optional.empty());
    }
}
