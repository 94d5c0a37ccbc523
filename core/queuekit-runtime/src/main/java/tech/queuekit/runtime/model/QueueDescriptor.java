package tech.queuekit.runtime.model;

import tech.queuekit.queue.QueueClient;
import tech.queuekit.runtime.exception.ConfigurationException;

/**
 * A named queue and the client that reaches it. Immutable once registered.
 *
 * @param name Unique key used by handlers, consumers and producers
 * @param queueUrl Queue URL passed to the client
 * @param client Transport for this queue
 * @param fifo Whether the queue orders by message group and deduplicates
 * @param contentBasedDeduplication Whether the queue derives deduplication ids from the body (FIFO only)
 */
public record QueueDescriptor(
    String name,
    String queueUrl,
    QueueClient client,
    boolean fifo,
    boolean contentBasedDeduplication
) {
    public QueueDescriptor {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Queue name is required");
        }
        if (queueUrl == null || queueUrl.isBlank()) {
            throw new ConfigurationException("Queue URL is required for queue [" + name + "]");
        }
        if (client == null) {
            throw new ConfigurationException("Queue client is required for queue [" + name + "]");
        }
        if (contentBasedDeduplication && !fifo) {
            throw new ConfigurationException("Content-based deduplication needs a FIFO queue [" + name + "]");
        }
    }

    /**
     * Describe a queue, treating it as FIFO when its URL ends in {@code .fifo}.
     */
    public static QueueDescriptor of(String name, String queueUrl, QueueClient client) {
        return new QueueDescriptor(name, queueUrl, client, queueUrl != null && queueUrl.endsWith(".fifo"), false);
    }
}
