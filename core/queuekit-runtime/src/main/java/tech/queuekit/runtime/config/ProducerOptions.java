package tech.queuekit.runtime.config;

import tech.queuekit.queue.QueueClient;
import tech.queuekit.runtime.model.QueueDescriptor;

import java.util.Objects;

/**
 * A queue the producer may send to.
 */
public record ProducerOptions(QueueDescriptor queue) {

    public ProducerOptions {
        Objects.requireNonNull(queue, "queue");
    }

    public String name() {
        return queue.name();
    }

    public static ProducerOptions of(String name, String queueUrl, QueueClient client) {
        return new ProducerOptions(QueueDescriptor.of(name, queueUrl, client));
    }
}
