package tech.queuekit.runtime.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Consumers and producers to register with a runtime.
 */
public record QueueRuntimeOptions(List<ConsumerOptions> consumers, List<ProducerOptions> producers) {

    public QueueRuntimeOptions {
        consumers = consumers == null ? List.of() : List.copyOf(consumers);
        producers = producers == null ? List.of() : List.copyOf(producers);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<ConsumerOptions> consumers = new ArrayList<>();
        private final List<ProducerOptions> producers = new ArrayList<>();

        private Builder() {
        }

        public Builder consumer(ConsumerOptions consumer) {
            consumers.add(consumer);
            return this;
        }

        public Builder producer(ProducerOptions producer) {
            producers.add(producer);
            return this;
        }

        public QueueRuntimeOptions build() {
            return new QueueRuntimeOptions(consumers, producers);
        }
    }
}
