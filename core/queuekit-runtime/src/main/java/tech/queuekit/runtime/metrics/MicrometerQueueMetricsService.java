package tech.queuekit.runtime.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class MicrometerQueueMetricsService implements QueueMetricsService {

    private final MeterRegistry meterRegistry;
    private final Map<String, QueueCounters> queueCounters = new ConcurrentHashMap<>();

    public MicrometerQueueMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordMessageReceived(String queueName) {
        countersFor(queueName).received.increment();
    }

    @Override
    public void recordMessageProcessed(String queueName, boolean success) {
        QueueCounters counters = countersFor(queueName);
        if (success) {
            counters.consumed.increment();
        } else {
            counters.failed.increment();
        }
    }

    @Override
    public void recordPollError(String queueName) {
        countersFor(queueName).pollErrors.increment();
    }

    private QueueCounters countersFor(String queueName) {
        return queueCounters.computeIfAbsent(queueName, name -> new QueueCounters(
            Counter.builder("queuekit.queue.messages.received")
                .tag("queue", name)
                .description("Total messages received from queue")
                .register(meterRegistry),
            Counter.builder("queuekit.queue.messages.consumed")
                .tag("queue", name)
                .description("Total messages handled and deleted")
                .register(meterRegistry),
            Counter.builder("queuekit.queue.messages.failed")
                .tag("queue", name)
                .description("Total messages whose handler failed or whose delete failed")
                .register(meterRegistry),
            Counter.builder("queuekit.queue.poll.errors")
                .tag("queue", name)
                .description("Total failed polls")
                .register(meterRegistry)
        ));
    }

    private record QueueCounters(Counter received, Counter consumed, Counter failed, Counter pollErrors) {
    }
}
