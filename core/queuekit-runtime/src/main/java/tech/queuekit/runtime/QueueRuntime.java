package tech.queuekit.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.jboss.logging.Logger;
import tech.queuekit.queue.QueueClient;
import tech.queuekit.runtime.config.ConsumerOptions;
import tech.queuekit.runtime.config.ProducerOptions;
import tech.queuekit.runtime.config.QueueRuntimeOptions;
import tech.queuekit.runtime.consumer.ConsumerLoop;
import tech.queuekit.runtime.exception.ConfigurationException;
import tech.queuekit.runtime.metrics.MicrometerQueueMetricsService;
import tech.queuekit.runtime.metrics.QueueMetricsService;
import tech.queuekit.runtime.model.OutboundMessage;
import tech.queuekit.runtime.producer.ProducerFacade;
import tech.queuekit.runtime.registry.HandlerRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the handler registry, one consumer loop per consumer queue and the producer.
 *
 * <p>Typical use: {@link #register} the queues, add handlers through
 * {@link #handlers()}, then {@link #start()}. Registration is closed once started.
 */
public class QueueRuntime implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(QueueRuntime.class);

    private final HandlerRegistry handlerRegistry;
    private final QueueMetricsService queueMetrics;
    private final ProducerFacade producer;
    private final Map<String, ConsumerLoop> consumers = new LinkedHashMap<>();
    private final Set<QueueClient> clients = Collections.newSetFromMap(new IdentityHashMap<>());
    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private volatile boolean started;

    public QueueRuntime() {
        this(new SimpleMeterRegistry());
    }

    public QueueRuntime(MeterRegistry meterRegistry) {
        this(new HandlerRegistry(), new MicrometerQueueMetricsService(meterRegistry), new ObjectMapper());
    }

    public QueueRuntime(HandlerRegistry handlerRegistry, QueueMetricsService queueMetrics, ObjectMapper objectMapper) {
        this.handlerRegistry = handlerRegistry;
        this.queueMetrics = queueMetrics;
        this.producer = new ProducerFacade(objectMapper);
    }

    /**
     * Create a runtime with the given queues registered.
     */
    public static QueueRuntime create(QueueRuntimeOptions options) {
        QueueRuntime runtime = new QueueRuntime();
        runtime.register(options);
        return runtime;
    }

    /**
     * Register consumers and producers. All names are checked before anything is
     * registered, so a failed call changes nothing.
     *
     * @throws ConfigurationException on a duplicate name or after {@link #start()}
     */
    public void register(QueueRuntimeOptions options) {
        lifecycleLock.lock();
        try {
            if (started) {
                throw new ConfigurationException("Cannot register queues after the runtime has started");
            }

            Set<String> consumerNames = new HashSet<>(consumers.keySet());
            for (ConsumerOptions consumer : options.consumers()) {
                if (!consumerNames.add(consumer.name())) {
                    throw new ConfigurationException("Consumer already registered: " + consumer.name());
                }
            }
            Set<String> producerNames = new HashSet<>(producer.producerNames());
            for (ProducerOptions producerOptions : options.producers()) {
                if (!producerNames.add(producerOptions.name())) {
                    throw new ConfigurationException("Producer already registered: " + producerOptions.name());
                }
            }

            for (ConsumerOptions consumer : options.consumers()) {
                consumers.put(consumer.name(), new ConsumerLoop(consumer, handlerRegistry, queueMetrics));
                producer.addQueue(consumer.queue());
                clients.add(consumer.queue().client());
                LOG.infof("Registered consumer [%s] for %s", consumer.name(), consumer.queue().queueUrl());
            }
            for (ProducerOptions producerOptions : options.producers()) {
                producer.addProducer(producerOptions.queue());
                clients.add(producerOptions.queue().client());
                LOG.infof("Registered producer [%s] for %s", producerOptions.name(), producerOptions.queue().queueUrl());
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    public HandlerRegistry handlers() {
        return handlerRegistry;
    }

    public ProducerFacade producer() {
        return producer;
    }

    /**
     * Start every consumer loop.
     *
     * @throws ConfigurationException when a consumer has no handler; nothing is started then
     */
    public void start() {
        lifecycleLock.lock();
        try {
            if (started) {
                return;
            }
            List<String> missing = consumers.keySet().stream()
                .filter(name -> !handlerRegistry.has(name))
                .toList();
            if (!missing.isEmpty()) {
                throw new ConfigurationException("No message handler registered for consumer(s) " + missing);
            }

            handlerRegistry.freeze();
            started = true;

            LOG.infof("Starting %d consumer(s)", consumers.size());
            for (ConsumerLoop consumer : consumers.values()) {
                try {
                    consumer.start();
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Failed to start consumer for queue [%s]", consumer.getQueueName());
                }
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Stop every consumer loop in parallel and wait for all of them to exit.
     */
    public void stop() {
        List<ConsumerLoop> loops;
        lifecycleLock.lock();
        try {
            loops = new ArrayList<>(consumers.values());
        } finally {
            lifecycleLock.unlock();
        }

        LOG.infof("Stopping %d consumer(s)", loops.size());
        // Signal every loop first so they wind down in parallel
        loops.forEach(ConsumerLoop::requestStop);
        loops.forEach(ConsumerLoop::awaitStopped);
        LOG.info("All consumers stopped");
    }

    /**
     * Stop every consumer loop, then close each queue client of the registered queues once.
     */
    @Override
    public void close() {
        stop();

        List<QueueClient> toClose;
        lifecycleLock.lock();
        try {
            toClose = new ArrayList<>(clients);
            clients.clear();
        } finally {
            lifecycleLock.unlock();
        }
        for (QueueClient client : toClose) {
            try {
                client.close();
            } catch (RuntimeException e) {
                LOG.warnf(e, "Failed to close %s queue client", client.getQueueType());
            }
        }
    }

    public boolean isStarted() {
        return started;
    }

    public Set<String> consumers() {
        lifecycleLock.lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(consumers.keySet()));
        } finally {
            lifecycleLock.unlock();
        }
    }

    public Set<String> producers() {
        return producer.producerNames();
    }

    public Optional<ConsumerLoop> consumer(String name) {
        lifecycleLock.lock();
        try {
            return Optional.ofNullable(consumers.get(name));
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * True when every consumer loop is running and polling.
     */
    public boolean isHealthy() {
        lifecycleLock.lock();
        try {
            return consumers.values().stream().allMatch(ConsumerLoop::isHealthy);
        } finally {
            lifecycleLock.unlock();
        }
    }

    public String send(String queueName, OutboundMessage<?> message) {
        return producer.send(queueName, message);
    }

    public List<String> send(String queueName, List<? extends OutboundMessage<?>> messages) {
        return producer.send(queueName, messages);
    }

    public void purgeQueue(String queueName) {
        producer.purgeQueue(queueName);
    }

    public Map<String, String> getQueueAttributes(String queueName) {
        return producer.getQueueAttributes(queueName);
    }
}
