package tech.queuekit.runtime.producer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.queuekit.queue.QueueAttributes;
import tech.queuekit.queue.QueueMessage;
import tech.queuekit.queue.TransportException;
import tech.queuekit.runtime.exception.ConfigurationException;
import tech.queuekit.runtime.exception.InvalidMessageException;
import tech.queuekit.runtime.exception.SendException;
import tech.queuekit.runtime.exception.UnknownQueueException;
import tech.queuekit.runtime.model.OutboundMessage;
import tech.queuekit.runtime.model.QueueDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sends messages to named queues and runs admin operations on them.
 *
 * <p>Sending is allowed only to queues registered as producers. Purge and
 * attribute reads work on any registered queue, consumer or producer.
 * Transport failures are never retried here.
 */
public class ProducerFacade {

    private static final Logger LOG = Logger.getLogger(ProducerFacade.class);

    static final int MAX_DELAY_SECONDS = 900;
    static final int MAX_BATCH_SIZE = 10;

    private final ObjectMapper objectMapper;
    private final Map<String, QueueDescriptor> producers = new ConcurrentHashMap<>();
    private final Map<String, QueueDescriptor> queues = new ConcurrentHashMap<>();

    public ProducerFacade(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Allow sending to a queue.
     */
    public void addProducer(QueueDescriptor queue) {
        if (producers.putIfAbsent(queue.name(), queue) != null) {
            throw new ConfigurationException("Producer already registered: " + queue.name());
        }
        queues.putIfAbsent(queue.name(), queue);
        LOG.debugf("Registered producer for queue [%s] (%s)", queue.name(), queue.queueUrl());
    }

    /**
     * Make a queue known for purge and attribute reads without allowing sends.
     */
    public void addQueue(QueueDescriptor queue) {
        queues.putIfAbsent(queue.name(), queue);
    }

    public Set<String> producerNames() {
        return Set.copyOf(producers.keySet());
    }

    /**
     * Send one message.
     *
     * @return the queue-assigned message id
     * @throws UnknownQueueException when no producer is registered under the name
     * @throws InvalidMessageException when the message cannot be sent as given
     * @throws SendException when the transport fails
     */
    public String send(String queueName, OutboundMessage<?> message) {
        QueueDescriptor queue = producer(queueName);
        QueueMessage queueMessage = toQueueMessage(queue, message);
        try {
            String messageId = queue.client().sendMessage(queue.queueUrl(), queueMessage);
            LOG.debugf("Sent message [%s] to queue [%s] as [%s]", message.id(), queueName, messageId);
            return messageId;
        } catch (TransportException e) {
            throw new SendException(queueName, e);
        }
    }

    /**
     * Send several messages in chunks of ten. Every message is validated before any is sent.
     *
     * @return queue-assigned message ids, in input order
     */
    public List<String> send(String queueName, List<? extends OutboundMessage<?>> messages) {
        QueueDescriptor queue = producer(queueName);
        if (messages.isEmpty()) {
            return List.of();
        }

        List<QueueMessage> queueMessages = new ArrayList<>(messages.size());
        for (OutboundMessage<?> message : messages) {
            queueMessages.add(toQueueMessage(queue, message));
        }

        List<String> messageIds = new ArrayList<>(queueMessages.size());
        for (int i = 0; i < queueMessages.size(); i += MAX_BATCH_SIZE) {
            List<QueueMessage> chunk = queueMessages.subList(i, Math.min(i + MAX_BATCH_SIZE, queueMessages.size()));
            try {
                messageIds.addAll(queue.client().sendMessageBatch(queue.queueUrl(), chunk));
            } catch (TransportException e) {
                throw new SendException(queueName, e);
            }
        }
        LOG.debugf("Sent %d message(s) to queue [%s]", messageIds.size(), queueName);
        return messageIds;
    }

    /**
     * Remove every message from a registered queue. Purging twice is fine.
     */
    public void purgeQueue(String queueName) {
        QueueDescriptor queue = queue(queueName);
        queue.client().purgeQueue(queue.queueUrl());
        LOG.infof("Purged queue [%s]", queueName);
    }

    /**
     * Read every attribute of a registered queue.
     */
    public Map<String, String> getQueueAttributes(String queueName) {
        QueueDescriptor queue = queue(queueName);
        return queue.client().getQueueAttributes(queue.queueUrl(), List.of(QueueAttributes.ALL));
    }

    /**
     * Approximate number of visible messages on a producer queue.
     */
    public long getProducerQueueSize(String queueName) {
        QueueDescriptor queue = producer(queueName);
        Map<String, String> attributes = queue.client().getQueueAttributes(
            queue.queueUrl(), List.of(QueueAttributes.APPROXIMATE_NUMBER_OF_MESSAGES));
        String size = attributes.get(QueueAttributes.APPROXIMATE_NUMBER_OF_MESSAGES);
        return size == null ? 0 : Long.parseLong(size);
    }

    private QueueDescriptor producer(String queueName) {
        QueueDescriptor queue = producers.get(queueName);
        if (queue == null) {
            throw UnknownQueueException.noProducer(queueName);
        }
        return queue;
    }

    private QueueDescriptor queue(String queueName) {
        QueueDescriptor queue = queues.get(queueName);
        if (queue == null) {
            throw UnknownQueueException.noQueue(queueName);
        }
        return queue;
    }

    QueueMessage toQueueMessage(QueueDescriptor queue, OutboundMessage<?> message) {
        if (message == null) {
            throw new InvalidMessageException("Message is required");
        }
        if (message.id() == null || message.id().isBlank()) {
            throw new InvalidMessageException("Message id is required");
        }
        if (message.body() == null) {
            throw new InvalidMessageException("Body is required for message [" + message.id() + "]");
        }
        if (message.delaySeconds() < 0 || message.delaySeconds() > MAX_DELAY_SECONDS) {
            throw new InvalidMessageException("delaySeconds must be between 0 and " + MAX_DELAY_SECONDS
                + " for message [" + message.id() + "], got " + message.delaySeconds());
        }

        String groupId = null;
        String deduplicationId = null;
        if (queue.fifo()) {
            if (message.groupId() == null || message.groupId().isBlank()) {
                throw new InvalidMessageException("groupId is required for message [" + message.id()
                    + "] on FIFO queue [" + queue.name() + "]");
            }
            if (message.deduplicationId() == null && !queue.contentBasedDeduplication()) {
                throw new InvalidMessageException("deduplicationId is required for message [" + message.id()
                    + "] on FIFO queue [" + queue.name() + "] without content-based deduplication");
            }
            groupId = message.groupId();
            deduplicationId = message.deduplicationId();
        } else if (message.groupId() != null || message.deduplicationId() != null) {
            LOG.debugf("Ignoring FIFO fields of message [%s] for standard queue [%s]", message.id(), queue.name());
        }

        return new QueueMessage(message.id(), serializeBody(message), message.delaySeconds(),
            groupId, deduplicationId, message.messageAttributes());
    }

    private String serializeBody(OutboundMessage<?> message) {
        if (message.body() instanceof String body) {
            return body;
        }
        try {
            return objectMapper.writeValueAsString(message.body());
        } catch (JsonProcessingException e) {
            throw new InvalidMessageException("Failed to serialize body of message [" + message.id() + "]", e);
        }
    }
}
