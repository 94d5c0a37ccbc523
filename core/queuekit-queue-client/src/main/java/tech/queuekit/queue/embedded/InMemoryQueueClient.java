package tech.queuekit.queue.embedded;

import org.jboss.logging.Logger;
import tech.queuekit.queue.*;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process queue client with SQS semantics.
 * Useful for development, single-node deployments and tests.
 *
 * Features:
 * - Message visibility timeout and receipt handles for ACK/NACK
 * - Long polling
 * - Per-message delay
 * - 5-minute deduplication window (matches SQS)
 * - FIFO ordering per message group; a group with a message in flight is held back
 * - Redrive to a dead-letter queue after maxReceiveCount receives
 *
 * Queues are created on first use with {@link EmbeddedQueueSettings#defaultsFor(String)}
 * unless {@link #createQueue} was called first. All queues share one lock.
 */
public class InMemoryQueueClient implements QueueClient {

    private static final Logger LOG = Logger.getLogger(InMemoryQueueClient.class);
    private static final long DEDUP_WINDOW_MS = 5 * 60 * 1000; // 5 minutes

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<String, EmbeddedQueue> queues = new HashMap<>();

    /**
     * Create (or reconfigure) a queue.
     *
     * @return the queue URL, for chaining into consumer and producer options
     */
    public String createQueue(String queueUrl, EmbeddedQueueSettings settings) {
        lock.lock();
        try {
            EmbeddedQueue existing = queues.get(queueUrl);
            if (existing != null) {
                existing.settings = settings;
            } else {
                queues.put(queueUrl, new EmbeddedQueue(queueUrl, settings));
            }
            LOG.debugf("Created embedded queue [%s] (fifo=%s, visibilityTimeout=%ds, dlq=%s)",
                queueUrl, settings.fifo(), settings.visibilityTimeoutSeconds(),
                settings.deadLetterQueueUrl().orElse("none"));
            return queueUrl;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ReceivedMessage> receiveMessages(String queueUrl, int maxMessages, int waitTimeSeconds,
                                                 Collection<String> messageAttributeNames) {
        long deadline = System.currentTimeMillis() + waitTimeSeconds * 1000L;

        lock.lock();
        try {
            while (true) {
                long now = System.currentTimeMillis();
                List<ReceivedMessage> received = receiveAvailable(queue(queueUrl), maxMessages, now, messageAttributeNames);
                if (!received.isEmpty() || now >= deadline) {
                    return received;
                }

                // Wake up for new sends, or when the next hidden message turns visible
                long waitMs = Math.min(deadline - now, queue(queueUrl).millisUntilNextVisible(now));
                changed.await(Math.max(1, waitMs), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Receive from embedded queue [" + queueUrl + "] interrupted", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void deleteMessage(String queueUrl, String receiptHandle) {
        lock.lock();
        try {
            EmbeddedQueue queue = queue(queueUrl);
            boolean removed = queue.messages.removeIf(m -> receiptHandle.equals(m.receiptHandle));
            if (removed) {
                LOG.debugf("Deleted message with receipt handle [%s] from [%s]", receiptHandle, queueUrl);
                changed.signalAll();
            } else {
                LOG.debugf("No message with receipt handle [%s] in [%s] - already deleted or redelivered",
                    receiptHandle, queueUrl);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void changeMessageVisibility(String queueUrl, String receiptHandle, int timeoutSeconds) {
        lock.lock();
        try {
            for (StoredMessage message : queue(queueUrl).messages) {
                if (receiptHandle.equals(message.receiptHandle)) {
                    message.visibleAt = System.currentTimeMillis() + timeoutSeconds * 1000L;
                    LOG.debugf("Changed visibility for receipt handle [%s] to %d seconds",
                        receiptHandle, timeoutSeconds);
                    changed.signalAll();
                    return;
                }
            }
            LOG.debugf("No message with receipt handle [%s] in [%s], cannot change visibility",
                receiptHandle, queueUrl);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String sendMessage(String queueUrl, QueueMessage message) {
        lock.lock();
        try {
            EmbeddedQueue queue = queue(queueUrl);
            long now = System.currentTimeMillis();
            queue.expireDeduplicationEntries(now - DEDUP_WINDOW_MS);

            String dedupKey = null;
            if (queue.settings.fifo()) {
                if (message.messageGroupId() == null) {
                    throw new TransportException(
                        "The request must contain the parameter MessageGroupId", "MissingParameter", false, null);
                }
                dedupKey = message.deduplicationId();
                if (dedupKey == null) {
                    if (!queue.settings.contentBasedDeduplication()) {
                        throw new TransportException(
                            "The queue should either have ContentBasedDeduplication enabled or MessageDeduplicationId provided explicitly",
                            "InvalidParameterValue", false, null);
                    }
                    dedupKey = "content:" + message.body();
                }
                Deduplication seen = queue.deduplication.get(dedupKey);
                if (seen != null) {
                    LOG.debugf("Message [%s] deduplicated (dedup ID: %s)", message.messageId(), dedupKey);
                    return seen.messageId();
                }
            }

            StoredMessage stored = new StoredMessage(
                UUID.randomUUID().toString(),
                message.body(),
                message.messageGroupId(),
                message.deduplicationId(),
                message.messageAttributes(),
                now);
            stored.visibleAt = now + message.delaySeconds() * 1000L;
            queue.messages.add(stored);

            if (dedupKey != null) {
                queue.deduplication.put(dedupKey, new Deduplication(stored.messageId, now));
            }

            LOG.debugf("Published message [%s] to embedded queue [%s] as [%s]",
                message.messageId(), queueUrl, stored.messageId);
            changed.signalAll();
            return stored.messageId;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void purgeQueue(String queueUrl) {
        lock.lock();
        try {
            EmbeddedQueue queue = queue(queueUrl);
            int purged = queue.messages.size();
            queue.messages.clear();
            LOG.infof("Purged %d message(s) from embedded queue [%s]", purged, queueUrl);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, String> getQueueAttributes(String queueUrl, Collection<String> attributeNames) {
        lock.lock();
        try {
            EmbeddedQueue queue = queue(queueUrl);
            long now = System.currentTimeMillis();

            long visible = 0;
            long notVisible = 0;
            long delayed = 0;
            for (StoredMessage message : queue.messages) {
                if (message.visibleAt <= now) {
                    visible++;
                } else if (message.receiptHandle != null) {
                    notVisible++;
                } else {
                    delayed++;
                }
            }

            Map<String, String> all = new LinkedHashMap<>();
            all.put(QueueAttributes.APPROXIMATE_NUMBER_OF_MESSAGES, String.valueOf(visible));
            all.put(QueueAttributes.APPROXIMATE_NUMBER_OF_MESSAGES_NOT_VISIBLE, String.valueOf(notVisible));
            all.put(QueueAttributes.APPROXIMATE_NUMBER_OF_MESSAGES_DELAYED, String.valueOf(delayed));
            all.put(QueueAttributes.VISIBILITY_TIMEOUT, String.valueOf(queue.settings.visibilityTimeoutSeconds()));
            all.put(QueueAttributes.FIFO_QUEUE, String.valueOf(queue.settings.fifo()));
            queue.settings.deadLetterQueueUrl().ifPresent(dlq -> all.put(QueueAttributes.REDRIVE_POLICY,
                "{\"deadLetterTargetArn\":\"" + dlq + "\",\"maxReceiveCount\":" + queue.settings.maxReceiveCount() + "}"));

            return select(all, attributeNames);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public QueueType getQueueType() {
        return QueueType.EMBEDDED;
    }

    // ========================================================================
    // Internal helper methods (lock held)
    // ========================================================================

    private EmbeddedQueue queue(String queueUrl) {
        return queues.computeIfAbsent(queueUrl,
            url -> new EmbeddedQueue(url, EmbeddedQueueSettings.defaultsFor(url)));
    }

    private List<ReceivedMessage> receiveAvailable(EmbeddedQueue queue, int maxMessages, long now,
                                                   Collection<String> messageAttributeNames) {
        List<ReceivedMessage> received = new ArrayList<>();
        Set<String> blockedGroups = new HashSet<>();

        Iterator<StoredMessage> iterator = queue.messages.iterator();
        while (iterator.hasNext() && received.size() < maxMessages) {
            StoredMessage message = iterator.next();
            boolean grouped = queue.settings.fifo() && message.groupId != null;

            if (message.visibleAt > now) {
                // An earlier message of this group is in flight or delayed
                if (grouped) {
                    blockedGroups.add(message.groupId);
                }
                continue;
            }
            if (grouped && blockedGroups.contains(message.groupId)) {
                continue;
            }

            if (queue.settings.deadLetterQueueUrl().isPresent()
                && message.receiveCount >= queue.settings.maxReceiveCount()) {
                iterator.remove();
                moveToDeadLetterQueue(queue, message, now);
                continue;
            }

            message.receiveCount++;
            message.receiptHandle = UUID.randomUUID().toString();
            message.visibleAt = now + queue.settings.visibilityTimeoutSeconds() * 1000L;
            received.add(message.toReceivedMessage(messageAttributeNames));
        }

        return received;
    }

    private void moveToDeadLetterQueue(EmbeddedQueue source, StoredMessage message, long now) {
        String dlqUrl = source.settings.deadLetterQueueUrl().orElseThrow();
        EmbeddedQueue dlq = queue(dlqUrl);

        StoredMessage deadLetter = new StoredMessage(
            message.messageId, message.body, message.groupId, message.deduplicationId,
            message.messageAttributes, message.sentTimestamp);
        deadLetter.visibleAt = now;
        dlq.messages.add(deadLetter);

        LOG.infof("Message [%s] exceeded maxReceiveCount %d on [%s] - moved to dead-letter queue [%s]",
            message.messageId, source.settings.maxReceiveCount(), source.url, dlqUrl);
        changed.signalAll();
    }

    private static Map<String, String> select(Map<String, String> values, Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return Map.of();
        }
        if (names.contains(QueueAttributes.ALL) || names.contains(".*")) {
            return Map.copyOf(values);
        }
        Map<String, String> selected = new LinkedHashMap<>();
        for (String name : names) {
            String value = values.get(name);
            if (value != null) {
                selected.put(name, value);
            }
        }
        return selected;
    }

    private static final class EmbeddedQueue {
        private final String url;
        private final List<StoredMessage> messages = new ArrayList<>();
        private final Map<String, Deduplication> deduplication = new HashMap<>();
        private EmbeddedQueueSettings settings;

        EmbeddedQueue(String url, EmbeddedQueueSettings settings) {
            this.url = url;
            this.settings = settings;
        }

        long millisUntilNextVisible(long now) {
            long next = Long.MAX_VALUE;
            for (StoredMessage message : messages) {
                if (message.visibleAt > now) {
                    next = Math.min(next, message.visibleAt - now);
                }
            }
            return next;
        }

        void expireDeduplicationEntries(long olderThan) {
            deduplication.values().removeIf(entry -> entry.createdAt() < olderThan);
        }
    }

    private record Deduplication(String messageId, long createdAt) {
    }

    private static final class StoredMessage {
        private final String messageId;
        private final String body;
        private final String groupId;
        private final String deduplicationId;
        private final Map<String, String> messageAttributes;
        private final long sentTimestamp;
        private long visibleAt;
        private int receiveCount;
        private String receiptHandle;

        StoredMessage(String messageId, String body, String groupId, String deduplicationId,
                      Map<String, String> messageAttributes, long sentTimestamp) {
            this.messageId = messageId;
            this.body = body;
            this.groupId = groupId;
            this.deduplicationId = deduplicationId;
            this.messageAttributes = messageAttributes;
            this.sentTimestamp = sentTimestamp;
        }

        ReceivedMessage toReceivedMessage(Collection<String> messageAttributeNames) {
            Map<String, String> attributes = new LinkedHashMap<>();
            attributes.put(QueueAttributes.APPROXIMATE_RECEIVE_COUNT, String.valueOf(receiveCount));
            attributes.put(QueueAttributes.SENT_TIMESTAMP, String.valueOf(sentTimestamp));
            if (groupId != null) {
                attributes.put(QueueAttributes.MESSAGE_GROUP_ID, groupId);
            }
            if (deduplicationId != null) {
                attributes.put(QueueAttributes.MESSAGE_DEDUPLICATION_ID, deduplicationId);
            }

            return new ReceivedMessage(messageId, body, receiptHandle, attributes,
                select(messageAttributes, messageAttributeNames));
        }
    }
}
