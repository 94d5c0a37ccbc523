package tech.queuekit.queue.sqs;

import org.jboss.logging.Logger;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.*;
import tech.queuekit.queue.*;

import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * SQS implementation of QueueClient.
 * Supports both standard and FIFO queues.
 */
public class SqsQueueClient implements QueueClient {

    private static final Logger LOG = Logger.getLogger(SqsQueueClient.class);
    private static final int SQS_MAX_BATCH_SIZE = 10;
    private static final String STRING_DATA_TYPE = "String";

    // Error codes after which polling again right away will not help
    private static final Set<String> AUTHENTICATION_ERROR_CODES = Set.of(
        "InvalidClientTokenId",
        "SignatureDoesNotMatch",
        "UnrecognizedClientException",
        "MissingAuthenticationToken",
        "ExpiredToken",
        "AccessDenied",
        "AccessDeniedException",
        "AWS.SimpleQueueService.NonExistentQueue",
        "QueueDoesNotExist"
    );

    private final SqsClient sqsClient;
    private final boolean ownsClient;

    /**
     * Wrap an externally managed client. {@link #close()} leaves it open.
     */
    public SqsQueueClient(SqsClient sqsClient) {
        this(sqsClient, false);
    }

    public SqsQueueClient(SqsClient sqsClient, boolean ownsClient) {
        this.sqsClient = sqsClient;
        this.ownsClient = ownsClient;
    }

    @Override
    public List<ReceivedMessage> receiveMessages(String queueUrl, int maxMessages, int waitTimeSeconds,
                                                 Collection<String> messageAttributeNames) {
        try {
            ReceiveMessageRequest request = ReceiveMessageRequest.builder()
                .queueUrl(queueUrl)
                .maxNumberOfMessages(maxMessages)
                .waitTimeSeconds(waitTimeSeconds)
                .attributeNamesWithStrings(QueueAttributes.ALL)
                .messageAttributeNames(messageAttributeNames)
                .build();

            ReceiveMessageResponse response = sqsClient.receiveMessage(request);

            List<ReceivedMessage> messages = new ArrayList<>(response.messages().size());
            for (Message message : response.messages()) {
                messages.add(toReceivedMessage(message));
            }
            return messages;
        } catch (SdkException e) {
            throw translate("receive messages from", queueUrl, e);
        }
    }

    @Override
    public void deleteMessage(String queueUrl, String receiptHandle) {
        try {
            sqsClient.deleteMessage(DeleteMessageRequest.builder()
                .queueUrl(queueUrl)
                .receiptHandle(receiptHandle)
                .build());
        } catch (SdkException e) {
            throw translate("delete message from", queueUrl, e);
        }
    }

    @Override
    public void changeMessageVisibility(String queueUrl, String receiptHandle, int timeoutSeconds) {
        try {
            // Clamp to SQS limits: 0-43200 seconds (12 hours)
            int effectiveTimeout = Math.max(0, Math.min(timeoutSeconds, 43200));

            sqsClient.changeMessageVisibility(ChangeMessageVisibilityRequest.builder()
                .queueUrl(queueUrl)
                .receiptHandle(receiptHandle)
                .visibilityTimeout(effectiveTimeout)
                .build());
        } catch (SdkException e) {
            throw translate("change message visibility on", queueUrl, e);
        }
    }

    @Override
    public String sendMessage(String queueUrl, QueueMessage message) {
        try {
            SendMessageRequest.Builder requestBuilder = SendMessageRequest.builder()
                .queueUrl(queueUrl)
                .messageBody(message.body());

            if (message.delaySeconds() > 0) {
                requestBuilder.delaySeconds(message.delaySeconds());
            }
            if (message.messageGroupId() != null) {
                requestBuilder.messageGroupId(message.messageGroupId());
            }
            if (message.deduplicationId() != null) {
                requestBuilder.messageDeduplicationId(message.deduplicationId());
            }
            if (!message.messageAttributes().isEmpty()) {
                requestBuilder.messageAttributes(toAttributeValues(message.messageAttributes()));
            }

            SendMessageResponse response = sqsClient.sendMessage(requestBuilder.build());

            LOG.debugf("Published message [%s] to SQS, messageId: %s",
                message.messageId(), response.messageId());

            return response.messageId();
        } catch (SdkException e) {
            throw translate("send message to", queueUrl, e);
        }
    }

    @Override
    public List<String> sendMessageBatch(String queueUrl, List<QueueMessage> messages) {
        List<String> messageIds = new ArrayList<>(messages.size());

        // Split into batches of 10 (SQS limit)
        for (int i = 0; i < messages.size(); i += SQS_MAX_BATCH_SIZE) {
            List<QueueMessage> batch = messages.subList(i, Math.min(i + SQS_MAX_BATCH_SIZE, messages.size()));

            List<SendMessageBatchRequestEntry> entries = new ArrayList<>(batch.size());
            for (int j = 0; j < batch.size(); j++) {
                entries.add(toEntry(String.valueOf(j), batch.get(j)));
            }

            SendMessageBatchResponse response;
            try {
                response = sqsClient.sendMessageBatch(SendMessageBatchRequest.builder()
                    .queueUrl(queueUrl)
                    .entries(entries)
                    .build());
            } catch (SdkException e) {
                throw translate("send message batch to", queueUrl, e);
            }

            if (!response.failed().isEmpty()) {
                StringBuilder errors = new StringBuilder();
                for (BatchResultErrorEntry failure : response.failed()) {
                    if (!errors.isEmpty()) errors.append("; ");
                    errors.append(batch.get(Integer.parseInt(failure.id())).messageId())
                        .append(": ").append(failure.message());
                }
                throw new TransportException(
                    "Failed to send " + response.failed().size() + " message(s) to [" + queueUrl + "]: " + errors,
                    response.failed().get(0).code(), false, null);
            }

            Map<String, String> idsByEntry = new HashMap<>();
            response.successful().forEach(success -> idsByEntry.put(success.id(), success.messageId()));
            for (int j = 0; j < batch.size(); j++) {
                messageIds.add(idsByEntry.get(String.valueOf(j)));
            }
        }

        LOG.debugf("Published %d message(s) to SQS queue [%s]", messageIds.size(), queueUrl);
        return messageIds;
    }

    @Override
    public void purgeQueue(String queueUrl) {
        try {
            sqsClient.purgeQueue(PurgeQueueRequest.builder().queueUrl(queueUrl).build());
            LOG.infof("Purged SQS queue [%s]", queueUrl);
        } catch (PurgeQueueInProgressException e) {
            // SQS allows one purge per 60 seconds; the queue is already being emptied
            LOG.debugf("Purge already in progress for SQS queue [%s]", queueUrl);
        } catch (SdkException e) {
            throw translate("purge", queueUrl, e);
        }
    }

    @Override
    public Map<String, String> getQueueAttributes(String queueUrl, Collection<String> attributeNames) {
        try {
            GetQueueAttributesResponse response = sqsClient.getQueueAttributes(GetQueueAttributesRequest.builder()
                .queueUrl(queueUrl)
                .attributeNamesWithStrings(attributeNames)
                .build());
            return response.attributesAsStrings();
        } catch (SdkException e) {
            throw translate("get attributes of", queueUrl, e);
        }
    }

    @Override
    public QueueType getQueueType() {
        return QueueType.SQS;
    }

    @Override
    public void close() {
        if (ownsClient) {
            sqsClient.close();
        }
    }

    private SendMessageBatchRequestEntry toEntry(String entryId, QueueMessage message) {
        SendMessageBatchRequestEntry.Builder builder = SendMessageBatchRequestEntry.builder()
            .id(entryId)
            .messageBody(message.body());

        if (message.delaySeconds() > 0) {
            builder.delaySeconds(message.delaySeconds());
        }
        if (message.messageGroupId() != null) {
            builder.messageGroupId(message.messageGroupId());
        }
        if (message.deduplicationId() != null) {
            builder.messageDeduplicationId(message.deduplicationId());
        }
        if (!message.messageAttributes().isEmpty()) {
            builder.messageAttributes(toAttributeValues(message.messageAttributes()));
        }

        return builder.build();
    }

    private static Map<String, MessageAttributeValue> toAttributeValues(Map<String, String> attributes) {
        Map<String, MessageAttributeValue> values = new LinkedHashMap<>();
        attributes.forEach((name, value) -> values.put(name, MessageAttributeValue.builder()
            .dataType(STRING_DATA_TYPE)
            .stringValue(value)
            .build()));
        return values;
    }

    private static ReceivedMessage toReceivedMessage(Message message) {
        Map<String, String> messageAttributes = new LinkedHashMap<>();
        message.messageAttributes().forEach((name, value) -> {
            if (value.stringValue() != null) {
                messageAttributes.put(name, value.stringValue());
            }
        });

        return new ReceivedMessage(
            message.messageId(),
            message.body(),
            message.receiptHandle(),
            message.attributesAsStrings(),
            messageAttributes
        );
    }

    static TransportException translate(String operation, String queueUrl, SdkException e) {
        String errorCode = null;
        boolean authenticationFailure = false;

        if (e instanceof QueueDoesNotExistException) {
            errorCode = "AWS.SimpleQueueService.NonExistentQueue";
            authenticationFailure = true;
        } else if (e instanceof AwsServiceException serviceException && serviceException.awsErrorDetails() != null) {
            errorCode = serviceException.awsErrorDetails().errorCode();
            authenticationFailure = errorCode != null && AUTHENTICATION_ERROR_CODES.contains(errorCode);
        } else if (e.getCause() instanceof UnknownHostException) {
            errorCode = "UnknownEndpoint";
            authenticationFailure = true;
        }

        return new TransportException(
            "Failed to " + operation + " SQS queue [" + queueUrl + "]: " + e.getMessage(),
            errorCode, authenticationFailure, e);
    }
}
