package tech.queuekit.queue.sqs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.*;
import tech.queuekit.queue.QueueAttributes;
import tech.queuekit.queue.QueueMessage;
import tech.queuekit.queue.ReceivedMessage;
import tech.queuekit.queue.TransportException;

import java.net.UnknownHostException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SqsQueueClientTest {

    private final String queueUrl = "https://sqs.us-east-1.amazonaws.com/123456789/test-queue";

    private SqsClient mockSqsClient;
    private SqsQueueClient client;

    @BeforeEach
    void setUp() {
        mockSqsClient = mock(SqsClient.class);
        client = new SqsQueueClient(mockSqsClient);
    }

    @Test
    void shouldUseLongPollingAndRequestAttributes() {
        // Given
        when(mockSqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
            .thenReturn(ReceiveMessageResponse.builder().messages(List.of()).build());

        // When
        List<ReceivedMessage> messages = client.receiveMessages(queueUrl, 3, 20, List.of("All"));

        // Then
        assertTrue(messages.isEmpty());
        ArgumentCaptor<ReceiveMessageRequest> requestCaptor = ArgumentCaptor.forClass(ReceiveMessageRequest.class);
        verify(mockSqsClient).receiveMessage(requestCaptor.capture());

        ReceiveMessageRequest request = requestCaptor.getValue();
        assertEquals(queueUrl, request.queueUrl());
        assertEquals(20, request.waitTimeSeconds());
        assertEquals(3, request.maxNumberOfMessages());
        assertEquals(List.of("All"), request.messageAttributeNames());
    }

    @Test
    void shouldConvertReceivedMessages() {
        // Given
        Message sqsMessage = Message.builder()
            .messageId("sqs-msg-123")
            .body("{\"test\":true}")
            .receiptHandle("receipt-123")
            .attributesWithStrings(Map.of("ApproximateReceiveCount", "2"))
            .messageAttributes(Map.of("tenant", MessageAttributeValue.builder()
                .dataType("String")
                .stringValue("acme")
                .build()))
            .build();

        when(mockSqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
            .thenReturn(ReceiveMessageResponse.builder().messages(sqsMessage).build());

        // When
        List<ReceivedMessage> messages = client.receiveMessages(queueUrl, 10, 1, List.of());

        // Then
        assertEquals(1, messages.size());
        ReceivedMessage message = messages.get(0);
        assertEquals("sqs-msg-123", message.messageId());
        assertEquals("{\"test\":true}", message.body());
        assertEquals("receipt-123", message.receiptHandle());
        assertEquals(2, message.receiveCount());
        assertEquals("acme", message.messageAttribute("tenant").orElseThrow());
    }

    @Test
    void shouldDeleteWithReceiptHandle() {
        client.deleteMessage(queueUrl, "receipt-ack-123");

        ArgumentCaptor<DeleteMessageRequest> deleteCaptor = ArgumentCaptor.forClass(DeleteMessageRequest.class);
        verify(mockSqsClient).deleteMessage(deleteCaptor.capture());
        assertEquals(queueUrl, deleteCaptor.getValue().queueUrl());
        assertEquals("receipt-ack-123", deleteCaptor.getValue().receiptHandle());
    }

    @Test
    void shouldClampVisibilityTimeout() {
        client.changeMessageVisibility(queueUrl, "receipt-1", 50_000);

        ArgumentCaptor<ChangeMessageVisibilityRequest> captor = ArgumentCaptor.forClass(ChangeMessageVisibilityRequest.class);
        verify(mockSqsClient).changeMessageVisibility(captor.capture());
        assertEquals(43200, captor.getValue().visibilityTimeout());
    }

    @Test
    void shouldSendFifoFieldsOnlyWhenPresent() {
        // Given
        when(mockSqsClient.sendMessage(any(SendMessageRequest.class)))
            .thenReturn(SendMessageResponse.builder().messageId("sqs-1").build());

        // When
        String standardId = client.sendMessage(queueUrl, QueueMessage.standard("msg-1", "{}"));
        String fifoId = client.sendMessage(queueUrl, new QueueMessage(
            "msg-2", "{}", 0, "group-1", "dedup-2", Map.of("tenant", "acme")));

        // Then
        assertEquals("sqs-1", standardId);
        assertEquals("sqs-1", fifoId);

        ArgumentCaptor<SendMessageRequest> captor = ArgumentCaptor.forClass(SendMessageRequest.class);
        verify(mockSqsClient, times(2)).sendMessage(captor.capture());

        SendMessageRequest standard = captor.getAllValues().get(0);
        assertNull(standard.messageGroupId());
        assertNull(standard.messageDeduplicationId());
        assertNull(standard.delaySeconds());

        SendMessageRequest fifo = captor.getAllValues().get(1);
        assertEquals("group-1", fifo.messageGroupId());
        assertEquals("dedup-2", fifo.messageDeduplicationId());
        assertEquals("acme", fifo.messageAttributes().get("tenant").stringValue());
    }

    @Test
    void shouldSplitBatchesOfTen() {
        // Given
        when(mockSqsClient.sendMessageBatch(any(SendMessageBatchRequest.class))).thenAnswer(invocation -> {
            SendMessageBatchRequest request = invocation.getArgument(0);
            return SendMessageBatchResponse.builder()
                .successful(request.entries().stream()
                    .map(entry -> SendMessageBatchResultEntry.builder()
                        .id(entry.id())
                        .messageId("sqs-" + entry.messageBody())
                        .build())
                    .toList())
                .failed(List.of())
                .build();
        });

        List<QueueMessage> messages = java.util.stream.IntStream.range(0, 12)
            .mapToObj(i -> QueueMessage.standard("msg-" + i, String.valueOf(i)))
            .toList();

        // When
        List<String> ids = client.sendMessageBatch(queueUrl, messages);

        // Then
        verify(mockSqsClient, times(2)).sendMessageBatch(any(SendMessageBatchRequest.class));
        assertEquals(12, ids.size());
        assertEquals("sqs-0", ids.get(0));
        assertEquals("sqs-11", ids.get(11));
    }

    @Test
    void shouldFailBatchWhenEntriesAreRejected() {
        when(mockSqsClient.sendMessageBatch(any(SendMessageBatchRequest.class)))
            .thenReturn(SendMessageBatchResponse.builder()
                .successful(List.of())
                .failed(BatchResultErrorEntry.builder()
                    .id("0")
                    .code("InvalidParameterValue")
                    .message("bad body")
                    .senderFault(true)
                    .build())
                .build());

        TransportException e = assertThrows(TransportException.class,
            () -> client.sendMessageBatch(queueUrl, List.of(QueueMessage.standard("msg-bad", "x"))));

        assertTrue(e.getMessage().contains("msg-bad"));
        assertEquals("InvalidParameterValue", e.getErrorCode());
    }

    @Test
    void shouldTreatPurgeInProgressAsSuccess() {
        when(mockSqsClient.purgeQueue(any(PurgeQueueRequest.class)))
            .thenReturn(PurgeQueueResponse.builder().build())
            .thenThrow(PurgeQueueInProgressException.builder().message("Only one PurgeQueue operation allowed every 60 seconds").build());

        assertDoesNotThrow(() -> client.purgeQueue(queueUrl));
        assertDoesNotThrow(() -> client.purgeQueue(queueUrl));
        verify(mockSqsClient, times(2)).purgeQueue(any(PurgeQueueRequest.class));
    }

    @Test
    void shouldFlagMissingQueueAsAuthenticationFailure() {
        when(mockSqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
            .thenThrow(QueueDoesNotExistException.builder().message("The specified queue does not exist").build());

        TransportException e = assertThrows(TransportException.class,
            () -> client.receiveMessages(queueUrl, 1, 0, List.of()));

        assertTrue(e.isAuthenticationFailure());
        assertEquals("AWS.SimpleQueueService.NonExistentQueue", e.getErrorCode());
    }

    @Test
    void shouldFlagInvalidCredentialsAsAuthenticationFailure() {
        when(mockSqsClient.deleteMessage(any(DeleteMessageRequest.class)))
            .thenThrow(SqsException.builder()
                .message("The security token included in the request is invalid")
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("InvalidClientTokenId").build())
                .build());

        TransportException e = assertThrows(TransportException.class,
            () -> client.deleteMessage(queueUrl, "receipt-1"));

        assertTrue(e.isAuthenticationFailure());
        assertEquals("InvalidClientTokenId", e.getErrorCode());
    }

    @Test
    void shouldFlagUnknownEndpointAsAuthenticationFailure() {
        when(mockSqsClient.sendMessage(any(SendMessageRequest.class)))
            .thenThrow(SdkClientException.builder()
                .message("Unable to execute HTTP request")
                .cause(new UnknownHostException("sqs.nowhere"))
                .build());

        TransportException e = assertThrows(TransportException.class,
            () -> client.sendMessage(queueUrl, QueueMessage.standard("msg-1", "{}")));

        assertTrue(e.isAuthenticationFailure());
    }

    @Test
    void shouldNotFlagThrottlingAsAuthenticationFailure() {
        when(mockSqsClient.receiveMessage(any(ReceiveMessageRequest.class)))
            .thenThrow(SqsException.builder()
                .message("Rate exceeded")
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("ThrottlingException").build())
                .build());

        TransportException e = assertThrows(TransportException.class,
            () -> client.receiveMessages(queueUrl, 1, 0, List.of()));

        assertFalse(e.isAuthenticationFailure());
        assertTrue(e.getMessage().contains(queueUrl));
    }

    @Test
    void shouldReadQueueAttributes() {
        when(mockSqsClient.getQueueAttributes(any(GetQueueAttributesRequest.class)))
            .thenReturn(GetQueueAttributesResponse.builder()
                .attributesWithStrings(Map.of(QueueAttributes.APPROXIMATE_NUMBER_OF_MESSAGES, "7"))
                .build());

        Map<String, String> attributes = client.getQueueAttributes(queueUrl,
            List.of(QueueAttributes.APPROXIMATE_NUMBER_OF_MESSAGES));

        assertEquals("7", attributes.get(QueueAttributes.APPROXIMATE_NUMBER_OF_MESSAGES));
    }

    @Test
    void shouldCloseOnlyOwnedClient() {
        client.close();
        verify(mockSqsClient, never()).close();

        new SqsQueueClient(mockSqsClient, true).close();
        verify(mockSqsClient).close();
    }
}
