package tech.queuekit.runtime.consumer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.queuekit.queue.QueueClient;
import tech.queuekit.queue.ReceivedMessage;
import tech.queuekit.queue.TransportException;
import tech.queuekit.queue.embedded.InMemoryQueueClient;
import tech.queuekit.runtime.config.ConsumerOptions;
import tech.queuekit.runtime.event.ConsumerEvent;
import tech.queuekit.runtime.event.EventKind;
import tech.queuekit.runtime.exception.UnknownQueueException;
import tech.queuekit.runtime.metrics.QueueMetricsService;
import tech.queuekit.runtime.registry.HandlerRegistry;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ConsumerLoopTest {

    private static final String QUEUE = "orders";
    private static final String QUEUE_URL = "https://sqs.us-east-1.amazonaws.com/123456789/orders";

    private QueueClient mockClient;
    private QueueMetricsService mockQueueMetrics;
    private HandlerRegistry registry;
    private ConsumerLoop consumer;
    private final List<ConsumerEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        mockClient = mock(QueueClient.class);
        mockQueueMetrics = mock(QueueMetricsService.class);
        registry = new HandlerRegistry();
        for (EventKind kind : EventKind.values()) {
            registry.registerEvent(QUEUE, kind, events::add);
        }
    }

    @AfterEach
    void tearDown() {
        if (consumer != null) {
            consumer.stop();
        }
    }

    @Test
    void shouldDeleteMessageAfterHandlerSucceeds() {
        receiveOnce(message("m-1", "r-1"));
        List<ReceivedMessage> handled = new CopyOnWriteArrayList<>();
        registry.register(QUEUE, handled::add);

        startConsumer(options().build());

        await().untilAsserted(() -> {
            verify(mockClient).deleteMessage(QUEUE_URL, "r-1");
            assertTrue(hasEvent(EventKind.RESPONSE_PROCESSED));
        });
        assertEquals(1, handled.size());
        assertEquals("m-1", handled.get(0).messageId());
        verify(mockQueueMetrics).recordMessageReceived(QUEUE);
        verify(mockQueueMetrics).recordMessageProcessed(QUEUE, true);
        assertEquals(List.of(EventKind.MESSAGE_RECEIVED, EventKind.MESSAGE_PROCESSED, EventKind.RESPONSE_PROCESSED),
            events.stream().map(ConsumerEvent::kind).filter(kind -> kind != EventKind.EMPTY).limit(3).toList());
    }

    @Test
    void shouldRequestConfiguredBatchSizeWaitTimeAndAttributes() {
        when(mockClient.receiveMessages(anyString(), anyInt(), anyInt(), any())).thenReturn(List.of());
        registry.register(QUEUE, message -> { });

        startConsumer(options().batchSize(3).waitTimeSeconds(1).messageAttributeNames("All").build());

        await().untilAsserted(() ->
            verify(mockClient, atLeastOnce()).receiveMessages(QUEUE_URL, 3, 1, Set.of("All")));
        await().until(() -> hasEvent(EventKind.EMPTY));
    }

    @Test
    void shouldLeaveMessageOnQueueWhenHandlerFails() {
        receiveOnce(message("m-1", "r-1"));
        registry.register(QUEUE, message -> {
            throw new IllegalStateException("boom");
        });

        startConsumer(options().build());

        await().until(() -> hasEvent(EventKind.PROCESSING_ERROR));
        ConsumerEvent.ProcessingError error = (ConsumerEvent.ProcessingError) firstEvent(EventKind.PROCESSING_ERROR);
        assertEquals("m-1", error.message().messageId());
        assertTrue(error.error().getMessage().contains("boom"));
        assertInstanceOf(IllegalStateException.class, error.error().getCause());

        verify(mockClient, never()).deleteMessage(anyString(), anyString());
        verify(mockClient, never()).changeMessageVisibility(anyString(), anyString(), anyInt());
        verify(mockQueueMetrics).recordMessageProcessed(QUEUE, false);
        assertTrue(consumer.isRunning(), "Handler failure must not stop the loop");
    }

    @Test
    void shouldTreatHandlerAssertionErrorAsProcessingError() {
        receiveOnce(message("m-1", "r-1"), message("m-2", "r-2"));
        registry.register(QUEUE, message -> {
            if (message.messageId().equals("m-1")) {
                throw new AssertionError("test");
            }
        });

        startConsumer(options().build());

        await().untilAsserted(() -> verify(mockClient).deleteMessage(QUEUE_URL, "r-2"));
        ConsumerEvent.ProcessingError error = (ConsumerEvent.ProcessingError) firstEvent(EventKind.PROCESSING_ERROR);
        assertEquals("m-1", error.message().messageId());
        assertInstanceOf(AssertionError.class, error.error().getCause());
        assertTrue(error.error().getMessage().contains("test"));
        verify(mockClient, never()).deleteMessage(QUEUE_URL, "r-1");
        assertTrue(consumer.isRunning());
        assertEquals(1, countEvents(EventKind.PROCESSING_ERROR));
    }

    @Test
    void shouldReportUnexpectedLoopFailureBeforeStopping() {
        when(mockClient.receiveMessages(anyString(), anyInt(), anyInt(), any())).thenReturn(null);
        registry.register(QUEUE, message -> { });

        startConsumer(options().build());

        await().until(() -> hasEvent(EventKind.STOPPED));
        ConsumerEvent.ConsumerError error = (ConsumerEvent.ConsumerError) firstEvent(EventKind.ERROR);
        assertInstanceOf(NullPointerException.class, error.error());
        assertFalse(consumer.isRunning());
        assertEquals(ConsumerState.STOPPED, consumer.state());
    }

    @Test
    void shouldTerminateVisibilityTimeoutWhenHandlerFails() {
        receiveOnce(message("m-1", "r-1"));
        registry.register(QUEUE, message -> {
            throw new Exception("checked failure");
        });

        startConsumer(options().terminateVisibilityTimeout(true).build());

        await().untilAsserted(() -> verify(mockClient).changeMessageVisibility(QUEUE_URL, "r-1", 0));
        verify(mockClient, never()).deleteMessage(anyString(), anyString());
    }

    @Test
    void shouldDispatchSequentiallyInReceiptOrder() {
        receiveOnce(message("m-1", "r-1"), message("m-2", "r-2"), message("m-3", "r-3"));
        List<String> order = new CopyOnWriteArrayList<>();
        AtomicInteger inFlight = new AtomicInteger();
        AtomicBoolean overlapped = new AtomicBoolean();
        registry.register(QUEUE, message -> {
            if (inFlight.incrementAndGet() > 1) {
                overlapped.set(true);
            }
            Thread.sleep(20);
            order.add(message.messageId());
            inFlight.decrementAndGet();
        });

        startConsumer(options().build());

        await().until(() -> order.size() == 3);
        assertEquals(List.of("m-1", "m-2", "m-3"), order);
        assertFalse(overlapped.get());
    }

    @Test
    void shouldContinueWithRemainingMessagesAfterOneFails() {
        receiveOnce(message("m-1", "r-1"), message("m-2", "r-2"));
        registry.register(QUEUE, message -> {
            if (message.messageId().equals("m-1")) {
                throw new IllegalArgumentException("bad payload");
            }
        });

        startConsumer(options().build());

        await().untilAsserted(() -> verify(mockClient).deleteMessage(QUEUE_URL, "r-2"));
        verify(mockClient, never()).deleteMessage(QUEUE_URL, "r-1");
    }

    @Test
    void shouldEmitErrorWhenDeleteFails() {
        receiveOnce(message("m-1", "r-1"));
        doThrow(new TransportException("delete failed")).when(mockClient).deleteMessage(QUEUE_URL, "r-1");
        registry.register(QUEUE, message -> { });

        startConsumer(options().build());

        await().until(() -> hasEvent(EventKind.ERROR));
        ConsumerEvent.ConsumerError error = (ConsumerEvent.ConsumerError) firstEvent(EventKind.ERROR);
        assertEquals("m-1", error.message().messageId());
        assertInstanceOf(TransportException.class, error.error());
        assertFalse(hasEvent(EventKind.MESSAGE_PROCESSED));
    }

    @Test
    void shouldDeleteWholeBatchAfterBatchHandlerSucceeds() {
        receiveOnce(message("m-1", "r-1"), message("m-2", "r-2"));
        List<Integer> batchSizes = new CopyOnWriteArrayList<>();
        registry.registerBatch(QUEUE, messages -> batchSizes.add(messages.size()));

        startConsumer(options().batchSize(10).build());

        await().untilAsserted(() -> {
            verify(mockClient).deleteMessage(QUEUE_URL, "r-1");
            verify(mockClient).deleteMessage(QUEUE_URL, "r-2");
        });
        assertEquals(List.of(2), batchSizes);
        await().until(() -> countEvents(EventKind.MESSAGE_PROCESSED) == 2);
        assertEquals(2, countEvents(EventKind.MESSAGE_RECEIVED));
    }

    @Test
    void shouldReportEveryMessageOfFailedBatch() {
        receiveOnce(message("m-1", "r-1"), message("m-2", "r-2"));
        registry.registerBatch(QUEUE, messages -> {
            throw new IllegalStateException("batch rejected");
        });

        startConsumer(options().batchSize(10).terminateVisibilityTimeout(true).build());

        await().until(() -> countEvents(EventKind.PROCESSING_ERROR) == 2);
        verify(mockClient, never()).deleteMessage(anyString(), anyString());
        verify(mockClient).changeMessageVisibility(QUEUE_URL, "r-1", 0);
        verify(mockClient).changeMessageVisibility(QUEUE_URL, "r-2", 0);
    }

    @Test
    void shouldEmitErrorAndKeepPollingWhenReceiveFails() {
        when(mockClient.receiveMessages(anyString(), anyInt(), anyInt(), any()))
            .thenThrow(new TransportException("connection reset"))
            .thenReturn(List.of(message("m-1", "r-1")))
            .thenReturn(List.of());
        registry.register(QUEUE, message -> { });

        startConsumer(options().errorBackoff(Duration.ofMillis(50)).build());

        await().untilAsserted(() -> verify(mockClient).deleteMessage(QUEUE_URL, "r-1"));
        ConsumerEvent.ConsumerError error = (ConsumerEvent.ConsumerError) firstEvent(EventKind.ERROR);
        assertNull(error.message());
        assertTrue(error.optionalMessage().isEmpty());
        assertEquals("connection reset", error.error().getMessage());
        verify(mockQueueMetrics).recordPollError(QUEUE);
    }

    @Test
    void shouldBackOffLongerAfterAuthenticationFailure() throws Exception {
        when(mockClient.receiveMessages(anyString(), anyInt(), anyInt(), any()))
            .thenThrow(new TransportException("bad credentials", "InvalidClientTokenId", true, null));
        registry.register(QUEUE, message -> { });

        startConsumer(options()
            .errorBackoff(Duration.ZERO)
            .authenticationErrorBackoff(Duration.ofSeconds(30))
            .build());

        await().until(() -> hasEvent(EventKind.ERROR));
        Thread.sleep(300);
        verify(mockClient, times(1)).receiveMessages(anyString(), anyInt(), anyInt(), any());

        long started = System.nanoTime();
        consumer.stop();
        assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started) < 5,
            "Stop must interrupt the backoff");
    }

    @Test
    void shouldKeepDispatchingWhenListenerThrows() {
        receiveOnce(message("m-1", "r-1"));
        registry.registerEvent(QUEUE, EventKind.MESSAGE_RECEIVED, event -> {
            throw new IllegalStateException("listener bug");
        });
        AtomicInteger handled = new AtomicInteger();
        registry.register(QUEUE, message -> handled.incrementAndGet());

        startConsumer(options().build());

        await().untilAsserted(() -> verify(mockClient).deleteMessage(QUEUE_URL, "r-1"));
        assertEquals(1, handled.get());
        assertTrue(consumer.isRunning());
    }

    @Test
    void shouldWaitForInFlightDispatchBeforeStopping() throws Exception {
        receiveOnce(message("m-1", "r-1"));
        CountDownLatch handlerStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        registry.register(QUEUE, message -> {
            handlerStarted.countDown();
            release.await();
            interrupted.set(Thread.currentThread().isInterrupted());
        });

        startConsumer(options().build());
        assertTrue(handlerStarted.await(5, TimeUnit.SECONDS));
        assertEquals(ConsumerState.DISPATCHING, consumer.state());

        CompletableFuture<Void> stopping = CompletableFuture.runAsync(consumer::stop);
        Thread.sleep(200);
        assertFalse(stopping.isDone(), "Stop must wait for the in-flight dispatch");
        assertFalse(consumer.isRunning());

        release.countDown();
        stopping.get(5, TimeUnit.SECONDS);

        assertFalse(interrupted.get(), "Dispatch must not be interrupted");
        verify(mockClient).deleteMessage(QUEUE_URL, "r-1");
        assertEquals(ConsumerState.STOPPED, consumer.state());
        assertTrue(hasEvent(EventKind.STOPPED));
    }

    @Test
    void shouldInterruptLongPollOnStop() {
        InMemoryQueueClient embedded = new InMemoryQueueClient();
        registry.register(QUEUE, message -> { });
        consumer = new ConsumerLoop(
            ConsumerOptions.builder(QUEUE, "memory://queue/orders", embedded).waitTimeSeconds(20).build(),
            registry, mockQueueMetrics);
        consumer.start();
        await().until(() -> consumer.getLastPollTime() > 0);

        long started = System.nanoTime();
        consumer.stop();

        assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started) < 5);
        assertFalse(consumer.isRunning());
        assertEquals(ConsumerState.STOPPED, consumer.state());
        assertEquals(1, countEvents(EventKind.STOPPED));
        assertFalse(hasEvent(EventKind.ERROR), "A poll cancelled by stop is not an error");
    }

    @Test
    void shouldBeIdempotentOnStop() {
        when(mockClient.receiveMessages(anyString(), anyInt(), anyInt(), any())).thenReturn(List.of());
        registry.register(QUEUE, message -> { });
        startConsumer(options().build());

        consumer.stop();
        consumer.stop();

        assertEquals(1, countEvents(EventKind.STOPPED));
    }

    @Test
    void shouldFailToStartWithoutHandler() {
        consumer = new ConsumerLoop(options().build(), registry, mockQueueMetrics);

        assertThrows(UnknownQueueException.class, consumer::start);
        assertFalse(consumer.isRunning());
        assertEquals(ConsumerState.STOPPED, consumer.state());
    }

    @Test
    void shouldReportHealthWhileRunning() {
        when(mockClient.receiveMessages(anyString(), anyInt(), anyInt(), any())).thenReturn(List.of());
        registry.register(QUEUE, message -> { });
        consumer = new ConsumerLoop(options().build(), registry, mockQueueMetrics);
        assertFalse(consumer.isHealthy());

        consumer.start();
        await().until(() -> consumer.getLastPollTime() > 0);
        assertTrue(consumer.isHealthy());

        consumer.stop();
        assertFalse(consumer.isHealthy());
    }

    private ConsumerOptions.Builder options() {
        return ConsumerOptions.builder(QUEUE, QUEUE_URL, mockClient)
            .waitTimeSeconds(0)
            .pollingWaitTime(Duration.ofMillis(10));
    }

    private void startConsumer(ConsumerOptions options) {
        consumer = new ConsumerLoop(options, registry, mockQueueMetrics);
        consumer.start();
    }

    private void receiveOnce(ReceivedMessage... messages) {
        when(mockClient.receiveMessages(anyString(), anyInt(), anyInt(), any()))
            .thenReturn(List.of(messages))
            .thenReturn(List.of());
    }

    private static ReceivedMessage message(String messageId, String receiptHandle) {
        return new ReceivedMessage(messageId, "{\"id\":\"" + messageId + "\"}", receiptHandle, Map.of(), Map.of());
    }

    private boolean hasEvent(EventKind kind) {
        return events.stream().anyMatch(event -> event.kind() == kind);
    }

    private long countEvents(EventKind kind) {
        return events.stream().filter(event -> event.kind() == kind).count();
    }

    private ConsumerEvent firstEvent(EventKind kind) {
        return events.stream().filter(event -> event.kind() == kind).findFirst().orElseThrow();
    }
}
