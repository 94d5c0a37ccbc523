package tech.queuekit.runtime.consumer;

import org.jboss.logging.Logger;
import org.jboss.logging.MDC;
import tech.queuekit.queue.ReceivedMessage;
import tech.queuekit.queue.TransportException;
import tech.queuekit.runtime.config.ConsumerOptions;
import tech.queuekit.runtime.event.ConsumerEvent;
import tech.queuekit.runtime.event.ConsumerEventHandler;
import tech.queuekit.runtime.exception.MessageHandlerException;
import tech.queuekit.runtime.metrics.QueueMetricsService;
import tech.queuekit.runtime.model.QueueDescriptor;
import tech.queuekit.runtime.registry.HandlerRegistration;
import tech.queuekit.runtime.registry.HandlerRegistry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Polls one queue on a dedicated thread and dispatches what it receives to the
 * handler registered for the queue.
 *
 * <p>Messages of one poll are dispatched one after another in receipt order.
 * A message is deleted only after its handler returned normally. A failed
 * message stays on the queue and, when {@code terminateVisibilityTimeout} is
 * set, is made visible again at once.
 *
 * <p>{@link #stop()} interrupts a pending receive or pause but never a dispatch:
 * it waits for the current dispatch to complete before the loop exits.
 */
public class ConsumerLoop {

    private static final Logger LOG = Logger.getLogger(ConsumerLoop.class);
    private static final long POLL_TIMEOUT_MS = 60_000;

    private final ConsumerOptions options;
    private final QueueDescriptor queue;
    private final HandlerRegistry registry;
    private final QueueMetricsService queueMetrics;

    // Guards state, running and pollThread so that stop never interrupts a dispatch
    private final ReentrantLock stateLock = new ReentrantLock();
    private final AtomicLong lastPollTime = new AtomicLong(0);
    private volatile ConsumerState state = ConsumerState.STOPPED;
    private volatile boolean running;
    private Thread pollThread;
    private ExecutorService executorService;
    private CountDownLatch exited;
    private HandlerRegistration handler;

    public ConsumerLoop(ConsumerOptions options, HandlerRegistry registry, QueueMetricsService queueMetrics) {
        this.options = options;
        this.queue = options.queue();
        this.registry = registry;
        this.queueMetrics = queueMetrics;
    }

    /**
     * Start polling. Does nothing when already running.
     *
     * @throws tech.queuekit.runtime.exception.UnknownQueueException when no handler is registered for the queue
     */
    public void start() {
        stateLock.lock();
        try {
            if (running) {
                return;
            }
            handler = registry.lookup(queue.name());
            running = true;
            state = ConsumerState.POLLING;
            exited = new CountDownLatch(1);
            executorService = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "queuekit-consumer-" + queue.name());
                thread.setDaemon(true);
                return thread;
            });
            executorService.submit(this::pollLoop);
            executorService.shutdown();
        } finally {
            stateLock.unlock();
        }
        LOG.infof("Started consumer for queue [%s] (batchSize=%d, waitTimeSeconds=%d)",
            queue.name(), options.batchSize(), options.waitTimeSeconds());
    }

    /**
     * Stop polling and wait until the loop thread has exited. An in-flight
     * dispatch runs to completion first. Safe to call more than once.
     *
     * <p>Called from a handler or listener on the loop's own thread, this only
     * requests the stop; the loop exits after the current dispatch.
     */
    public void stop() {
        requestStop();
        if (Thread.currentThread() != pollThreadSnapshot()) {
            awaitStopped();
        }
    }

    /**
     * Ask the loop to stop without waiting for it.
     */
    public void requestStop() {
        stateLock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            LOG.infof("Stopping consumer for queue [%s] (state=%s)", queue.name(), state);
            // A thread blocked in receive or backoff is interrupted; a dispatching one is left alone
            if (state == ConsumerState.POLLING && pollThread != null) {
                pollThread.interrupt();
            }
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Wait until the loop thread has exited.
     */
    public void awaitStopped() {
        CountDownLatch latch;
        stateLock.lock();
        try {
            latch = exited;
        } finally {
            stateLock.unlock();
        }
        if (latch == null) {
            return;
        }
        boolean interrupted = false;
        while (true) {
            try {
                latch.await();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    public String getQueueName() {
        return queue.name();
    }

    public ConsumerOptions options() {
        return options;
    }

    public ConsumerState state() {
        return state;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Epoch millis of the last receive attempt, 0 before the first one.
     */
    public long getLastPollTime() {
        return lastPollTime.get();
    }

    /**
     * Running and polled within the last 60 seconds.
     */
    public boolean isHealthy() {
        if (!running) {
            return false;
        }
        long lastPoll = lastPollTime.get();
        if (lastPoll == 0) {
            return true;
        }
        return System.currentTimeMillis() - lastPoll < POLL_TIMEOUT_MS;
    }

    private void pollLoop() {
        if (!enterPolling(Thread.currentThread())) {
            finish();
            return;
        }
        MDC.put("queueName", queue.name());
        try {
            while (running) {
                lastPollTime.set(System.currentTimeMillis());

                List<ReceivedMessage> messages;
                try {
                    messages = queue.client().receiveMessages(queue.queueUrl(), options.batchSize(),
                        options.waitTimeSeconds(), options.messageAttributeNames());
                } catch (RuntimeException e) {
                    if (!running) {
                        break;
                    }
                    if (!handlePollError(e)) {
                        break;
                    }
                    continue;
                }

                if (!enterDispatching()) {
                    if (!messages.isEmpty()) {
                        LOG.debugf("Consumer for queue [%s] stopped with %d undispatched message(s); "
                            + "they become visible again after the visibility timeout", queue.name(), messages.size());
                    }
                    break;
                }
                try {
                    handleResponse(messages);
                } finally {
                    leaveDispatching();
                }

                if (!pause(options.pollingWaitTime())) {
                    break;
                }
            }
        } catch (RuntimeException | Error e) {
            LOG.errorf(e, "Consumer for queue [%s] terminated unexpectedly", queue.name());
            emit(new ConsumerEvent.ConsumerError(queue.name(), e, null));
        } finally {
            MDC.remove("queueName");
            finish();
        }
    }

    private void handleResponse(List<ReceivedMessage> messages) {
        if (messages.isEmpty()) {
            emit(new ConsumerEvent.Empty(queue.name()));
            return;
        }

        LOG.debugf("Received %d message(s) from queue [%s]", messages.size(), queue.name());

        if (handler.isBatch()) {
            processBatch(messages);
        } else {
            for (ReceivedMessage message : messages) {
                processMessage(message);
            }
        }

        emit(new ConsumerEvent.ResponseProcessed(queue.name(), messages));
    }

    private void processMessage(ReceivedMessage message) {
        queueMetrics.recordMessageReceived(queue.name());
        emit(new ConsumerEvent.MessageReceived(queue.name(), message));

        try {
            handler.messageHandler().handleMessage(message);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            onHandlerFailure(message, new MessageHandlerException(e));
            return;
        }

        acknowledge(message);
    }

    private void processBatch(List<ReceivedMessage> messages) {
        for (ReceivedMessage message : messages) {
            queueMetrics.recordMessageReceived(queue.name());
            emit(new ConsumerEvent.MessageReceived(queue.name(), message));
        }

        try {
            handler.batchHandler().handleMessageBatch(messages);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            MessageHandlerException error = new MessageHandlerException(e);
            for (ReceivedMessage message : messages) {
                onHandlerFailure(message, error);
            }
            return;
        }

        for (ReceivedMessage message : messages) {
            acknowledge(message);
        }
    }

    private void onHandlerFailure(ReceivedMessage message, MessageHandlerException error) {
        LOG.warnf(error.getCause(), "Handler failed for message [%s] on queue [%s]", message.messageId(), queue.name());
        queueMetrics.recordMessageProcessed(queue.name(), false);
        emit(new ConsumerEvent.ProcessingError(queue.name(), error, message));

        if (options.terminateVisibilityTimeout()) {
            try {
                queue.client().changeMessageVisibility(queue.queueUrl(), message.receiptHandle(), 0);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to reset visibility of message [%s] on queue [%s]",
                    message.messageId(), queue.name());
                emit(new ConsumerEvent.ConsumerError(queue.name(), e, message));
            }
        }
    }

    private void acknowledge(ReceivedMessage message) {
        try {
            queue.client().deleteMessage(queue.queueUrl(), message.receiptHandle());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to delete message [%s] from queue [%s]", message.messageId(), queue.name());
            queueMetrics.recordMessageProcessed(queue.name(), false);
            emit(new ConsumerEvent.ConsumerError(queue.name(), e, message));
            return;
        }
        queueMetrics.recordMessageProcessed(queue.name(), true);
        emit(new ConsumerEvent.MessageProcessed(queue.name(), message));
    }

    /**
     * Report a failed poll and back off.
     *
     * @return false when the loop should exit
     */
    private boolean handlePollError(RuntimeException e) {
        boolean authFailure = e instanceof TransportException te && te.isAuthenticationFailure();
        Duration backoff = authFailure ? options.authenticationErrorBackoff() : options.errorBackoff();

        LOG.errorf(e, "Error polling queue [%s], retrying in %d ms", queue.name(), backoff.toMillis());
        queueMetrics.recordPollError(queue.name());

        if (!enterDispatching()) {
            return false;
        }
        try {
            emit(new ConsumerEvent.ConsumerError(queue.name(), e, null));
        } finally {
            leaveDispatching();
        }
        return pause(backoff);
    }

    /**
     * Sleep while interruptible by stop.
     *
     * @return false when interrupted or stopped
     */
    private boolean pause(Duration duration) {
        if (duration.isZero()) {
            return running;
        }
        try {
            Thread.sleep(duration.toMillis());
            return running;
        } catch (InterruptedException e) {
            LOG.debugf("Consumer for queue [%s] interrupted while pausing", queue.name());
            return false;
        }
    }

    private void emit(ConsumerEvent event) {
        List<ConsumerEventHandler> listeners = registry.eventHandlers(queue.name(), event.kind());
        for (ConsumerEventHandler listener : listeners) {
            try {
                listener.handle(event);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Listener for [%s] on queue [%s] failed", event.kind().wireName(), queue.name());
            }
        }
    }

    private boolean enterPolling(Thread thread) {
        stateLock.lock();
        try {
            if (!running) {
                return false;
            }
            pollThread = thread;
            state = ConsumerState.POLLING;
            return true;
        } finally {
            stateLock.unlock();
        }
    }

    private boolean enterDispatching() {
        stateLock.lock();
        try {
            if (!running) {
                return false;
            }
            state = ConsumerState.DISPATCHING;
            return true;
        } finally {
            stateLock.unlock();
        }
    }

    private void leaveDispatching() {
        stateLock.lock();
        try {
            state = ConsumerState.POLLING;
        } finally {
            stateLock.unlock();
        }
    }

    private void finish() {
        CountDownLatch latch;
        stateLock.lock();
        try {
            running = false;
            state = ConsumerState.STOPPED;
            pollThread = null;
            latch = exited;
        } finally {
            stateLock.unlock();
        }
        // Clear an interrupt from stop before running stopped listeners
        Thread.interrupted();
        emit(new ConsumerEvent.Stopped(queue.name()));
        LOG.infof("Consumer for queue [%s] stopped", queue.name());
        latch.countDown();
    }

    private Thread pollThreadSnapshot() {
        stateLock.lock();
        try {
            return pollThread;
        } finally {
            stateLock.unlock();
        }
    }
}
