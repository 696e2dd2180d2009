package fr.lapetina.stages.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ordered inbox of one stage, backed by its own Disruptor ring buffer.
 *
 * Any thread may {@link #send} a message; a single consumer thread hands
 * messages to the {@link MessageHandler} strictly in publication order, one
 * at a time. This gives every stage the isolation of an actor: its state is
 * only ever touched from its mailbox thread.
 *
 * PRODUCER TYPE: MULTI, since every peer stage and the runtime may publish
 * concurrently.
 *
 * WAIT STRATEGY: configurable, default "blocking". A pipeline runs one
 * mailbox thread per stage, so spinning strategies only pay off when stages
 * have dedicated cores.
 *
 * Publishing blocks while the ring buffer is full. Messages sent after
 * {@link #close()} are dropped.
 */
public final class Mailbox<M> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Mailbox.class);

    private final String name;
    private final Disruptor<MessageEnvelope<M>> disruptor;
    private final RingBuffer<MessageEnvelope<M>> ringBuffer;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final long shutdownTimeoutMs;

    private Mailbox(Builder<M> builder) {
        this.name = builder.name;
        this.shutdownTimeoutMs = builder.shutdownTimeoutMs;

        this.disruptor = new Disruptor<>(
                new MessageEnvelopeFactory<>(),
                builder.ringBufferSize,
                new MailboxThreadFactory("stage-" + builder.name),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );
        disruptor.handleEventsWith(new DeliveryHandler<>(builder.handler));
        disruptor.setDefaultExceptionHandler(new MailboxExceptionHandler<>(builder.name));

        this.ringBuffer = disruptor.getRingBuffer();

        log.debug("Mailbox created: name={}, ringBufferSize={}, waitStrategy={}",
                builder.name, builder.ringBufferSize, builder.waitStrategy);
    }

    /**
     * Starts the consumer thread.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.debug("Mailbox started: name={}", name);
        }
    }

    /**
     * Enqueues a message, fire-and-forget.
     *
     * @return false if the mailbox is closed and the message was dropped
     */
    public boolean send(M message) {
        if (closed.get() || !running.get()) {
            log.debug("Message dropped, mailbox closed: name={}, message={}", name, message);
            return false;
        }

        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(message, sequence);
        } finally {
            ringBuffer.publish(sequence);
        }
        return true;
    }

    public boolean isOpen() {
        return running.get() && !closed.get();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public String getName() {
        return name;
    }

    /**
     * Stops accepting messages, drains what is already queued and stops the
     * consumer thread. Must not be called from the mailbox's own thread.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true) && running.get()) {
            try {
                disruptor.shutdown(shutdownTimeoutMs, TimeUnit.MILLISECONDS);
                log.debug("Mailbox closed: name={}", name);
            } catch (TimeoutException e) {
                log.warn("Mailbox drain timed out, halting: name={}", name);
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static <M> Builder<M> builder() {
        return new Builder<>();
    }

    private static final class DeliveryHandler<M> implements EventHandler<MessageEnvelope<M>> {
        private final MessageHandler<M> handler;

        DeliveryHandler(MessageHandler<M> handler) {
            this.handler = handler;
        }

        @Override
        public void onEvent(MessageEnvelope<M> envelope, long sequence, boolean endOfBatch) {
            try {
                handler.onMessage(envelope.getMessage());
            } finally {
                envelope.clear();
            }
        }
    }

    /**
     * Thread factory for mailbox consumer threads.
     */
    private static class MailboxThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        MailboxThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Logs failures escaping the message handler and keeps the mailbox running.
     */
    private static class MailboxExceptionHandler<M> implements ExceptionHandler<MessageEnvelope<M>> {

        private final String name;

        MailboxExceptionHandler(String name) {
            this.name = name;
        }

        @Override
        public void handleEventException(Throwable ex, long sequence, MessageEnvelope<M> envelope) {
            log.error("Unhandled exception in mailbox: name={}, sequence={}, envelope={}",
                    name, sequence, envelope, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during mailbox start: name={}", name, ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during mailbox shutdown: name={}", name, ex);
        }
    }

    /**
     * Builder for Mailbox.
     */
    public static final class Builder<M> {
        private String name = "mailbox";
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private long shutdownTimeoutMs = 10_000;
        private MessageHandler<M> handler;

        public Builder<M> name(String name) {
            this.name = name;
            return this;
        }

        public Builder<M> ringBufferSize(int size) {
            // Must be power of 2
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder<M> waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder<M> shutdownTimeoutMs(long timeoutMs) {
            this.shutdownTimeoutMs = timeoutMs;
            return this;
        }

        public Builder<M> handler(MessageHandler<M> handler) {
            this.handler = handler;
            return this;
        }

        public Mailbox<M> build() {
            Objects.requireNonNull(handler, "MessageHandler is required");
            return new Mailbox<>(this);
        }
    }
}
