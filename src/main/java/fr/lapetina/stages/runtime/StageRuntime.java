package fr.lapetina.stages.runtime;

import fr.lapetina.stages.disruptor.Mailbox;
import fr.lapetina.stages.domain.dispatcher.Dispatcher;
import fr.lapetina.stages.domain.dispatcher.DispatcherConfig;
import fr.lapetina.stages.domain.dispatcher.DispatcherFactory;
import fr.lapetina.stages.domain.model.CancelMode;
import fr.lapetina.stages.domain.model.DemandMode;
import fr.lapetina.stages.domain.model.Reason;
import fr.lapetina.stages.domain.model.SubscriptionOptions;
import fr.lapetina.stages.domain.model.SubscriptionTag;
import fr.lapetina.stages.domain.stage.StageHandler;
import fr.lapetina.stages.infrastructure.config.ConfigLoader;
import fr.lapetina.stages.infrastructure.config.PipelineConfig;
import fr.lapetina.stages.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.stages.runtime.exception.SubscribeException;
import fr.lapetina.stages.runtime.exception.SubscribeException.SubscribeRejection;
import fr.lapetina.stages.runtime.message.CancelRequest;
import fr.lapetina.stages.runtime.message.Inspect;
import fr.lapetina.stages.runtime.message.ManualAsk;
import fr.lapetina.stages.runtime.message.SetDemandMode;
import fr.lapetina.stages.runtime.message.StageMessage;
import fr.lapetina.stages.runtime.message.Stop;
import fr.lapetina.stages.runtime.message.Subscribe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for starting stages and wiring them together.
 *
 * Each started stage gets its own {@link Mailbox} (Disruptor ring buffer and
 * consumer thread). All operations except {@link #subscribe} and
 * {@link #inspect} are asynchronous: they enqueue a message on the target
 * stage and return.
 *
 * <pre>{@code
 * try (StageRuntime runtime = StageRuntime.builder().build()) {
 *     StageRef numbers = runtime.startProducer("numbers", Producers.fromIterator(), source, DispatcherConfig.demand());
 *     StageRef printer = runtime.startConsumer("printer", Producers.forEach(System.out::println), null);
 *     runtime.subscribe(printer, numbers, SubscriptionOptions.builder().maxDemand(10).build());
 * }
 * }</pre>
 */
public final class StageRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StageRuntime.class);

    private final int ringBufferSize;
    private final String waitStrategy;
    private final long subscribeTimeoutMs;
    private final int bufferWarningThreshold;
    private final long inspectTimeoutMs;
    private final long shutdownTimeoutMs;
    private final MetricsRegistry metricsRegistry;

    private volatile int defaultMinDemand;
    private volatile int defaultMaxDemand;
    private volatile CancelMode defaultCancelMode;

    private final StageRegistry registry = new StageRegistry();
    private final AtomicLong idSequence = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ExecutorService reaper;

    private StageRuntime(Builder builder) {
        this.ringBufferSize = builder.ringBufferSize;
        this.waitStrategy = builder.waitStrategy;
        this.subscribeTimeoutMs = builder.subscribeTimeoutMs;
        this.bufferWarningThreshold = builder.bufferWarningThreshold;
        this.inspectTimeoutMs = builder.inspectTimeoutMs;
        this.shutdownTimeoutMs = builder.shutdownTimeoutMs;
        this.metricsRegistry = builder.metricsRegistry != null ? builder.metricsRegistry : new MetricsRegistry();
        this.defaultMinDemand = builder.minDemand;
        this.defaultMaxDemand = builder.maxDemand;
        this.defaultCancelMode = builder.cancelMode;

        // Mailboxes cannot be closed from their own thread
        this.reaper = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "stage-reaper");
            t.setDaemon(true);
            return t;
        });

        log.info("Stage runtime created: ringBufferSize={}, waitStrategy={}, defaultWindow={}/{}, "
                        + "cancelMode={}, subscribeTimeoutMs={}",
                ringBufferSize, waitStrategy, defaultMinDemand, defaultMaxDemand, defaultCancelMode,
                subscribeTimeoutMs);
    }

    // ==================== LIFECYCLE ====================

    /**
     * Starts a stage and returns once its mailbox accepts messages.
     */
    public <I, O, S> StageRef start(StageSpec<I, O, S> spec) {
        if (closed.get()) {
            throw new IllegalStateException("Stage runtime is closed");
        }

        StageRef ref = new StageRef(String.valueOf(idSequence.incrementAndGet()), spec.name(), spec.role());
        Dispatcher<O> dispatcher = spec.dispatcher() != null ? DispatcherFactory.create(spec.dispatcher()) : null;
        StageProcess<I, O, S> process = new StageProcess<>(
                ref, spec, dispatcher, metricsRegistry, this::onTerminated, bufferWarningThreshold);

        Mailbox<StageMessage> mailbox = Mailbox.<StageMessage>builder()
                .name(spec.name() + "-" + ref.getId())
                .ringBufferSize(ringBufferSize)
                .waitStrategy(waitStrategy)
                .shutdownTimeoutMs(shutdownTimeoutMs)
                .handler(process)
                .build();
        ref.attach(mailbox);
        registry.register(ref);
        mailbox.start();
        metricsRegistry.stageStarted();

        log.info("Stage started: stage={}, role={}, dispatcher={}, demandMode={}",
                ref, spec.role(), dispatcher != null ? dispatcher.getName() : "none", spec.demandMode());
        return ref;
    }

    public <O, S> StageRef startProducer(
            String name, StageHandler<Void, O, S> handler, S initialState, DispatcherConfig dispatcher) {
        return start(StageSpec.producer(name, handler, initialState, dispatcher));
    }

    public <I, O, S> StageRef startProducerConsumer(
            String name, StageHandler<I, O, S> handler, S initialState, DispatcherConfig dispatcher) {
        return start(StageSpec.producerConsumer(name, handler, initialState, dispatcher));
    }

    public <I, S> StageRef startConsumer(String name, StageHandler<I, Void, S> handler, S initialState) {
        return start(StageSpec.consumer(name, handler, initialState));
    }

    /**
     * Asks the stage to terminate with the given reason. Returns once enqueued.
     */
    public void stop(StageRef stage, Reason reason) {
        if (!stage.send(new Stop(reason))) {
            log.debug("Stop ignored, stage not running: stage={}", stage);
        }
    }

    public void stop(StageRef stage) {
        stop(stage, Reason.normal());
    }

    private void onTerminated(StageRef stage, Reason reason) {
        registry.remove(stage);
        metricsRegistry.stageTerminated();
        stage.markTerminated(reason);
        try {
            reaper.execute(() -> {
                Mailbox<StageMessage> mailbox = stage.mailbox();
                if (mailbox != null) {
                    mailbox.close();
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Reaper already stopped, mailbox left to close(): stage={}", stage);
        }
    }

    // ==================== SUBSCRIPTIONS ====================

    public SubscriptionTag subscribe(StageRef downstream, StageRef upstream) {
        return subscribe(downstream, upstream, SubscriptionOptions.defaults());
    }

    /**
     * Subscribes {@code downstream} to {@code upstream} and waits for the
     * handshake. Once this returns, the initial demand has been sent
     * (unless the subscription is manual).
     *
     * @throws SubscribeException if the subscription is rejected or the
     *                            handshake does not complete in time
     */
    public SubscriptionTag subscribe(StageRef downstream, StageRef upstream, SubscriptionOptions options) {
        SubscriptionOptions resolved = options.withDefaults(defaultMinDemand, defaultMaxDemand, defaultCancelMode);
        if (!resolved.hasValidWindow()) {
            throw reject(downstream, upstream, new SubscribeException(SubscribeRejection.INVALID_DEMAND_WINDOW,
                    "min=" + resolved.minDemand() + ", max=" + resolved.maxDemand()));
        }
        if (!upstream.getRole().isProducing()) {
            throw reject(downstream, upstream, new SubscribeException(SubscribeRejection.NOT_A_PRODUCER,
                    "upstream=" + upstream));
        }
        if (!downstream.getRole().isConsuming()) {
            throw reject(downstream, upstream, new SubscribeException(SubscribeRejection.NOT_A_CONSUMER,
                    "downstream=" + downstream));
        }
        if (!upstream.isAlive() || !downstream.isAlive()) {
            throw reject(downstream, upstream, new SubscribeException(SubscribeRejection.STAGE_NOT_ALIVE,
                    "downstream=" + downstream + ", upstream=" + upstream));
        }

        SubscriptionTag tag = SubscriptionTag.random();
        CompletableFuture<SubscriptionTag> reply = new CompletableFuture<>();
        if (!downstream.send(new Subscribe(tag, upstream, resolved, reply))) {
            throw reject(downstream, upstream, new SubscribeException(SubscribeRejection.STAGE_NOT_ALIVE,
                    "downstream=" + downstream));
        }

        try {
            if (subscribeTimeoutMs > 0) {
                return reply.get(subscribeTimeoutMs, TimeUnit.MILLISECONDS);
            }
            return reply.get();
        } catch (TimeoutException e) {
            downstream.send(new CancelRequest(tag, Reason.normal("subscribe timed out")));
            throw reject(downstream, upstream, new SubscribeException(SubscribeRejection.TIMEOUT,
                    "timeoutMs=" + subscribeTimeoutMs, e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            downstream.send(new CancelRequest(tag, Reason.normal("subscribe interrupted")));
            throw reject(downstream, upstream, new SubscribeException(SubscribeRejection.INTERRUPTED,
                    "downstream=" + downstream, e));
        } catch (CancellationException e) {
            throw reject(downstream, upstream, new SubscribeException(SubscribeRejection.STAGE_NOT_ALIVE,
                    "subscription abandoned", e));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SubscribeException subscribeException) {
                throw reject(downstream, upstream, subscribeException);
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Subscribe failed", cause);
        }
    }

    private SubscribeException reject(StageRef downstream, StageRef upstream, SubscribeException e) {
        log.warn("Subscribe failed: downstream={}, upstream={}, reason={}", downstream, upstream, e.getRejection());
        return e;
    }

    /**
     * Cancels a subscription from either of its ends. Idempotent: cancelling
     * an unknown or already cancelled subscription, or one of a terminated
     * stage, does nothing.
     */
    public void cancel(StageRef stage, SubscriptionTag tag, Reason reason) {
        if (!stage.send(new CancelRequest(tag, reason))) {
            log.debug("Cancel ignored, stage not running: stage={}, tag={}", stage, tag);
        }
    }

    public void cancel(StageRef stage, SubscriptionTag tag) {
        cancel(stage, tag, Reason.normal());
    }

    // ==================== DEMAND ====================

    /**
     * Asks upstream for more events on a manual subscription of {@code consumer}.
     * The count is clamped to the subscription's window.
     */
    public void ask(StageRef consumer, SubscriptionTag tag, long count) {
        if (count <= 0) {
            throw new IllegalArgumentException("Ask count must be positive: " + count);
        }
        consumer.send(new ManualAsk(tag, count));
    }

    /**
     * Switches a producing stage between forwarding demand to its handler
     * and accumulating it.
     */
    public void setDemandMode(StageRef stage, DemandMode mode) {
        stage.send(new SetDemandMode(mode));
    }

    // ==================== INSPECTION ====================

    /**
     * Returns the stage's accounting as seen from its own thread, or empty if
     * the stage does not answer in time.
     */
    public Optional<StageSnapshot> inspect(StageRef stage) {
        CompletableFuture<StageSnapshot> reply = new CompletableFuture<>();
        if (!stage.send(new Inspect(reply))) {
            return Optional.empty();
        }
        try {
            return Optional.of(reply.get(inspectTimeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            log.warn("Inspect timed out: stage={}, timeoutMs={}", stage, inspectTimeoutMs);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("Inspect failed: stage={}", stage, e.getCause());
            return Optional.empty();
        }
    }

    public List<StageRef> getStages() {
        return registry.getAllStages();
    }

    public Optional<StageRef> findStage(String stageId) {
        return registry.getStage(stageId);
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    // ==================== CONFIGURATION ====================

    /**
     * Replaces the defaults used by later subscriptions. Existing subscriptions keep their window.
     */
    public void updateDefaults(int minDemand, int maxDemand, CancelMode cancelMode) {
        if (minDemand < 0 || minDemand >= maxDemand) {
            throw new IllegalArgumentException("Demand window must satisfy 0 <= min < max");
        }
        this.defaultMinDemand = minDemand;
        this.defaultMaxDemand = maxDemand;
        this.defaultCancelMode = cancelMode;
        log.info("Subscription defaults updated: window={}/{}, cancelMode={}", minDemand, maxDemand, cancelMode);
    }

    public int getDefaultMinDemand() {
        return defaultMinDemand;
    }

    public int getDefaultMaxDemand() {
        return defaultMaxDemand;
    }

    public CancelMode getDefaultCancelMode() {
        return defaultCancelMode;
    }

    /**
     * Stops every running stage with a shutdown reason and waits for them.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down stage runtime: stages={}", registry.size());

        List<StageRef> stages = registry.getAllStages();
        List<CompletableFuture<Reason>> terminations = new ArrayList<>();
        for (StageRef stage : stages) {
            terminations.add(stage.terminationFuture());
            stop(stage, Reason.shutdown());
        }

        try {
            CompletableFuture.allOf(terminations.toArray(new CompletableFuture[0]))
                    .get(shutdownTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Stages did not terminate in time: timeoutMs={}", shutdownTimeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("Error waiting for stage termination", e.getCause());
        }

        reaper.shutdown();
        try {
            if (!reaper.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                reaper.shutdownNow();
            }
        } catch (InterruptedException e) {
            reaper.shutdownNow();
            Thread.currentThread().interrupt();
        }

        // Stages that missed the deadline
        for (StageRef stage : stages) {
            Mailbox<StageMessage> mailbox = stage.mailbox();
            if (mailbox != null && mailbox.isOpen()) {
                mailbox.close();
            }
        }

        log.info("Stage runtime shut down");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for StageRuntime.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private int minDemand = 750;
        private int maxDemand = 1000;
        private CancelMode cancelMode = CancelMode.PERMANENT;
        private long subscribeTimeoutMs = 5000;
        private int bufferWarningThreshold = 10_000;
        private long inspectTimeoutMs = 2000;
        private long shutdownTimeoutMs = 10_000;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder defaultDemand(int minDemand, int maxDemand) {
            if (minDemand < 0 || minDemand >= maxDemand) {
                throw new IllegalArgumentException("Demand window must satisfy 0 <= min < max");
            }
            this.minDemand = minDemand;
            this.maxDemand = maxDemand;
            return this;
        }

        public Builder defaultCancelMode(CancelMode cancelMode) {
            this.cancelMode = cancelMode;
            return this;
        }

        /**
         * Bound on {@link #subscribe}; zero or negative waits indefinitely.
         */
        public Builder subscribeTimeoutMs(long timeoutMs) {
            this.subscribeTimeoutMs = timeoutMs;
            return this;
        }

        public Builder bufferWarningThreshold(int threshold) {
            this.bufferWarningThreshold = threshold;
            return this;
        }

        public Builder inspectTimeoutMs(long timeoutMs) {
            this.inspectTimeoutMs = timeoutMs;
            return this;
        }

        public Builder shutdownTimeoutMs(long timeoutMs) {
            this.shutdownTimeoutMs = timeoutMs;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(PipelineConfig config) {
            this.ringBufferSize = config.getMailbox().getRingBufferSize();
            this.waitStrategy = config.getMailbox().getWaitStrategy();
            this.minDemand = config.getSubscription().getMinDemand();
            this.maxDemand = config.getSubscription().getMaxDemand();
            this.cancelMode = ConfigLoader.parseCancelMode(config.getSubscription().getCancelMode());
            this.subscribeTimeoutMs = config.getSubscription().getSubscribeTimeoutMs();
            this.bufferWarningThreshold = config.getStage().getBufferWarningThreshold();
            this.inspectTimeoutMs = config.getStage().getInspectTimeoutMs();
            this.shutdownTimeoutMs = config.getStage().getShutdownTimeoutMs();
            return this;
        }

        public StageRuntime build() {
            return new StageRuntime(this);
        }
    }
}
