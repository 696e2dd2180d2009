package fr.lapetina.stages.infrastructure.metrics;

import fr.lapetina.stages.domain.model.ErrorType;
import fr.lapetina.stages.domain.model.Reason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Event and demand counters per stage
 * - Subscription, cancellation and termination counters
 * - Error counters by type
 * - Handler latency timers per stage and callback
 * - Buffered events and running stages gauges
 * - Prometheus exposition
 *
 * Called from every stage thread, so all meter caches are concurrent.
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> handlerTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> bufferedEvents = new ConcurrentHashMap<>();

    private final AtomicInteger runningStages = new AtomicInteger(0);

    public MetricsRegistry(String prefix, boolean jvmMetrics) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (jvmMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            new JvmGcMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        Gauge.builder(prefix + "_stages_running", runningStages, AtomicInteger::get)
                .description("Number of stages currently running")
                .register(registry);

        log.info("MetricsRegistry initialized: prefix={}, jvmMetrics={}", prefix, jvmMetrics);
    }

    public MetricsRegistry(String prefix) {
        this(prefix, false);
    }

    public MetricsRegistry() {
        this("stages");
    }

    public void recordEventsDispatched(String stage, int count) {
        counter("_events_dispatched_total", "Events sent downstream", stage, null, null).increment(count);
    }

    public void recordEventsReceived(String stage, int count) {
        counter("_events_received_total", "Events received from upstream", stage, null, null).increment(count);
    }

    public void recordDemandRequested(String stage, long count) {
        counter("_demand_requested_total", "Demand asked from upstream", stage, null, null).increment(count);
    }

    /**
     * Counts a subscribe handshake seen by an upstream stage.
     *
     * @param outcome "accepted" or "rejected"
     */
    public void recordSubscription(String stage, String outcome) {
        counter("_subscriptions_total", "Subscription handshakes", stage, "outcome", outcome).increment();
    }

    public void recordCancellation(String stage) {
        counter("_cancellations_total", "Subscriptions cancelled", stage, null, null).increment();
    }

    public void recordTermination(String stage, Reason.Kind kind) {
        counter("_terminations_total", "Stage terminations", stage, "kind", kind.name()).increment();
    }

    public void recordError(String stage, ErrorType errorType) {
        counter("_errors_total", "Stage failures", stage, "type", errorType.name()).increment();
    }

    /**
     * Records how long a handler callback ran.
     */
    public void recordHandlerLatency(String stage, String callback, Duration latency) {
        String key = stage + ":" + callback;
        handlerTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_handler_latency")
                        .description("Stage handler callback latency")
                        .tag("stage", stage)
                        .tag("callback", callback)
                        .publishPercentiles(0.5, 0.9, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Updates the number of produced events a stage holds waiting for demand.
     */
    public void setBufferedEvents(String stage, int count) {
        bufferedEvents.computeIfAbsent(stage, s -> {
            AtomicInteger holder = new AtomicInteger();
            Gauge.builder(prefix + "_buffered_events", holder, AtomicInteger::get)
                    .description("Produced events waiting for downstream demand")
                    .tag("stage", s)
                    .register(registry);
            return holder;
        }).set(count);
    }

    public void stageStarted() {
        runningStages.incrementAndGet();
    }

    public void stageTerminated() {
        runningStages.decrementAndGet();
    }

    public int getRunningStages() {
        return runningStages.get();
    }

    private Counter counter(String suffix, String description, String stage, String tagKey, String tagValue) {
        String key = suffix + ":" + stage + ":" + tagValue;
        return counters.computeIfAbsent(key, k -> {
            Counter.Builder builder = Counter.builder(prefix + suffix)
                    .description(description)
                    .tag("stage", stage);
            if (tagKey != null) {
                builder.tag(tagKey, tagValue);
            }
            return builder.register(registry);
        });
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
