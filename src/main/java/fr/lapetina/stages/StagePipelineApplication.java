package fr.lapetina.stages;

import fr.lapetina.stages.api.AdminHttpServer;
import fr.lapetina.stages.domain.dispatcher.DispatcherConfig;
import fr.lapetina.stages.domain.dispatcher.DispatcherType;
import fr.lapetina.stages.domain.model.DemandMode;
import fr.lapetina.stages.domain.model.SubscriptionOptions;
import fr.lapetina.stages.domain.stage.Producers;
import fr.lapetina.stages.infrastructure.config.PipelineConfig;
import fr.lapetina.stages.runtime.StageRef;
import fr.lapetina.stages.runtime.StageRuntime;
import fr.lapetina.stages.runtime.StageSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.LongStream;

/**
 * Main entry point: starts the stage runtime, the admin HTTP server and,
 * when enabled, a sample pipeline.
 */
public class StagePipelineApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StagePipelineApplication.class);

    private final PipelineFactory factory;
    private final AdminHttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private final AtomicLong demoConsumed = new AtomicLong();

    public StagePipelineApplication(String configPath) throws Exception {
        log.info("Starting Staged Pipeline...");

        this.factory = PipelineFactory.create(configPath).start();

        PipelineConfig.ServerConfig server = factory.getConfig().getServer();
        this.httpServer = server.isEnabled()
                ? new AdminHttpServer(
                        server.getHost(),
                        server.getPort(),
                        server.getBacklog(),
                        server.getThreads(),
                        factory.getRuntime(),
                        factory.getMetricsRegistry())
                : null;

        log.info("Staged Pipeline initialized");
    }

    public void start() {
        if (httpServer != null) {
            httpServer.start();
            log.info("Admin API listening on port {}", httpServer.getPort());
        }
        if (factory.getConfig().getDemo().isEnabled()) {
            startDemo(factory.getConfig().getDemo());
        }
    }

    /**
     * Counter producer, doubling producer-consumer, then logging consumers
     * behind the configured dispatcher.
     */
    void startDemo(PipelineConfig.DemoConfig demo) {
        StageRuntime runtime = factory.getRuntime();
        DispatcherType type = DispatcherType.fromName(demo.getDispatcher());
        DispatcherConfig dispatcher = switch (type) {
            case DEMAND -> DispatcherConfig.demand();
            case BROADCAST -> DispatcherConfig.broadcast();
            case PARTITION -> DispatcherConfig.partition(demo.getConsumers());
        };

        Iterator<Long> source = LongStream.range(0, demo.getEventCount()).boxed().iterator();
        StageRef counter = runtime.startProducer("counter", Producers.<Long>fromIterator(), source,
                DispatcherConfig.demand());
        // Held in accumulate mode until every printer is subscribed, so no
        // partition is ever unbound and every broadcast subscriber sees all events
        StageRef doubler = runtime.start(StageSpec.producerConsumer("doubler",
                Producers.<Long, Long>mapping(n -> n * 2), null, dispatcher).withDemandMode(DemandMode.ACCUMULATE));
        runtime.subscribe(doubler, counter);

        long progressEvery = Math.max(1, demo.getEventCount() / 10);
        for (int i = 0; i < demo.getConsumers(); i++) {
            String name = "printer-" + i;
            StageRef printer = runtime.startConsumer(name, Producers.<Long>forEach(n -> {
                long consumed = demoConsumed.incrementAndGet();
                if (consumed % progressEvery == 0) {
                    log.info("Demo progress: consumed={}, last={}", consumed, n);
                }
            }), null);

            SubscriptionOptions.Builder options = SubscriptionOptions.builder();
            if (type == DispatcherType.PARTITION) {
                options.partition(i);
            }
            runtime.subscribe(printer, doubler, options.build());
        }
        runtime.setDemandMode(doubler, DemandMode.FORWARD);

        log.info("Demo pipeline started: dispatcher={}, consumers={}, events={}",
                type.getConfigName(), demo.getConsumers(), demo.getEventCount());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public PipelineFactory getFactory() {
        return factory;
    }

    long getDemoConsumed() {
        return demoConsumed.get();
    }

    @Override
    public void close() {
        log.info("Shutting down Staged Pipeline...");

        if (httpServer != null) {
            try {
                httpServer.close();
            } catch (RuntimeException e) {
                log.warn("Error closing HTTP server", e);
            }
        }

        try {
            factory.close();
        } catch (RuntimeException e) {
            log.warn("Error closing factory", e);
        }

        log.info("Staged Pipeline shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            StagePipelineApplication app = new StagePipelineApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Staged Pipeline", e);
            System.exit(1);
        }
    }
}
