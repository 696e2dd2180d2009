package fr.lapetina.stages;

import fr.lapetina.stages.infrastructure.config.ConfigLoader;
import fr.lapetina.stages.infrastructure.config.PipelineConfig;
import fr.lapetina.stages.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.stages.runtime.StageRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating a fully-wired stage runtime from configuration.
 * This is the primary entry point for obtaining a configured {@link StageRuntime}.
 *
 * <p>Usage:
 * <pre>{@code
 * try (PipelineFactory factory = PipelineFactory.create("config.yaml").start()) {
 *     StageRuntime runtime = factory.getRuntime();
 *     // start and subscribe stages...
 * }
 * }</pre>
 */
public class PipelineFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    private final ConfigLoader configLoader;
    private final PipelineConfig config;
    private final MetricsRegistry metricsRegistry;
    private final StageRuntime runtime;

    protected PipelineFactory(String configPath) {
        log.info("Initializing PipelineFactory from config: {}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.metricsRegistry = new MetricsRegistry(
                config.getMetrics().getPrefix(),
                config.getMetrics().isJvmMetrics()
        );

        this.runtime = StageRuntime.builder()
                .fromConfig(config)
                .metricsRegistry(metricsRegistry)
                .build();

        configLoader.addListener(this::onConfigChanged);

        log.info("PipelineFactory initialized");
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static PipelineFactory create(String configPath) {
        return new PipelineFactory(configPath);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static PipelineFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts watching the configuration file.
     */
    public PipelineFactory start() {
        configLoader.startWatching();
        log.info("Pipeline factory started");
        return this;
    }

    public StageRuntime getRuntime() {
        return runtime;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public PipelineConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    /**
     * Applies the subscription defaults of a reloaded configuration. Mailbox
     * and stage settings only take effect on restart.
     */
    private void onConfigChanged(PipelineConfig oldConfig, PipelineConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        log.info("Configuration changed, applying updates...");

        PipelineConfig.SubscriptionConfig subscription = newConfig.getSubscription();
        runtime.updateDefaults(
                subscription.getMinDemand(),
                subscription.getMaxDemand(),
                ConfigLoader.parseCancelMode(subscription.getCancelMode())
        );

        if (oldConfig.getMailbox().getRingBufferSize() != newConfig.getMailbox().getRingBufferSize()
                || !oldConfig.getMailbox().getWaitStrategy().equals(newConfig.getMailbox().getWaitStrategy())) {
            log.warn("Mailbox settings changed, restart required to apply them");
        }

        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down PipelineFactory...");

        try {
            runtime.close();
        } catch (RuntimeException e) {
            log.warn("Error closing stage runtime", e);
        }

        try {
            metricsRegistry.close();
        } catch (RuntimeException e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (RuntimeException e) {
            log.warn("Error closing config loader", e);
        }

        log.info("PipelineFactory shut down");
    }
}
