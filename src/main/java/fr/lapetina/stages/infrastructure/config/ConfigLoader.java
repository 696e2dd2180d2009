package fr.lapetina.stages.infrastructure.config;

import fr.lapetina.stages.domain.dispatcher.DispatcherType;
import fr.lapetina.stages.domain.model.CancelMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pipeline configuration loader with hot-reload support.
 *
 * The path is looked up on the file system first, then on the classpath.
 * Only a file system configuration can be watched; on change it is reloaded,
 * validated and handed to the registered listeners. An invalid reload keeps
 * the current configuration.
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<PipelineConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(PipelineConfig.class, new LoaderOptions()));
    }

    /**
     * Loads and validates the configuration, then notifies listeners.
     *
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public PipelineConfig load() {
        return apply(loadFromPath());
    }

    /**
     * Loads and validates configuration from an input stream.
     */
    public PipelineConfig loadFromStream(InputStream inputStream) {
        return apply(parse(inputStream, "stream"));
    }

    private PipelineConfig apply(PipelineConfig config) {
        validate(config);
        PipelineConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private PipelineConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString().replace('\\', '/');
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private PipelineConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private PipelineConfig parse(InputStream is, String source) {
        try {
            PipelineConfig config = yaml.load(is);
            // An empty document means all defaults
            return config != null ? config : new PipelineConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks values that would otherwise only fail when the first stage starts.
     */
    static void validate(PipelineConfig config) {
        PipelineConfig.SubscriptionConfig subscription = config.getSubscription();
        if (subscription.getMinDemand() < 0 || subscription.getMinDemand() >= subscription.getMaxDemand()) {
            throw new ConfigurationException("subscription demand window must satisfy 0 <= minDemand < maxDemand, got "
                    + subscription.getMinDemand() + "/" + subscription.getMaxDemand());
        }
        parseCancelMode(subscription.getCancelMode());

        int ringBufferSize = config.getMailbox().getRingBufferSize();
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("mailbox.ringBufferSize must be a power of 2, got " + ringBufferSize);
        }

        if (config.getStage().getBufferWarningThreshold() <= 0) {
            throw new ConfigurationException("stage.bufferWarningThreshold must be positive");
        }

        PipelineConfig.ServerConfig server = config.getServer();
        if (server.getPort() < 0 || server.getPort() > 65535) {
            throw new ConfigurationException("server.port out of range: " + server.getPort());
        }

        PipelineConfig.DemoConfig demo = config.getDemo();
        try {
            DispatcherType.fromName(demo.getDispatcher());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("demo.dispatcher: " + e.getMessage(), e);
        }
        if (demo.getConsumers() <= 0) {
            throw new ConfigurationException("demo.consumers must be positive");
        }
    }

    /**
     * Maps a configured cancel mode name ("permanent", "transient", "temporary").
     */
    public static CancelMode parseCancelMode(String name) {
        if (name == null) {
            throw new ConfigurationException("subscription.cancelMode is required");
        }
        try {
            return CancelMode.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown cancel mode: " + name, e);
        }
    }

    public PipelineConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed.equals(configPath.getFileName())) {
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading...");
                        reload();
                    }
                }
            }

            key.reset();
        } catch (IOException | ClosedWatchServiceException e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload, keeping the current one if the new one is invalid.
     */
    public PipelineConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Failed to reload configuration, keeping current: {}", e.getMessage());
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(PipelineConfig oldConfig, PipelineConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (RuntimeException e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
