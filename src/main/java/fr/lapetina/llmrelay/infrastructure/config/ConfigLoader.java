package fr.lapetina.llmrelay.infrastructure.config;

import fr.lapetina.llmrelay.domain.model.ChannelStatus;
import fr.lapetina.llmrelay.domain.model.LoadBalancerStrategyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Configuration loader with validation and hot-reload support.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Validation of every loaded configuration before it becomes current
 * - File watching for automatic reload
 * - Listener notification on changes
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<RelayConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(RelayConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath and makes it current.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public RelayConfig load() {
        return apply(loadFromPath());
    }

    /**
     * Loads configuration from an input stream and makes it current.
     */
    public RelayConfig loadFromStream(InputStream inputStream) {
        return apply(parse(inputStream, "stream"));
    }

    private RelayConfig apply(RelayConfig config) {
        validate(config);
        RelayConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    private RelayConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString();
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

    private RelayConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private RelayConfig parse(InputStream inputStream, String source) {
        try {
            RelayConfig config = yaml.load(inputStream);
            return config != null ? config : new RelayConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks the configuration for values the relay cannot run with.
     *
     * @throws ConfigurationException describing the first invalid value
     */
    public static void validate(RelayConfig config) {
        RelayConfig.RetryConfig retry = config.getRetry();
        require(retry.getMaxChannelRetries() >= 0, "retry.maxChannelRetries must be >= 0");
        require(retry.getMaxSingleChannelRetries() >= 0, "retry.maxSingleChannelRetries must be >= 0");
        require(retry.getRetryDelayMs() >= 0, "retry.retryDelayMs must be >= 0");
        try {
            LoadBalancerStrategyType.fromValue(retry.getLoadBalancerStrategy());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("retry.loadBalancerStrategy: " + e.getMessage(), e);
        }
        RelayConfig.AutoDisableChannelConfig autoDisable = retry.getAutoDisableChannel();
        if (autoDisable != null && autoDisable.getStatuses() != null) {
            Set<Integer> statuses = new HashSet<>();
            for (RelayConfig.StatusConfig status : autoDisable.getStatuses()) {
                require(status.getStatus() >= 100 && status.getStatus() <= 599,
                        "retry.autoDisableChannel.statuses[].status must be an HTTP status code: " + status.getStatus());
                require(status.getTimes() >= 1,
                        "retry.autoDisableChannel.statuses[" + status.getStatus() + "].times must be >= 1");
                require(statuses.add(status.getStatus()),
                        "Duplicate retry.autoDisableChannel status: " + status.getStatus());
            }
        }

        Set<String> ids = new HashSet<>();
        for (RelayConfig.ChannelConfig channel : config.getChannels()) {
            require(channel.getId() != null && !channel.getId().isBlank(), "channels[].id is required");
            require(ids.add(channel.getId()), "Duplicate channel id: " + channel.getId());
            require(channel.getUrl() != null && !channel.getUrl().isBlank(),
                    "channels[" + channel.getId() + "].url is required");
            try {
                URI.create(channel.getUrl());
                ChannelStatus.fromValue(channel.getStatus());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("channels[" + channel.getId() + "]: " + e.getMessage(), e);
            }
            require(Double.isFinite(channel.getWeight()) && channel.getWeight() >= 0,
                    "channels[" + channel.getId() + "].weight must be >= 0");
        }

        RelayConfig.AdaptiveConfig adaptive = config.getAdaptive();
        require(adaptive.getWindowSeconds() > 0, "adaptive.windowSeconds must be > 0");
        require(adaptive.getBucketCount() > 0, "adaptive.bucketCount must be > 0");
        require(adaptive.getCooldownMs() >= 0, "adaptive.cooldownMs must be >= 0");
        require(adaptive.getFailureThreshold() > 0, "adaptive.failureThreshold must be > 0");
        require(adaptive.getRecoveryMs() >= 0, "adaptive.recoveryMs must be >= 0");
        require(inUnitRange(adaptive.getCooldownPenalty()), "adaptive.cooldownPenalty must be within [0, 1]");
        require(inUnitRange(adaptive.getHalfOpenWeight()), "adaptive.halfOpenWeight must be within [0, 1]");
        require(adaptive.getMinScore() >= 0, "adaptive.minScore must be >= 0");

        RelayConfig.DisruptorConfig disruptor = config.getDisruptor();
        require(Integer.bitCount(disruptor.getRingBufferSize()) == 1, "disruptor.ringBufferSize must be a power of 2");
        require(disruptor.getMaxGlobalInFlight() > 0, "disruptor.maxGlobalInFlight must be > 0");
        require(disruptor.getWorkerThreads() > 0, "disruptor.workerThreads must be > 0");
    }

    private static boolean inUnitRange(double value) {
        return value >= 0 && value <= 1;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ConfigurationException(message);
        }
    }

    /**
     * Returns the current configuration.
     */
    public RelayConfig getCurrentConfig() {
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
            if (parent == null) {
                parent = Paths.get(".");
            }
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
                    // Debounce - check if file actually changed
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading...");
                        reload();
                    }
                }
            }

            key.reset();
        } catch (IOException | RuntimeException e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload. An invalid file keeps the current configuration.
     */
    public RelayConfig reload() {
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

    private void notifyListeners(RelayConfig oldConfig, RelayConfig newConfig) {
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
