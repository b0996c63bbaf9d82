package fr.lapetina.llmrelay;

import fr.lapetina.llmrelay.disruptor.RequestPipeline;
import fr.lapetina.llmrelay.domain.model.Channel;
import fr.lapetina.llmrelay.domain.model.ChannelHealth;
import fr.lapetina.llmrelay.domain.model.ChannelStatus;
import fr.lapetina.llmrelay.domain.strategy.LoadBalancer;
import fr.lapetina.llmrelay.domain.strategy.StrategySettings;
import fr.lapetina.llmrelay.infrastructure.config.ConfigLoader;
import fr.lapetina.llmrelay.infrastructure.config.RelayConfig;
import fr.lapetina.llmrelay.infrastructure.config.RetryPolicyProvider;
import fr.lapetina.llmrelay.infrastructure.http.HttpDispatcher;
import fr.lapetina.llmrelay.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llmrelay.infrastructure.persistence.InMemoryExecutionRecorder;
import fr.lapetina.llmrelay.infrastructure.persistence.InMemoryUsageLogRepository;
import fr.lapetina.llmrelay.infrastructure.registry.ChannelRegistry;
import fr.lapetina.llmrelay.retry.Dispatcher;
import fr.lapetina.llmrelay.retry.RetryCoordinator;
import fr.lapetina.llmrelay.retry.RetryDelay;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a fully-wired relay from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (RelayFactory factory = RelayFactory.create("config.yaml").start()) {
 *     Request terminal = factory.getPipeline()
 *             .submit(Request.create("gpt-4o", body))
 *             .get();
 * }
 * }</pre>
 *
 * Channel, status and weight changes in the configuration file are applied on reload.
 * Strategy tuning (seeds, penalties) is read once at startup.
 */
public class RelayFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RelayFactory.class);

    private final ConfigLoader configLoader;
    private final RelayConfig config;
    private final ChannelRegistry channelRegistry;
    private final MetricsRegistry metricsRegistry;
    private final LoadBalancer loadBalancer;
    private final InMemoryExecutionRecorder recorder;
    private final InMemoryUsageLogRepository usageLogs;
    private final RetryPolicyProvider policyProvider;
    private final Dispatcher dispatcher;
    private final RetryCoordinator coordinator;
    private final RequestPipeline pipeline;

    protected RelayFactory(String configPath, Dispatcher dispatcherOverride, RetryDelay retryDelay) {
        log.info("Initializing RelayFactory from config: {}", configPath);

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : new MetricsRegistry(config.getMetrics().getPrefix(), new SimpleMeterRegistry());

        this.channelRegistry = new ChannelRegistry();
        channelRegistry.replaceAll(buildChannels(config));

        this.loadBalancer = new LoadBalancer(strategySettings(config));
        this.recorder = new InMemoryExecutionRecorder();
        this.usageLogs = new InMemoryUsageLogRepository();
        this.policyProvider = new RetryPolicyProvider(configLoader);
        this.dispatcher = dispatcherOverride != null ? dispatcherOverride : createDispatcher(config);

        this.coordinator = new RetryCoordinator(
                loadBalancer, dispatcher, recorder, usageLogs, metricsRegistry, retryDelay, this::disableChannel);

        this.pipeline = RequestPipeline.builder()
                .fromConfig(config)
                .coordinator(coordinator)
                .policyProvider(policyProvider)
                .channels(channelRegistry::snapshot)
                .metricsRegistry(metricsRegistry)
                .build();

        configLoader.addListener(this::onConfigChanged);
        registerChannelMetrics();

        log.info("RelayFactory initialized with {} channels", channelRegistry.size());
    }

    public static RelayFactory create(String configPath) {
        return new RelayFactory(configPath, null, RetryDelay.CANCELLABLE);
    }

    public static RelayFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the intake pipeline and the configuration watcher.
     */
    public RelayFactory start() {
        pipeline.start();
        configLoader.startWatching();
        log.info("Relay started");
        return this;
    }

    public RequestPipeline getPipeline() {
        return pipeline;
    }

    public ChannelRegistry getChannelRegistry() {
        return channelRegistry;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public LoadBalancer getLoadBalancer() {
        return loadBalancer;
    }

    public InMemoryExecutionRecorder getRecorder() {
        return recorder;
    }

    public InMemoryUsageLogRepository getUsageLogs() {
        return usageLogs;
    }

    public RetryPolicyProvider getPolicyProvider() {
        return policyProvider;
    }

    public RetryCoordinator getCoordinator() {
        return coordinator;
    }

    public RelayConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    private static Dispatcher createDispatcher(RelayConfig config) {
        return new HttpDispatcher(
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs())
        );
    }

    static StrategySettings strategySettings(RelayConfig config) {
        RelayConfig.AdaptiveConfig adaptive = config.getAdaptive();
        return new StrategySettings(
                config.getWeighted().getRandomSeed(),
                adaptive.getRandomSeed(),
                adaptive.getCooldownPenalty(),
                adaptive.getHalfOpenWeight(),
                adaptive.getMinScore()
        );
    }

    static ChannelHealth.Settings healthSettings(RelayConfig.AdaptiveConfig adaptive) {
        return new ChannelHealth.Settings(
                Duration.ofSeconds(adaptive.getWindowSeconds()),
                adaptive.getBucketCount(),
                Duration.ofMillis(adaptive.getCooldownMs()),
                adaptive.getFailureThreshold(),
                Duration.ofMillis(adaptive.getRecoveryMs()),
                adaptive.getHalfOpenSuccessThreshold()
        );
    }

    static List<Channel> buildChannels(RelayConfig config) {
        ChannelHealth.Settings settings = healthSettings(config.getAdaptive());
        List<Channel> channels = new ArrayList<>();
        for (RelayConfig.ChannelConfig channelConfig : config.getChannels()) {
            channels.add(Channel.builder()
                    .id(channelConfig.getId())
                    .name(channelConfig.getName() != null ? channelConfig.getName() : channelConfig.getId())
                    .baseUrl(channelConfig.getUrl())
                    .apiKey(channelConfig.getApiKey())
                    .models(channelConfig.getModels())
                    .weight(channelConfig.getWeight())
                    .status(ChannelStatus.fromValue(channelConfig.getStatus()))
                    .healthSettings(settings)
                    .build());
        }
        return channels;
    }

    private void registerChannelMetrics() {
        for (Channel channel : channelRegistry.snapshot()) {
            String channelId = channel.getId();
            metricsRegistry.registerChannelScore(channelId, () ->
                    loadBalancer.adaptiveScores(channelRegistry.snapshot()).getOrDefault(channelId, 0.0));
        }
    }

    private void disableChannel(Channel channel, int statusCode) {
        channelRegistry.updateStatus(channel.getId(), ChannelStatus.DISABLED).ifPresentOrElse(
                updated -> log.warn("Channel {} disabled after repeated upstream status {}", updated.getId(), statusCode),
                () -> log.warn("Channel {} left the registry before it could be disabled", channel.getId()));
    }

    private void onConfigChanged(RelayConfig oldConfig, RelayConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        log.info("Configuration changed, applying channel updates...");
        channelRegistry.replaceAll(buildChannels(newConfig));
        registerChannelMetrics();
        log.info("Configuration updates applied: channels={}", channelRegistry.size());
    }

    @Override
    public void close() {
        log.info("Shutting down RelayFactory...");

        try {
            pipeline.close();
        } catch (Exception e) {
            log.warn("Error closing pipeline", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("RelayFactory shut down");
    }
}
