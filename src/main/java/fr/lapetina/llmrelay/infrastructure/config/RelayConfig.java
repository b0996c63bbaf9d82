package fr.lapetina.llmrelay.infrastructure.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Root configuration object for the relay.
 * Designed to be populated from YAML.
 */
public class RelayConfig {

    private ServerConfig server = new ServerConfig();
    private List<ChannelConfig> channels = new ArrayList<>();
    private RetryConfig retry = new RetryConfig();
    private AdaptiveConfig adaptive = new AdaptiveConfig();
    private WeightedConfig weighted = new WeightedConfig();
    private DisruptorConfig disruptor = new DisruptorConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private ValidationConfig validation = new ValidationConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public List<ChannelConfig> getChannels() { return channels; }
    public void setChannels(List<ChannelConfig> channels) { this.channels = channels; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public AdaptiveConfig getAdaptive() { return adaptive; }
    public void setAdaptive(AdaptiveConfig adaptive) { this.adaptive = adaptive; }

    public WeightedConfig getWeighted() { return weighted; }
    public void setWeighted(WeightedConfig weighted) { this.weighted = weighted; }

    public DisruptorConfig getDisruptor() { return disruptor; }
    public void setDisruptor(DisruptorConfig disruptor) { this.disruptor = disruptor; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public ValidationConfig getValidation() { return validation; }
    public void setValidation(ValidationConfig validation) { this.validation = validation; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int threads = 32;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * Upstream channel configuration.
     */
    public static class ChannelConfig {
        private String id;
        private String name;
        private String url;
        private String apiKey;
        private Set<String> models = new HashSet<>();
        private double weight = 1.0;
        private String status = "enabled";

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public Set<String> getModels() { return models; }
        public void setModels(Set<String> models) { this.models = models; }

        public double getWeight() { return weight; }
        public void setWeight(double weight) { this.weight = weight; }

        public String getStatus() { return status; }
        public void setStatus(String status) { this.status = status; }
    }

    /**
     * Retry policy configuration. Read into a snapshot at the start of every request.
     */
    public static class RetryConfig {
        private boolean enabled = true;
        private int maxChannelRetries = 3;
        private int maxSingleChannelRetries = 2;
        private long retryDelayMs = 1000;
        private String loadBalancerStrategy = "adaptive";
        private AutoDisableChannelConfig autoDisableChannel = new AutoDisableChannelConfig();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getMaxChannelRetries() { return maxChannelRetries; }
        public void setMaxChannelRetries(int maxChannelRetries) { this.maxChannelRetries = maxChannelRetries; }

        public int getMaxSingleChannelRetries() { return maxSingleChannelRetries; }
        public void setMaxSingleChannelRetries(int maxSingleChannelRetries) { this.maxSingleChannelRetries = maxSingleChannelRetries; }

        public long getRetryDelayMs() { return retryDelayMs; }
        public void setRetryDelayMs(long retryDelayMs) { this.retryDelayMs = retryDelayMs; }

        public String getLoadBalancerStrategy() { return loadBalancerStrategy; }
        public void setLoadBalancerStrategy(String loadBalancerStrategy) { this.loadBalancerStrategy = loadBalancerStrategy; }

        public AutoDisableChannelConfig getAutoDisableChannel() { return autoDisableChannel; }
        public void setAutoDisableChannel(AutoDisableChannelConfig autoDisableChannel) { this.autoDisableChannel = autoDisableChannel; }
    }

    /**
     * Disables a channel after it returned the same upstream status a number of times.
     */
    public static class AutoDisableChannelConfig {
        private boolean enabled = false;
        private List<StatusConfig> statuses = new ArrayList<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public List<StatusConfig> getStatuses() { return statuses; }
        public void setStatuses(List<StatusConfig> statuses) { this.statuses = statuses; }
    }

    public static class StatusConfig {
        private int status;
        private int times = 1;

        public int getStatus() { return status; }
        public void setStatus(int status) { this.status = status; }

        public int getTimes() { return times; }
        public void setTimes(int times) { this.times = times; }
    }

    /**
     * Adaptive strategy and channel health configuration.
     */
    public static class AdaptiveConfig {
        private long windowSeconds = 600;
        private int bucketCount = 60;
        private long cooldownMs = 5000;
        private double cooldownPenalty = 0.1;
        private int failureThreshold = 5;
        private long recoveryMs = 60000;
        private double halfOpenWeight = 0.3;
        private int halfOpenSuccessThreshold = 3;
        private double minScore = 0.01;
        private Long randomSeed;

        public long getWindowSeconds() { return windowSeconds; }
        public void setWindowSeconds(long windowSeconds) { this.windowSeconds = windowSeconds; }

        public int getBucketCount() { return bucketCount; }
        public void setBucketCount(int bucketCount) { this.bucketCount = bucketCount; }

        public long getCooldownMs() { return cooldownMs; }
        public void setCooldownMs(long cooldownMs) { this.cooldownMs = cooldownMs; }

        public double getCooldownPenalty() { return cooldownPenalty; }
        public void setCooldownPenalty(double cooldownPenalty) { this.cooldownPenalty = cooldownPenalty; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getRecoveryMs() { return recoveryMs; }
        public void setRecoveryMs(long recoveryMs) { this.recoveryMs = recoveryMs; }

        public double getHalfOpenWeight() { return halfOpenWeight; }
        public void setHalfOpenWeight(double halfOpenWeight) { this.halfOpenWeight = halfOpenWeight; }

        public int getHalfOpenSuccessThreshold() { return halfOpenSuccessThreshold; }
        public void setHalfOpenSuccessThreshold(int threshold) { this.halfOpenSuccessThreshold = threshold; }

        public double getMinScore() { return minScore; }
        public void setMinScore(double minScore) { this.minScore = minScore; }

        public Long getRandomSeed() { return randomSeed; }
        public void setRandomSeed(Long randomSeed) { this.randomSeed = randomSeed; }
    }

    /**
     * Weighted strategy configuration.
     */
    public static class WeightedConfig {
        private Long randomSeed;

        public Long getRandomSeed() { return randomSeed; }
        public void setRandomSeed(Long randomSeed) { this.randomSeed = randomSeed; }
    }

    /**
     * LMAX Disruptor intake configuration.
     */
    public static class DisruptorConfig {
        private int ringBufferSize = 1024;
        private String waitStrategy = "yielding";
        private int maxGlobalInFlight = 1000;
        private int workerThreads = 64;

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public int getMaxGlobalInFlight() { return maxGlobalInFlight; }
        public void setMaxGlobalInFlight(int maxGlobalInFlight) { this.maxGlobalInFlight = maxGlobalInFlight; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long requestTimeoutMs = 120000;
        private long connectTimeoutMs = 10000;

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * Request validation configuration.
     */
    public static class ValidationConfig {
        private int maxBodyBytes = 1_048_576;
        private Set<String> allowedModels = new HashSet<>();

        public int getMaxBodyBytes() { return maxBodyBytes; }
        public void setMaxBodyBytes(int maxBodyBytes) { this.maxBodyBytes = maxBodyBytes; }

        public Set<String> getAllowedModels() { return allowedModels; }
        public void setAllowedModels(Set<String> allowedModels) { this.allowedModels = allowedModels; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "llm_relay";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
