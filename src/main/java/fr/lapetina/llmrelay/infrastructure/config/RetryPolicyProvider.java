package fr.lapetina.llmrelay.infrastructure.config;

import fr.lapetina.llmrelay.domain.model.AutoDisablePolicy;
import fr.lapetina.llmrelay.domain.model.LoadBalancerStrategyType;
import fr.lapetina.llmrelay.domain.model.RetryPolicy;

import java.util.List;
import java.util.function.Supplier;

/**
 * Reads the current retry configuration as an immutable {@link RetryPolicy}.
 *
 * Each call returns a fresh snapshot, so a request holding one is unaffected by later reloads.
 */
public final class RetryPolicyProvider {

    private final Supplier<RelayConfig> configSupplier;

    public RetryPolicyProvider(Supplier<RelayConfig> configSupplier) {
        this.configSupplier = configSupplier;
    }

    public RetryPolicyProvider(ConfigLoader configLoader) {
        this(configLoader::getCurrentConfig);
    }

    public RetryPolicy snapshot() {
        RelayConfig config = configSupplier.get();
        if (config == null) {
            return RetryPolicy.defaults();
        }
        return toPolicy(config.getRetry());
    }

    public static RetryPolicy toPolicy(RelayConfig.RetryConfig retry) {
        return new RetryPolicy(
                retry.isEnabled(),
                retry.getMaxChannelRetries(),
                retry.getMaxSingleChannelRetries(),
                retry.getRetryDelayMs(),
                LoadBalancerStrategyType.fromValue(retry.getLoadBalancerStrategy()),
                toAutoDisable(retry.getAutoDisableChannel())
        );
    }

    static AutoDisablePolicy toAutoDisable(RelayConfig.AutoDisableChannelConfig config) {
        if (config == null) {
            return AutoDisablePolicy.disabled();
        }
        List<AutoDisablePolicy.StatusThreshold> thresholds = config.getStatuses() == null
                ? List.of()
                : config.getStatuses().stream()
                        .map(status -> new AutoDisablePolicy.StatusThreshold(status.getStatus(), status.getTimes()))
                        .toList();
        return new AutoDisablePolicy(config.isEnabled(), thresholds);
    }
}
