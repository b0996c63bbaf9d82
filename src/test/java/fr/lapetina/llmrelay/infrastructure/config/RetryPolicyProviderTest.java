package fr.lapetina.llmrelay.infrastructure.config;

import fr.lapetina.llmrelay.domain.model.AutoDisablePolicy;
import fr.lapetina.llmrelay.domain.model.LoadBalancerStrategyType;
import fr.lapetina.llmrelay.domain.model.RetryPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyProviderTest {

    @Test
    @DisplayName("should map the retry section to a policy")
    void shouldMapRetryConfig() {
        RelayConfig config = new RelayConfig();
        config.getRetry().setEnabled(false);
        config.getRetry().setMaxChannelRetries(4);
        config.getRetry().setMaxSingleChannelRetries(1);
        config.getRetry().setRetryDelayMs(250);
        config.getRetry().setLoadBalancerStrategy("Weighted");

        RetryPolicy policy = new RetryPolicyProvider(() -> config).snapshot();

        assertThat(policy).isEqualTo(new RetryPolicy(false, 4, 1, 250, LoadBalancerStrategyType.WEIGHTED));
    }

    @Test
    @DisplayName("should map auto-disable thresholds in declaration order")
    void shouldMapAutoDisable() {
        RelayConfig config = new RelayConfig();
        RelayConfig.StatusConfig unauthorized = new RelayConfig.StatusConfig();
        unauthorized.setStatus(401);
        RelayConfig.StatusConfig rateLimited = new RelayConfig.StatusConfig();
        rateLimited.setStatus(429);
        rateLimited.setTimes(5);
        config.getRetry().getAutoDisableChannel().setEnabled(true);
        config.getRetry().getAutoDisableChannel().setStatuses(List.of(unauthorized, rateLimited));

        AutoDisablePolicy autoDisable = new RetryPolicyProvider(() -> config).snapshot().autoDisableChannel();

        assertThat(autoDisable.enabled()).isTrue();
        assertThat(autoDisable.statuses()).containsExactly(
                new AutoDisablePolicy.StatusThreshold(401, 1),
                new AutoDisablePolicy.StatusThreshold(429, 5));
        assertThat(autoDisable.thresholdFor(429)).hasValue(5);
        assertThat(autoDisable.thresholdFor(500)).isEmpty();
    }

    @Test
    @DisplayName("should return defaults before any configuration is loaded")
    void shouldReturnDefaultsWithoutConfig() {
        RetryPolicy policy = new RetryPolicyProvider(() -> null).snapshot();

        assertThat(policy).isEqualTo(RetryPolicy.defaults());
    }

    @Test
    @DisplayName("should not change a snapshot already taken when the configuration changes")
    void shouldIsolateSnapshots() {
        RelayConfig first = new RelayConfig();
        AtomicReference<RelayConfig> current = new AtomicReference<>(first);
        RetryPolicyProvider provider = new RetryPolicyProvider(current::get);

        RetryPolicy before = provider.snapshot();
        RelayConfig second = new RelayConfig();
        second.getRetry().setMaxChannelRetries(9);
        current.set(second);
        RetryPolicy after = provider.snapshot();

        assertThat(before.maxChannelRetries()).isEqualTo(3);
        assertThat(after.maxChannelRetries()).isEqualTo(9);
    }
}
