package fr.lapetina.llmrelay.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    @DisplayName("should expose the documented defaults")
    void shouldExposeDefaults() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertThat(policy.enabled()).isTrue();
        assertThat(policy.maxChannelRetries()).isEqualTo(3);
        assertThat(policy.maxSingleChannelRetries()).isEqualTo(2);
        assertThat(policy.retryDelayMs()).isEqualTo(1000);
        assertThat(policy.loadBalancerStrategy()).isEqualTo(LoadBalancerStrategyType.ADAPTIVE);
    }

    @Test
    @DisplayName("should bound attempts by channels times attempts per channel")
    void shouldBoundAttempts() {
        RetryPolicy policy = new RetryPolicy(true, 3, 2, 0, LoadBalancerStrategyType.WEIGHTED);

        assertThat(policy.attemptsPerChannel()).isEqualTo(3);
        assertThat(policy.maxAttempts()).isEqualTo(9);
        assertThat(policy.withEnabled(false).maxAttempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("should allow zero channel retries")
    void shouldAllowZeroChannelRetries() {
        RetryPolicy policy = new RetryPolicy(true, 0, 0, 0, LoadBalancerStrategyType.ADAPTIVE);

        assertThat(policy.maxAttempts()).isZero();
    }

    @Test
    @DisplayName("should reject negative values")
    void shouldRejectNegativeValues() {
        assertThatThrownBy(() -> new RetryPolicy(true, -1, 0, 0, LoadBalancerStrategyType.ADAPTIVE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxChannelRetries");
        assertThatThrownBy(() -> new RetryPolicy(true, 1, -1, 0, LoadBalancerStrategyType.ADAPTIVE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxSingleChannelRetries");
        assertThatThrownBy(() -> new RetryPolicy(true, 1, 0, -5, LoadBalancerStrategyType.ADAPTIVE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retryDelayMs");
    }

    @Test
    @DisplayName("should keep auto-disable off unless configured")
    void shouldDefaultAutoDisableToOff() {
        RetryPolicy policy = new RetryPolicy(true, 1, 0, 0, LoadBalancerStrategyType.ADAPTIVE);

        assertThat(policy.autoDisableChannel()).isEqualTo(AutoDisablePolicy.disabled());
        assertThat(policy.autoDisableChannel().thresholdFor(401)).isEmpty();
        assertThat(policy.withEnabled(false).autoDisableChannel()).isEqualTo(AutoDisablePolicy.disabled());
    }

    @Test
    @DisplayName("should validate auto-disable thresholds")
    void shouldValidateAutoDisableThresholds() {
        assertThatThrownBy(() -> new AutoDisablePolicy.StatusThreshold(99, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("status");
        assertThatThrownBy(() -> new AutoDisablePolicy.StatusThreshold(401, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("times");
        assertThatThrownBy(() -> new AutoDisablePolicy(true, List.of(
                new AutoDisablePolicy.StatusThreshold(401, 1),
                new AutoDisablePolicy.StatusThreshold(401, 2))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Duplicate auto-disable status: 401");
    }

    @Test
    @DisplayName("should parse strategy names and default to adaptive")
    void shouldParseStrategyNames() {
        assertThat(LoadBalancerStrategyType.fromValue(null)).isEqualTo(LoadBalancerStrategyType.ADAPTIVE);
        assertThat(LoadBalancerStrategyType.fromValue(" Weighted ")).isEqualTo(LoadBalancerStrategyType.WEIGHTED);
        assertThatThrownBy(() -> LoadBalancerStrategyType.fromValue("round-robin"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
