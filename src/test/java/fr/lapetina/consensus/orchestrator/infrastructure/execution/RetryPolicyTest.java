package fr.lapetina.consensus.orchestrator.infrastructure.execution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    @DisplayName("disabled policy should never retry")
    void disabledShouldNeverRetry() {
        assertThat(RetryPolicy.disabled().retriesFor(5)).isZero();
    }

    @Test
    @DisplayName("enabled policy should allow the backend's retries")
    void enabledShouldAllowConfiguredRetries() {
        RetryPolicy policy = RetryPolicy.exponential(Duration.ofMillis(100), Duration.ofSeconds(2), 2.0);

        assertThat(policy.retriesFor(3)).isEqualTo(3);
        assertThat(policy.retriesFor(-1)).isZero();
    }

    @Test
    @DisplayName("backoff should grow exponentially up to the cap")
    void backoffShouldGrowUpToCap() {
        RetryPolicy policy = RetryPolicy.exponential(Duration.ofMillis(100), Duration.ofMillis(500), 2.0);

        assertThat(policy.backoffBefore(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.backoffBefore(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.backoffBefore(3)).isEqualTo(Duration.ofMillis(400));
        assertThat(policy.backoffBefore(4)).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("should reject a shrinking multiplier")
    void shouldRejectShrinkingMultiplier() {
        assertThatThrownBy(() -> RetryPolicy.exponential(Duration.ofMillis(100), Duration.ofSeconds(1), 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
