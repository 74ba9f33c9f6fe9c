package com.jonathantong.WalShift.consumer;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void fixedPolicy_retriesForeverWithSameDelay() {
        RetryPolicy policy = RetryPolicy.fixed(Duration.ofSeconds(2));

        assertThat(policy.canRetry(1)).isTrue();
        assertThat(policy.canRetry(10_000)).isTrue();
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayFor(50)).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void exponentialPolicy_growsUntilCap() {
        RetryPolicy policy = new RetryPolicy(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10), 0);

        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayFor(4)).isEqualTo(Duration.ofSeconds(8));
        assertThat(policy.delayFor(5)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.delayFor(500)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void boundedPolicy_stopsAfterMaxAttempts() {
        RetryPolicy policy = new RetryPolicy(Duration.ZERO, 1.0, Duration.ZERO, 3);

        assertThat(policy.canRetry(3)).isTrue();
        assertThat(policy.canRetry(4)).isFalse();
    }

    @Test
    void invalidSettings_areRejected() {
        assertThatThrownBy(() -> new RetryPolicy(Duration.ofSeconds(-1), 1.0, Duration.ZERO, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(Duration.ofSeconds(1), 0.5, Duration.ofSeconds(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(Duration.ofSeconds(1), 1.0, Duration.ofSeconds(1), -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryPolicy.fixed(Duration.ofSeconds(1)).delayFor(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
