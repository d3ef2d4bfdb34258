package com.fragmentdl.services;

import com.fragmentdl.config.EngineProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void backoffGrowsGeometrically() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(1), 2.0, Duration.ZERO);

        assertThat(policy.backoffFor(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.backoffFor(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.backoffFor(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.backoffFor(4)).isEqualTo(Duration.ofSeconds(8));
    }

    @Test
    void backoffIsStrictlyIncreasing() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofMillis(100), 1.5, Duration.ZERO);

        for (int attempt = 1; attempt < 10; attempt++) {
            assertThat(policy.backoffFor(attempt + 1)).isGreaterThan(policy.backoffFor(attempt));
        }
    }

    @Test
    void jitterStaysWithinBound() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofMillis(250));
        Random random = new Random(7);

        for (int i = 0; i < 100; i++) {
            Duration delay = policy.delayFor(2, random);
            assertThat(delay).isBetween(Duration.ofSeconds(2), Duration.ofMillis(2250));
        }
    }

    @Test
    void attemptBudget() {
        RetryPolicy policy = RetryPolicy.of(3, EngineProperties.defaults().retry());

        assertThat(policy.canRetry(1)).isTrue();
        assertThat(policy.canRetry(2)).isTrue();
        assertThat(policy.canRetry(3)).isFalse();
        assertThat(policy.baseDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.multiplier()).isEqualTo(2.0);
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ofSeconds(1), 2.0, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ZERO).backoffFor(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
