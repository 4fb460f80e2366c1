package com.baykanat.cardflow.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the bundle retry backoff.
 */
class DeliveryRetryPolicyTest {

    private final DeliveryRetryPolicy policy = new DeliveryRetryPolicy(Duration.ofMinutes(1), Duration.ofHours(1));

    @Test
    @DisplayName("First retry is around the base delay with jitter")
    void firstRetryNearBase() {
        for (int i = 0; i < 50; i++) {
            assertThat(policy.delayFor(1)).isBetween(Duration.ofSeconds(30), Duration.ofSeconds(90));
        }
    }

    @Test
    @DisplayName("Delay grows exponentially")
    void delayGrows() {
        for (int i = 0; i < 50; i++) {
            assertThat(policy.delayFor(4)).isBetween(Duration.ofMinutes(4), Duration.ofMinutes(12));
        }
    }

    @Test
    @DisplayName("Delay never exceeds the configured maximum, even for huge attempt counts")
    void delayIsCapped() {
        for (int attempts : new int[]{7, 20, 31, 1000}) {
            Duration delay = policy.delayFor(attempts);
            assertThat(delay).isLessThanOrEqualTo(Duration.ofHours(1));
            assertThat(delay).isGreaterThanOrEqualTo(Duration.ofMinutes(30));
        }
    }

    @Test
    @DisplayName("No delay before the first attempt")
    void zeroAttempts() {
        assertThat(policy.delayFor(0)).isEqualTo(Duration.ZERO);
    }

    @Test
    @DisplayName("Invalid configuration is rejected")
    void invalidConfiguration() {
        assertThatThrownBy(() -> new DeliveryRetryPolicy(Duration.ZERO, Duration.ofHours(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DeliveryRetryPolicy(Duration.ofMinutes(5), Duration.ofMinutes(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
