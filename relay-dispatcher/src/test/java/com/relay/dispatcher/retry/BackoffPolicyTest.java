package com.relay.dispatcher.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffPolicyTest {

    @Test
    void doublesFromBaseDelay() {
        BackoffPolicy backoff = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), false);

        assertThat(backoff.delayFor(0)).isEqualTo(Duration.ofSeconds(1));
        assertThat(backoff.delayFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(backoff.delayFor(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(backoff.delayFor(5)).isEqualTo(Duration.ofSeconds(32));
    }

    @Test
    void cappedAtMaxDelay() {
        BackoffPolicy backoff = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), false);

        assertThat(backoff.delayFor(6)).isEqualTo(Duration.ofSeconds(60));
        assertThat(backoff.delayFor(100)).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void jitterScalesBetweenHalfAndOneAndAHalf() {
        Duration base = Duration.ofSeconds(2);
        Duration max = Duration.ofSeconds(60);

        assertThat(new BackoffPolicy(base, max, true, () -> 0.0).delayFor(0))
                .isEqualTo(Duration.ofSeconds(1));
        assertThat(new BackoffPolicy(base, max, true, () -> 0.5).delayFor(0))
                .isEqualTo(Duration.ofSeconds(2));
        assertThat(new BackoffPolicy(base, max, true, () -> 0.999).delayFor(0))
                .isBetween(Duration.ofMillis(2990), Duration.ofSeconds(3));
    }

    @Test
    void jitterWithRealRandomStaysInRange() {
        BackoffPolicy backoff = new BackoffPolicy(Duration.ofSeconds(4), Duration.ofSeconds(60), true);

        for (int i = 0; i < 200; i++) {
            assertThat(backoff.delayFor(0)).isBetween(Duration.ofSeconds(2), Duration.ofSeconds(6));
        }
    }

    @Test
    void worstCaseTotalIsCappedGeometricSum() {
        BackoffPolicy backoff = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(5), false);

        // 1 + 2 + 4 + 5 + 5
        assertThat(backoff.maxTotalDelay(5)).isEqualTo(Duration.ofSeconds(17));
        assertThat(backoff.maxTotalDelay(0)).isEqualTo(Duration.ZERO);

        BackoffPolicy jittered = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), true);
        assertThat(jittered.maxTotalDelay(3)).isEqualTo(Duration.ofMillis(10_500));
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ofSeconds(10), Duration.ofSeconds(1), false))
                .isInstanceOf(IllegalArgumentException.class);
        BackoffPolicy backoff = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(2), false);
        assertThatThrownBy(() -> backoff.delayFor(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
