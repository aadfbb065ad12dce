package org.javai.resilience.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class RetryHelperTest {

    @Test
    void constant_returnsBaseDelayForEveryAttempt() {
        Duration base = Duration.ofMillis(300);

        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.CONSTANT, 0, base)).isEqualTo(base);
        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.CONSTANT, 7, base)).isEqualTo(base);
        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.CONSTANT, Integer.MAX_VALUE, base)).isEqualTo(base);
    }

    @Test
    void linear_growsByBaseDelayPerAttempt() {
        Duration base = Duration.ofSeconds(2);

        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.LINEAR, 0, base)).isEqualTo(Duration.ofSeconds(2));
        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.LINEAR, 1, base)).isEqualTo(Duration.ofSeconds(4));
        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.LINEAR, 2, base)).isEqualTo(Duration.ofSeconds(6));
    }

    @Test
    void exponential_doublesPerAttempt() {
        Duration base = Duration.ofMillis(100);

        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.EXPONENTIAL, 0, base)).isEqualTo(Duration.ofMillis(100));
        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.EXPONENTIAL, 1, base)).isEqualTo(Duration.ofMillis(200));
        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.EXPONENTIAL, 2, base)).isEqualTo(Duration.ofMillis(400));
        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.EXPONENTIAL, 10, base)).isEqualTo(Duration.ofMillis(102_400));
    }

    @Test
    void exponential_saturatesForLargeAttempts() {
        Duration base = Duration.ofNanos(1);

        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.EXPONENTIAL, 62, base)).isEqualTo(Duration.ofNanos(1L << 62));
        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.EXPONENTIAL, 63, base)).isEqualTo(RetryConstants.MAX_DELAY);
        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.EXPONENTIAL, RetryConstants.MAX_RETRY_COUNT, base))
                .isEqualTo(RetryConstants.MAX_DELAY);
        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.EXPONENTIAL, Integer.MAX_VALUE, Duration.ofDays(365)))
                .isEqualTo(RetryConstants.MAX_DELAY);
    }

    @Test
    void linear_saturatesForLargeAttempts() {
        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.LINEAR, Integer.MAX_VALUE, Duration.ofDays(365)))
                .isEqualTo(RetryConstants.MAX_DELAY);
    }

    @Test
    void hugeBaseDelay_saturates() {
        Duration huge = Duration.ofSeconds(Long.MAX_VALUE);

        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.CONSTANT, 0, huge)).isEqualTo(RetryConstants.MAX_DELAY);
    }

    @Test
    void zeroBaseDelay_alwaysZero() {
        for (RetryBackoffType type : RetryBackoffType.values()) {
            assertThat(RetryHelper.getRetryDelay(type, 50, Duration.ZERO)).isZero();
        }
    }

    @Test
    void jitter_staysWithinWindow() {
        Duration base = Duration.ofSeconds(4);

        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.CONSTANT, true, 0, base, () -> 0.0))
                .isEqualTo(Duration.ofSeconds(3));
        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.CONSTANT, true, 0, base, () -> 0.5))
                .isEqualTo(Duration.ofSeconds(4));
        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.CONSTANT, true, 0, base, () -> 0.999))
                .isBetween(Duration.ofSeconds(4), Duration.ofSeconds(5));
    }

    @Test
    void jitter_saturatesAtMaxDelay() {
        assertThat(RetryHelper.getRetryDelay(RetryBackoffType.EXPONENTIAL, true, 200, Duration.ofSeconds(1), () -> 0.99))
                .isEqualTo(RetryConstants.MAX_DELAY);
    }

    @Test
    void jitter_rejectsRandomOutsideUnitInterval() {
        assertThatThrownBy(() -> RetryHelper.getRetryDelay(RetryBackoffType.CONSTANT, true, 0, Duration.ofSeconds(1), () -> 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void negativeAttempt_rejected() {
        assertThatThrownBy(() -> RetryHelper.getRetryDelay(RetryBackoffType.CONSTANT, -1, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("attempt");
    }

    @Test
    void applyMaxDelay_truncatesOnlyAboveCeiling() {
        Duration ceiling = Duration.ofSeconds(5);

        assertThat(RetryHelper.applyMaxDelay(Duration.ofSeconds(9), ceiling)).isEqualTo(ceiling);
        assertThat(RetryHelper.applyMaxDelay(Duration.ofSeconds(2), ceiling)).isEqualTo(Duration.ofSeconds(2));
        assertThat(RetryHelper.applyMaxDelay(Duration.ofSeconds(9), null)).isEqualTo(Duration.ofSeconds(9));
    }
}
