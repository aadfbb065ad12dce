package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Computes retry delays.
 *
 * <p>All arithmetic saturates at {@link RetryConstants#MAX_DELAY} instead of overflowing, so a
 * delay can be computed for any attempt number, including those reached with an infinite
 * retry count.
 */
public final class RetryHelper {

    private static final long MAX_NANOS = Long.MAX_VALUE;

    private RetryHelper() {}

    /**
     * Computes the delay without jitter.
     */
    public static Duration getRetryDelay(RetryBackoffType type, int attempt, Duration baseDelay) {
        return getRetryDelay(type, false, attempt, baseDelay, () -> 0.5);
    }

    /**
     * Computes the delay before the retry that follows the given attempt.
     *
     * @param type the backoff shape
     * @param useJitter whether to randomize the delay within the jitter window
     * @param attempt the 0-based number of the attempt that just completed
     * @param baseDelay the base delay, must not be negative
     * @param randomizer source of values in {@code [0, 1)}, used only with jitter
     * @return the delay, never negative and never above {@link RetryConstants#MAX_DELAY}
     */
    public static Duration getRetryDelay(RetryBackoffType type, boolean useJitter, int attempt,
                                         Duration baseDelay, DoubleSupplier randomizer) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(randomizer, "randomizer must not be null");
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, was: " + attempt);
        }
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative, was: " + baseDelay);
        }
        if (baseDelay.isZero()) {
            return Duration.ZERO;
        }

        long base = toNanosSaturated(baseDelay);
        long nanos = switch (type) {
            case CONSTANT -> base;
            case LINEAR -> multiplySaturated(base, (long) attempt + 1);
            case EXPONENTIAL -> shiftSaturated(base, Math.min(attempt, RetryConstants.MAX_RETRY_COUNT));
        };

        if (useJitter) {
            nanos = applyJitter(nanos, randomizer.getAsDouble());
        }
        return Duration.ofNanos(nanos);
    }

    /**
     * Returns the delay truncated to the ceiling, or unchanged when there is no ceiling.
     */
    public static Duration applyMaxDelay(Duration delay, Duration maxDelay) {
        if (maxDelay != null && delay.compareTo(maxDelay) > 0) {
            return maxDelay;
        }
        return delay;
    }

    static long toNanosSaturated(Duration duration) {
        if (duration.compareTo(RetryConstants.MAX_DELAY) >= 0) {
            return MAX_NANOS;
        }
        return duration.toNanos();
    }

    static long multiplySaturated(long value, long factor) {
        if (value > MAX_NANOS / factor) {
            return MAX_NANOS;
        }
        return value * factor;
    }

    static long shiftSaturated(long value, int exponent) {
        if (exponent >= Long.SIZE - 1 || value > (MAX_NANOS >> exponent)) {
            return MAX_NANOS;
        }
        return value << exponent;
    }

    static long applyJitter(long nanos, double random) {
        if (random < 0 || random >= 1 || Double.isNaN(random)) {
            throw new IllegalArgumentException("randomizer must return a value in [0, 1), was: " + random);
        }
        double factor = 1 - RetryConstants.JITTER_FACTOR / 2 + RetryConstants.JITTER_FACTOR * random;
        double jittered = nanos * factor;
        if (jittered >= MAX_NANOS) {
            return MAX_NANOS;
        }
        return (long) jittered;
    }
}
