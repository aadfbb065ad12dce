package org.javai.resilience.time;

import org.javai.resilience.cancel.CancellationToken;

import java.math.BigInteger;
import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Source of monotonic timestamps and cancellable delays.
 * Strategies take time from an injected provider so that tests can run deterministically.
 */
public interface TimeProvider {

    /**
     * Returns a monotonic timestamp measured in units of {@link #timestampFrequency()} per second.
     */
    long timestamp();

    /**
     * The number of timestamp units per second.
     */
    long timestampFrequency();

    /**
     * Blocks for the given duration, or until the token is cancelled.
     *
     * @param delay how long to wait; zero or negative returns immediately
     * @param cancellationToken the token observed while waiting
     * @throws CancellationException if the token is, or becomes, cancelled before the delay elapses
     */
    void delay(Duration delay, CancellationToken cancellationToken);

    /**
     * Returns the time elapsed between two timestamps taken from this provider.
     */
    default Duration elapsed(long startTimestamp, long endTimestamp) {
        long ticks = endTimestamp - startTimestamp;
        long frequency = timestampFrequency();
        long seconds = ticks / frequency;
        long remainder = ticks % frequency;
        long nanos;
        if (Math.abs(remainder) <= Long.MAX_VALUE / 1_000_000_000L) {
            nanos = remainder * 1_000_000_000L / frequency;
        } else {
            // Frequencies above one tick per nanosecond overflow the direct product.
            nanos = BigInteger.valueOf(remainder)
                    .multiply(BigInteger.valueOf(1_000_000_000L))
                    .divide(BigInteger.valueOf(frequency))
                    .longValue();
        }
        return Duration.ofSeconds(seconds, nanos);
    }

    /**
     * Returns the time elapsed since a timestamp taken from this provider.
     */
    default Duration elapsedSince(long startTimestamp) {
        return elapsed(startTimestamp, timestamp());
    }

    /**
     * Returns the provider backed by {@link System#nanoTime()}.
     */
    static TimeProvider system() {
        return SystemTimeProvider.INSTANCE;
    }
}
