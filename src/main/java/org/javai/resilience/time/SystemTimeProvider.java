package org.javai.resilience.time;

import org.javai.resilience.cancel.CancellationRegistration;
import org.javai.resilience.cancel.CancellationToken;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * {@link TimeProvider} backed by {@link System#nanoTime()}.
 *
 * <p>Delays park the calling thread on a latch that the cancellation token releases, so a
 * cancelled delay returns as soon as the token fires.
 */
final class SystemTimeProvider implements TimeProvider {

    static final SystemTimeProvider INSTANCE = new SystemTimeProvider();

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private SystemTimeProvider() {}

    @Override
    public long timestamp() {
        return System.nanoTime();
    }

    @Override
    public long timestampFrequency() {
        return NANOS_PER_SECOND;
    }

    @Override
    public void delay(Duration delay, CancellationToken cancellationToken) {
        Objects.requireNonNull(delay, "delay must not be null");
        Objects.requireNonNull(cancellationToken, "cancellationToken must not be null");
        cancellationToken.throwIfCancellationRequested();
        if (delay.isZero() || delay.isNegative()) {
            return;
        }

        CountDownLatch cancelled = new CountDownLatch(1);
        try (CancellationRegistration ignored = cancellationToken.register(cancelled::countDown)) {
            cancelled.await(saturatedNanos(delay), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException("The delay was interrupted");
            cancellation.initCause(e);
            throw cancellation;
        }
        cancellationToken.throwIfCancellationRequested();
    }

    private static long saturatedNanos(Duration delay) {
        try {
            return delay.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
