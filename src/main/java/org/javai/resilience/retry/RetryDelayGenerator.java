package org.javai.resilience.retry;

import org.javai.resilience.OutcomeArguments;

import java.time.Duration;

/**
 * Overrides the delay computed by the configured backoff.
 *
 * @param <T> The type of the successful value
 */
@FunctionalInterface
public interface RetryDelayGenerator<T> {

    /**
     * Returns the delay before the next attempt.
     *
     * @param args the outcome being retried; {@link RetryDelayArguments#delayHint()} carries the
     *             delay the configured backoff would use
     * @return the delay to use, or null (or a negative duration) to use the hint
     */
    Duration generate(OutcomeArguments<T, RetryDelayArguments> args);
}
