package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Arguments handed to an {@link OnRetryListener} and reported with the {@code OnRetry} event.
 *
 * @param attemptNumber the 0-based number of the attempt being retried
 * @param retryDelay the delay before the next attempt
 * @param executionTime how long the attempt took
 */
public record OnRetryArguments(int attemptNumber, Duration retryDelay, Duration executionTime) {

    public static final String EVENT_NAME = "OnRetry";

    public OnRetryArguments {
        Objects.requireNonNull(retryDelay, "retryDelay must not be null");
        Objects.requireNonNull(executionTime, "executionTime must not be null");
    }
}
