package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Arguments handed to a {@link RetryDelayGenerator}.
 *
 * @param attemptNumber the 0-based number of the attempt that produced the outcome
 * @param delayHint the delay the configured backoff would use
 */
public record RetryDelayArguments(int attemptNumber, Duration delayHint) {

    public RetryDelayArguments {
        Objects.requireNonNull(delayHint, "delayHint must not be null");
    }
}
