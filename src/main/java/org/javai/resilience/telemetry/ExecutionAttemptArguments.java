package org.javai.resilience.telemetry;

import java.time.Duration;
import java.util.Objects;

/**
 * Arguments of the {@code ExecutionAttempt} event, emitted once per attempt.
 *
 * @param attemptNumber the 0-based attempt number
 * @param executionTime how long the attempt took
 * @param handled whether the outcome was classified as retryable
 */
public record ExecutionAttemptArguments(int attemptNumber, Duration executionTime, boolean handled) {

    public static final String EVENT_NAME = "ExecutionAttempt";

    public ExecutionAttemptArguments {
        Objects.requireNonNull(executionTime, "executionTime must not be null");
    }
}
