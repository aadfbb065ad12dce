package org.javai.resilience.retry;

import org.javai.resilience.OutcomeArguments;

/**
 * Invoked once a retry has been decided, before the delay starts.
 *
 * <p>The outcome being retried is still intact during the call and is disposed afterwards. The
 * listener may request cancellation; the strategy then stops before the next attempt. An
 * exception thrown by the listener aborts the execution.
 *
 * @param <T> The type of the successful value
 */
@FunctionalInterface
public interface OnRetryListener<T> {

    void onRetry(OutcomeArguments<T, OnRetryArguments> args);
}
