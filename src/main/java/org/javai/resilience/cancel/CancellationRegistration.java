package org.javai.resilience.cancel;

/**
 * Handle for a callback registered on a {@link CancellationToken}.
 * Closing it removes the callback; closing it after cancellation has no effect.
 */
@FunctionalInterface
public interface CancellationRegistration extends AutoCloseable {

    CancellationRegistration NONE = () -> {};

    @Override
    void close();
}
