package org.javai.resilience.cancel;

import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * An observable cancellation signal.
 *
 * <p>Tokens are handed out by a {@link CancellationTokenSource}; whoever holds the source decides
 * when to cancel. Executions only observe the token, they never own it.
 */
public final class CancellationToken {

    /**
     * A token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken(null);

    private final CancellationTokenSource source;

    CancellationToken(CancellationTokenSource source) {
        this.source = source;
    }

    public boolean isCancellationRequested() {
        return source != null && source.isCancellationRequested();
    }

    /**
     * Whether this token can ever become cancelled.
     */
    public boolean canBeCancelled() {
        return source != null;
    }

    /**
     * Throws a {@link CancellationException} if cancellation has been requested.
     */
    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("The operation was cancelled");
        }
    }

    /**
     * Registers a callback invoked when cancellation is requested.
     * If the token is already cancelled, the callback runs immediately on the calling thread.
     *
     * @param callback the callback to run
     * @return a registration that removes the callback when closed
     */
    public CancellationRegistration register(Runnable callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        if (source == null) {
            return CancellationRegistration.NONE;
        }
        return source.register(callback);
    }
}
