package org.javai.resilience.cancel;

import java.util.ArrayList;
import java.util.List;

/**
 * Owns a {@link CancellationToken} and signals cancellation to everything observing it.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * CancellationTokenSource source = new CancellationTokenSource();
 * ResilienceContext context = ResilienceContextPool.shared().get(source.token());
 * // ... hand the context to an execution, then from any thread:
 * source.cancel();
 * }</pre>
 */
public final class CancellationTokenSource {

    private final Object lock = new Object();
    private final List<Runnable> callbacks = new ArrayList<>();
    private final CancellationToken token = new CancellationToken(this);
    private volatile boolean cancelled;

    /**
     * Returns the token observed by executions.
     */
    public CancellationToken token() {
        return token;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    /**
     * Requests cancellation. Registered callbacks run synchronously on the calling thread,
     * exactly once. Subsequent calls have no effect.
     *
     * <p>If a callback throws, the remaining callbacks still run and the first exception is
     * rethrown afterwards.
     */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = List.copyOf(callbacks);
            callbacks.clear();
        }

        RuntimeException first = null;
        for (Runnable callback : toRun) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }

    CancellationRegistration register(Runnable callback) {
        synchronized (lock) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (lock) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        callback.run();
        return CancellationRegistration.NONE;
    }
}
