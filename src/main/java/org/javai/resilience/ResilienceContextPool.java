package org.javai.resilience;

import org.javai.resilience.cancel.CancellationToken;

import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool of reusable {@link ResilienceContext} instances.
 *
 * <p>Every context handed out by {@link #get()} is reset to its initial state. Callers return
 * it with {@link #release(ResilienceContext)} once the execution has completed, whether it
 * succeeded, failed or was cancelled.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ResilienceContext context = ResilienceContextPool.shared().get("orders.fetch", token);
 * try {
 *     Outcome<Order> outcome = strategy.executeOutcome(callback, context, orderId);
 * } finally {
 *     ResilienceContextPool.shared().release(context);
 * }
 * }</pre>
 */
public final class ResilienceContextPool {

    static final int DEFAULT_MAX_RETAINED = 256;

    private static final ResilienceContextPool SHARED = new ResilienceContextPool(DEFAULT_MAX_RETAINED);

    private final ConcurrentLinkedQueue<ResilienceContext> available = new ConcurrentLinkedQueue<>();
    private final AtomicInteger retained = new AtomicInteger();
    private final int maxRetained;

    /**
     * Creates a pool that keeps at most {@code maxRetained} idle contexts.
     *
     * @param maxRetained the number of released contexts kept for reuse
     */
    public ResilienceContextPool(int maxRetained) {
        if (maxRetained < 0) {
            throw new IllegalArgumentException("maxRetained must be >= 0, was: " + maxRetained);
        }
        this.maxRetained = maxRetained;
    }

    /**
     * The process-wide pool.
     */
    public static ResilienceContextPool shared() {
        return SHARED;
    }

    public ResilienceContext get() {
        return get(null, CancellationToken.NONE);
    }

    public ResilienceContext get(CancellationToken cancellationToken) {
        return get(null, cancellationToken);
    }

    /**
     * Acquires a reset context.
     *
     * @param operationKey the operation key, may be null
     * @param cancellationToken the caller's cancellation token
     * @return a context owned exclusively by the caller until released
     */
    public ResilienceContext get(String operationKey, CancellationToken cancellationToken) {
        Objects.requireNonNull(cancellationToken, "cancellationToken must not be null");

        ResilienceContext context = available.poll();
        if (context != null) {
            retained.decrementAndGet();
        } else {
            context = new ResilienceContext();
        }
        context.markInUse();
        return context.operationKey(operationKey).cancellationToken(cancellationToken);
    }

    /**
     * Resets the context and returns it to the pool.
     *
     * @param context a context previously obtained from this pool
     * @throws IllegalStateException if the context is not currently in use
     */
    public void release(ResilienceContext context) {
        Objects.requireNonNull(context, "context must not be null");
        if (!context.isInUse()) {
            throw new IllegalStateException("context is not in use, it was already released or never acquired");
        }
        context.reset();
        if (retained.incrementAndGet() <= maxRetained) {
            available.offer(context);
        } else {
            retained.decrementAndGet();
        }
    }

    int idleCount() {
        return retained.get();
    }
}
