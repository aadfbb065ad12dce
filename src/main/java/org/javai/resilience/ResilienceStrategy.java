package org.javai.resilience;

import org.javai.resilience.cancel.CancellationToken;

import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * A strategy governs how an operation is executed: how often, with which delays, and how its
 * attempts are observed.
 *
 * <p>Every strategy implements the single operation
 * {@link #executeOutcome(ResilienceCallback, ResilienceContext, Object)}. Strategies compose by
 * nesting: the callback handed to an outer strategy invokes an inner strategy's
 * {@code executeOutcome}.</p>
 *
 * <pre>{@code
 * Outcome<String> outcome = retry.executeOutcome(
 *     (context, state) -> timeout.executeOutcome(callback, context, state),
 *     context,
 *     request);
 * }</pre>
 *
 * <p>The convenience methods acquire a context from the shared {@link ResilienceContextPool},
 * capture exceptions raised by the work into an {@link Outcome}, and release the context
 * when the execution completes.</p>
 *
 * @param <T> The type of the successful value
 */
public abstract class ResilienceStrategy<T> {

    /**
     * Executes the callback under this strategy.
     *
     * @param callback the operation to execute; may be invoked zero or more times
     * @param context the execution context, owned by the caller
     * @param state opaque state passed unchanged to every invocation of the callback
     * @return the outcome accepted by this strategy
     * @throws java.util.concurrent.CancellationException if the context's token is cancelled
     */
    public final <S> Outcome<T> executeOutcome(ResilienceCallback<T, S> callback, ResilienceContext context, S state) {
        Objects.requireNonNull(callback, "callback must not be null");
        Objects.requireNonNull(context, "context must not be null");
        return executeCore(callback, context, state);
    }

    /**
     * Strategy-specific execution. Arguments have already been validated.
     */
    protected abstract <S> Outcome<T> executeCore(ResilienceCallback<T, S> callback, ResilienceContext context, S state);

    /**
     * Invokes the callback, turning a {@link RuntimeException} it raises into a failed outcome.
     * Errors still propagate.
     */
    protected static <T, S> Outcome<T> invokeCallback(ResilienceCallback<T, S> callback, ResilienceContext context, S state) {
        try {
            return callback.execute(context, state);
        } catch (RuntimeException e) {
            return Outcome.fail(e);
        }
    }

    /**
     * Executes work that may throw, returning its outcome instead of throwing.
     *
     * @param work the work to execute
     * @return the accepted outcome
     */
    public Outcome<T> executeOutcome(ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        return executePooled(null, CancellationToken.NONE, (context, w) -> Outcome.of(w), work);
    }

    /**
     * Executes work that may throw, returning its value or rethrowing its failure.
     *
     * @param work the work to execute
     * @return the value of the accepted outcome
     * @throws OutcomeFailedException if the accepted outcome carries a checked exception
     */
    public T execute(ThrowingSupplier<T, ? extends Exception> work) {
        return executeOutcome(work).getOrThrow();
    }

    /**
     * Executes context-aware work under the given cancellation token.
     *
     * @param work the work to execute
     * @param cancellationToken the token observed by this execution
     * @return the value of the accepted outcome
     * @throws OutcomeFailedException if the accepted outcome carries a checked exception
     * @throws java.util.concurrent.CancellationException if the execution is cancelled
     */
    public T execute(ThrowingFunction<T, ? extends Exception> work, CancellationToken cancellationToken) {
        return execute(null, work, cancellationToken);
    }

    /**
     * Executes context-aware work for a named operation under the given cancellation token.
     *
     * @param operationKey the operation key reported in telemetry, may be null
     * @param work the work to execute
     * @param cancellationToken the token observed by this execution
     * @return the value of the accepted outcome
     */
    public T execute(String operationKey, ThrowingFunction<T, ? extends Exception> work, CancellationToken cancellationToken) {
        Objects.requireNonNull(work, "work must not be null");
        return executePooled(operationKey, cancellationToken, (context, w) -> Outcome.of(() -> w.apply(context)), work)
                .getOrThrow();
    }

    private <S> Outcome<T> executePooled(String operationKey, CancellationToken cancellationToken,
                                         ResilienceCallback<T, S> callback, S state) {
        ResilienceContextPool pool = ResilienceContextPool.shared();
        ResilienceContext context = pool.get(operationKey, cancellationToken);
        try {
            return executeOutcome(callback, context, state);
        } finally {
            pool.release(context);
        }
    }

    /**
     * Returns a strategy that invokes the callback exactly once and returns its outcome.
     */
    public static <T> ResilienceStrategy<T> empty() {
        return new ResilienceStrategy<>() {
            @Override
            protected <S> Outcome<T> executeCore(ResilienceCallback<T, S> callback, ResilienceContext context, S state) {
                context.cancellationToken().throwIfCancellationRequested();
                Outcome<T> outcome = invokeCallback(callback, context, state);
                if (outcome.exception() instanceof CancellationException cancellation
                        && context.cancellationToken().isCancellationRequested()) {
                    throw cancellation;
                }
                return outcome;
            }

            @Override
            public String toString() {
                return "ResilienceStrategy.empty()";
            }
        };
    }
}
