package org.javai.resilience;

/**
 * The operation a {@link ResilienceStrategy} executes on behalf of the caller.
 *
 * <p>A callback reports failure by returning {@link Outcome.Fail}. A {@link RuntimeException}
 * it throws is treated the same way: strategies capture it into a failed outcome and classify
 * it like any other. A cancellation raised while the caller's token is cancelled is rethrown
 * instead. A callback may be
 * invoked any number of times for one execution, always with the same {@code state} and with
 * a context whose attempt number reflects the current attempt. When strategies are nested,
 * the outer strategy's callback is the inner strategy's
 * {@link ResilienceStrategy#executeOutcome(ResilienceCallback, ResilienceContext, Object)}.
 *
 * @param <T> The type of the successful value
 * @param <S> The type of the caller-supplied state
 */
@FunctionalInterface
public interface ResilienceCallback<T, S> {

    Outcome<T> execute(ResilienceContext context, S state);
}
