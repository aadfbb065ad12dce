package org.javai.resilience.retry;

import org.javai.resilience.OutcomeArguments;

/**
 * Decides whether the outcome of an attempt should be retried.
 * Implementations must not modify the outcome; an exception they throw aborts the execution.
 *
 * @param <T> The type of the successful value
 * @see PredicateBuilder
 */
@FunctionalInterface
public interface RetryPredicate<T> {

    boolean shouldHandle(OutcomeArguments<T, RetryPredicateArguments> args);

    /**
     * A predicate that never retries.
     */
    static <T> RetryPredicate<T> never() {
        return args -> false;
    }

    /**
     * A predicate that retries every outcome, successful or not.
     */
    static <T> RetryPredicate<T> always() {
        return args -> true;
    }
}
