package org.javai.resilience.retry;

/**
 * Arguments handed to a {@link RetryPredicate}.
 *
 * @param attemptNumber the 0-based number of the attempt that produced the outcome
 */
public record RetryPredicateArguments(int attemptNumber) {
}
