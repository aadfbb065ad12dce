package org.javai.resilience;

import java.util.Objects;

/**
 * What a strategy hands to user-supplied predicates, hooks and generators: the outcome being
 * evaluated, the execution context and strategy-specific arguments.
 *
 * @param context the execution context
 * @param outcome the outcome of the attempt
 * @param arguments the strategy-specific arguments
 * @param <T> The type of the successful value
 * @param <A> The type of the arguments
 */
public record OutcomeArguments<T, A>(ResilienceContext context, Outcome<T> outcome, A arguments) {

    public OutcomeArguments {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");
    }

    /**
     * The value of a successful outcome, or null.
     */
    public T result() {
        return outcome.result();
    }

    /**
     * The exception of a failed outcome, or null.
     */
    public Throwable exception() {
        return outcome.exception();
    }
}
