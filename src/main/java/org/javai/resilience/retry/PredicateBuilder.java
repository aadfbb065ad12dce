package org.javai.resilience.retry;

import org.javai.resilience.Outcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.Predicate;

/**
 * Builds a {@link RetryPredicate} from exception-type and result-value conditions.
 *
 * <p>The built predicate handles an outcome if any condition matches. A
 * {@link CancellationException} is never handled, whatever the conditions say.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryPredicate<HttpResponse<String>> shouldHandle = new PredicateBuilder<HttpResponse<String>>()
 *     .handle(IOException.class)
 *     .handle(HttpTimeoutException.class)
 *     .handleResult(response -> response.statusCode() >= 500)
 *     .build();
 * }</pre>
 *
 * @param <T> The type of the successful value
 */
public final class PredicateBuilder<T> {

    private final List<Predicate<Outcome<T>>> conditions = new ArrayList<>();

    /**
     * Handles failures whose exception is an instance of the given type.
     */
    public PredicateBuilder<T> handle(Class<? extends Throwable> type) {
        Objects.requireNonNull(type, "type must not be null");
        conditions.add(outcome -> type.isInstance(outcome.exception()));
        return this;
    }

    /**
     * Handles failures whose exception is an instance of the given type and satisfies the condition.
     */
    public <E extends Throwable> PredicateBuilder<T> handle(Class<E> type, Predicate<? super E> condition) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        conditions.add(outcome -> type.isInstance(outcome.exception()) && condition.test(type.cast(outcome.exception())));
        return this;
    }

    /**
     * Handles failures whose exception, or any exception in its cause chain, is an instance of
     * the given type.
     */
    public PredicateBuilder<T> handleInner(Class<? extends Throwable> type) {
        Objects.requireNonNull(type, "type must not be null");
        conditions.add(outcome -> causeChainContains(outcome.exception(), type));
        return this;
    }

    /**
     * Handles successful outcomes whose value equals the given value.
     */
    public PredicateBuilder<T> handleResult(T value) {
        conditions.add(outcome -> outcome.isOk() && Objects.equals(outcome.result(), value));
        return this;
    }

    /**
     * Handles successful outcomes whose value satisfies the condition.
     */
    public PredicateBuilder<T> handleResult(Predicate<? super T> condition) {
        Objects.requireNonNull(condition, "condition must not be null");
        conditions.add(outcome -> outcome.isOk() && condition.test(outcome.result()));
        return this;
    }

    /**
     * Builds the predicate.
     *
     * @throws IllegalStateException if no condition has been added
     */
    public RetryPredicate<T> build() {
        if (conditions.isEmpty()) {
            throw new IllegalStateException("at least one condition must be configured");
        }
        List<Predicate<Outcome<T>>> snapshot = List.copyOf(conditions);
        return args -> {
            Outcome<T> outcome = args.outcome();
            if (outcome.exception() instanceof CancellationException) {
                return false;
            }
            for (Predicate<Outcome<T>> condition : snapshot) {
                if (condition.test(outcome)) {
                    return true;
                }
            }
            return false;
        };
    }

    private static boolean causeChainContains(Throwable exception, Class<? extends Throwable> type) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = exception; current != null && seen.add(current); current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
        }
        return false;
    }
}
