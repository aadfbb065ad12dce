package org.javai.resilience;

/**
 * A context-aware operation that may throw a checked exception.
 *
 * @param <T> The type of value returned
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingFunction<T, E extends Exception> {

    T apply(ResilienceContext context) throws E;
}
