package org.javai.resilience;

/**
 * A supplier that may throw a checked exception.
 * Used to hand operations that declare checked exceptions to a {@link ResilienceStrategy}.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
