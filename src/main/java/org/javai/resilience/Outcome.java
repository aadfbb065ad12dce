package org.javai.resilience;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Represents the outcome of a single execution attempt.
 * Either {@link Ok} containing the returned value, or {@link Fail} containing the exception
 * the operation raised.
 *
 * <p>An outcome owns its value until it is handed to the caller. When a strategy discards an
 * outcome (for example because it will be retried), it calls {@link #dispose()} so that values
 * holding external resources are released exactly once. The outcome returned to the caller is
 * never disposed by the strategy.
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome containing a value.
     *
     * @param value the returned value, may be null
     */
    record Ok<T>(T value) implements Outcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
        }

        @Override
        public T result() {
            return value;
        }

        @Override
        public Throwable exception() {
            return null;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public Outcome<T> recover(Function<? super Throwable, ? extends T> recovery) {
            return this;
        }

        @Override
        public void dispose() {
            if (value instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new OutcomeFailedException("Failed to release outcome value", e);
                }
            }
        }
    }

    /**
     * A failed outcome containing the exception raised by the operation.
     *
     * @param exception the captured exception
     */
    record Fail<T>(Throwable exception) implements Outcome<T> {

        /**
         * Canonical constructor with validation.
         */
        public Fail {
            Objects.requireNonNull(exception, "exception must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public T result() {
            return null;
        }

        @Override
        public T getOrThrow() {
            if (exception instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (exception instanceof Error error) {
                throw error;
            }
            throw new OutcomeFailedException(exception);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(exception);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return new Fail<>(exception);
        }

        @Override
        public Outcome<T> recover(Function<? super Throwable, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(exception));
        }

        @Override
        public void dispose() {
            // nothing is owned
        }
    }

    // Query methods
    boolean isOk();
    boolean isFail();

    /**
     * Returns the value of a successful outcome, or null for a failed one.
     */
    T result();

    /**
     * Returns the captured exception of a failed outcome, or null for a successful one.
     */
    Throwable exception();

    // Value extraction

    /**
     * Returns the value, or rethrows the captured exception.
     * Unchecked exceptions and errors are rethrown as-is; checked exceptions are wrapped
     * in an {@link OutcomeFailedException}.
     */
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations
    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);
    <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper);

    // Recovery
    Outcome<T> recover(Function<? super Throwable, ? extends T> recovery);

    /**
     * Releases the resource held by this outcome's value, if the value is {@link AutoCloseable}.
     *
     * <p>Only the owner of an outcome may dispose it, and only once. A checked exception raised
     * while closing is wrapped in an {@link OutcomeFailedException}.
     */
    void dispose();

    // Static factories
    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Throwable exception) {
        return new Fail<>(exception);
    }

    /**
     * Runs work that may throw, capturing any exception into a failed outcome.
     *
     * <p>Errors are not captured; they propagate to the caller.
     *
     * @param work the work to execute
     * @return Ok with the value, or Fail with the exception raised by the work
     */
    static <T> Outcome<T> of(ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        try {
            return new Ok<>(work.get());
        } catch (Exception e) {
            return new Fail<>(e);
        }
    }
}
