package org.javai.resilience.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration of a {@link RetryResilienceStrategy}.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryStrategyOptions<Order> options = RetryStrategyOptions.<Order>builder()
 *     .shouldHandle(new PredicateBuilder<Order>().handle(IOException.class).build())
 *     .retryCount(5)
 *     .backoffType(RetryBackoffType.EXPONENTIAL)
 *     .baseDelay(Duration.ofMillis(200))
 *     .maxDelay(Duration.ofSeconds(10))
 *     .onRetry(args -> log.info("retrying after {}", args.arguments().retryDelay()))
 *     .build();
 * }</pre>
 *
 * @param <T> The type of the successful value
 */
public final class RetryStrategyOptions<T> {

    /**
     * Retry count meaning "retry for as long as the outcome is handled".
     */
    public static final int INFINITE_RETRY_COUNT = RetryConstants.INFINITE_RETRY_COUNT;

    private final String strategyName;
    private final RetryPredicate<T> shouldHandle;
    private final OnRetryListener<T> onRetry;
    private final int retryCount;
    private final RetryBackoffType backoffType;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final RetryDelayGenerator<T> retryDelayGenerator;
    private final boolean useJitter;

    private RetryStrategyOptions(Builder<T> builder) {
        this.strategyName = builder.strategyName;
        this.shouldHandle = builder.shouldHandle;
        this.onRetry = builder.onRetry;
        this.retryCount = builder.retryCount;
        this.backoffType = builder.backoffType;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.retryDelayGenerator = builder.retryDelayGenerator;
        this.useJitter = builder.useJitter;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * Returns options with every setting at its default: three retries that are never triggered.
     */
    public static <T> RetryStrategyOptions<T> defaults() {
        return new Builder<T>().build();
    }

    /**
     * Returns a builder initialised with these options.
     */
    public Builder<T> toBuilder() {
        return new Builder<T>()
                .strategyName(strategyName)
                .shouldHandle(shouldHandle)
                .onRetry(onRetry)
                .retryCount(retryCount)
                .backoffType(backoffType)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .retryDelayGenerator(retryDelayGenerator)
                .useJitter(useJitter);
    }

    public String strategyName() {
        return strategyName;
    }

    public RetryPredicate<T> shouldHandle() {
        return shouldHandle;
    }

    /**
     * The retry listener, or null.
     */
    public OnRetryListener<T> onRetry() {
        return onRetry;
    }

    public int retryCount() {
        return retryCount;
    }

    public boolean isInfinite() {
        return retryCount == INFINITE_RETRY_COUNT;
    }

    public RetryBackoffType backoffType() {
        return backoffType;
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    /**
     * The delay ceiling, or null when delays are not capped.
     */
    public Duration maxDelay() {
        return maxDelay;
    }

    /**
     * The delay override, or null.
     */
    public RetryDelayGenerator<T> retryDelayGenerator() {
        return retryDelayGenerator;
    }

    public boolean useJitter() {
        return useJitter;
    }

    @Override
    public String toString() {
        return "RetryStrategyOptions[strategyName=" + strategyName
                + ", retryCount=" + (isInfinite() ? "infinite" : String.valueOf(retryCount))
                + ", backoffType=" + backoffType
                + ", baseDelay=" + baseDelay
                + ", maxDelay=" + maxDelay
                + ", useJitter=" + useJitter + "]";
    }

    /**
     * Builder for {@link RetryStrategyOptions}.
     */
    public static final class Builder<T> {
        private String strategyName = RetryConstants.DEFAULT_STRATEGY_NAME;
        private RetryPredicate<T> shouldHandle = RetryPredicate.never();
        private OnRetryListener<T> onRetry;
        private int retryCount = RetryConstants.DEFAULT_RETRY_COUNT;
        private RetryBackoffType backoffType = RetryConstants.DEFAULT_BACKOFF_TYPE;
        private Duration baseDelay = RetryConstants.DEFAULT_BASE_DELAY;
        private Duration maxDelay;
        private RetryDelayGenerator<T> retryDelayGenerator;
        private boolean useJitter;

        private Builder() {}

        /**
         * Sets the name reported in telemetry (defaults to "Retry").
         */
        public Builder<T> strategyName(String strategyName) {
            this.strategyName = Objects.requireNonNull(strategyName, "strategyName must not be null");
            return this;
        }

        /**
         * Sets the predicate deciding which outcomes are retried (defaults to never).
         */
        public Builder<T> shouldHandle(RetryPredicate<T> shouldHandle) {
            this.shouldHandle = Objects.requireNonNull(shouldHandle, "shouldHandle must not be null");
            return this;
        }

        /**
         * Sets the listener invoked before each retry (optional).
         */
        public Builder<T> onRetry(OnRetryListener<T> onRetry) {
            this.onRetry = onRetry;
            return this;
        }

        /**
         * Sets the maximum number of retries (defaults to 3).
         *
         * @param retryCount a non-negative count, or {@link #INFINITE_RETRY_COUNT}; 0 means try once
         * @return this builder
         */
        public Builder<T> retryCount(int retryCount) {
            if (retryCount < 0 && retryCount != INFINITE_RETRY_COUNT) {
                throw new IllegalArgumentException(
                        "retryCount must be >= 0 or INFINITE_RETRY_COUNT, was: " + retryCount);
            }
            this.retryCount = retryCount;
            return this;
        }

        public Builder<T> backoffType(RetryBackoffType backoffType) {
            this.backoffType = Objects.requireNonNull(backoffType, "backoffType must not be null");
            return this;
        }

        /**
         * Sets the base delay of the backoff (defaults to 2 seconds).
         */
        public Builder<T> baseDelay(Duration baseDelay) {
            Objects.requireNonNull(baseDelay, "baseDelay must not be null");
            if (baseDelay.isNegative()) {
                throw new IllegalArgumentException("baseDelay must not be negative, was: " + baseDelay);
            }
            this.baseDelay = baseDelay;
            return this;
        }

        /**
         * Caps every delay, including generated ones (optional, null means no cap).
         */
        public Builder<T> maxDelay(Duration maxDelay) {
            if (maxDelay != null && maxDelay.isNegative()) {
                throw new IllegalArgumentException("maxDelay must not be negative, was: " + maxDelay);
            }
            this.maxDelay = maxDelay;
            return this;
        }

        /**
         * Sets a generator that replaces the computed delay (optional).
         */
        public Builder<T> retryDelayGenerator(RetryDelayGenerator<T> retryDelayGenerator) {
            this.retryDelayGenerator = retryDelayGenerator;
            return this;
        }

        /**
         * Randomizes computed delays within ±25% (defaults to false).
         */
        public Builder<T> useJitter(boolean useJitter) {
            this.useJitter = useJitter;
            return this;
        }

        public RetryStrategyOptions<T> build() {
            return new RetryStrategyOptions<>(this);
        }
    }
}
