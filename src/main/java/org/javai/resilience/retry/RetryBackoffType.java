package org.javai.resilience.retry;

/**
 * How the delay between retries grows with the attempt number.
 */
public enum RetryBackoffType {

    /**
     * The base delay for every attempt.
     */
    CONSTANT,

    /**
     * {@code baseDelay * (attempt + 1)}.
     */
    LINEAR,

    /**
     * {@code baseDelay * 2^attempt}, with the exponent capped at {@link RetryConstants#MAX_RETRY_COUNT}.
     */
    EXPONENTIAL
}
