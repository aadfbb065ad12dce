package org.javai.resilience.retry;

import java.time.Duration;

/**
 * Defaults and limits of the retry strategy.
 */
public final class RetryConstants {

    public static final String DEFAULT_STRATEGY_NAME = "Retry";

    public static final int DEFAULT_RETRY_COUNT = 3;

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(2);

    public static final RetryBackoffType DEFAULT_BACKOFF_TYPE = RetryBackoffType.CONSTANT;

    /**
     * Retry count meaning "retry for as long as the outcome is handled".
     */
    public static final int INFINITE_RETRY_COUNT = -1;

    /**
     * The largest attempt number used when computing exponential backoff.
     * Later attempts reuse this exponent; the number of retries itself is not limited by it.
     */
    public static final int MAX_RETRY_COUNT = 100;

    /**
     * Every computed delay saturates at this value.
     */
    public static final Duration MAX_DELAY = Duration.ofNanos(Long.MAX_VALUE);

    /**
     * Width of the jitter window relative to the delay: jittered delays fall in
     * {@code [delay * 0.75, delay * 1.25)}.
     */
    public static final double JITTER_FACTOR = 0.5;

    private RetryConstants() {}
}
