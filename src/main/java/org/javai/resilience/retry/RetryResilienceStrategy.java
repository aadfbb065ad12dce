package org.javai.resilience.retry;

import org.javai.resilience.Outcome;
import org.javai.resilience.OutcomeArguments;
import org.javai.resilience.ResilienceCallback;
import org.javai.resilience.ResilienceContext;
import org.javai.resilience.ResilienceStrategy;
import org.javai.resilience.cancel.CancellationToken;
import org.javai.resilience.telemetry.ExecutionAttemptArguments;
import org.javai.resilience.telemetry.ResilienceEvent;
import org.javai.resilience.telemetry.ResilienceEventSeverity;
import org.javai.resilience.telemetry.ResilienceStrategyTelemetry;
import org.javai.resilience.telemetry.TelemetrySink;
import org.javai.resilience.telemetry.TelemetrySource;
import org.javai.resilience.time.TimeProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Executes a callback and retries it while its outcome is handled by the configured predicate
 * and the retry budget lasts.
 *
 * <p>Each execution runs its attempts strictly one after another on the calling thread:</p>
 * <ol>
 *   <li>invoke the callback and measure how long it took;</li>
 *   <li>classify the outcome and report an {@code ExecutionAttempt} event;</li>
 *   <li>return the outcome untouched if it is not handled or the budget is spent;</li>
 *   <li>otherwise compute the delay, notify the {@link OnRetryListener}, report {@code OnRetry},
 *       dispose the discarded outcome and wait out the delay before the next attempt.</li>
 * </ol>
 *
 * <p>Cancellation of the context's token is observed before the first attempt, before and
 * during every delay, and when a cancelled callback fails with a {@link CancellationException};
 * it always ends the execution with a thrown {@link CancellationException}. Exceptions thrown
 * by the predicate, listener or delay generator propagate unchanged.</p>
 *
 * <p>The strategy holds no per-execution state and may be shared by concurrent executions.</p>
 *
 * @param <T> The type of the successful value
 */
public final class RetryResilienceStrategy<T> extends ResilienceStrategy<T> {

    private static final Logger LOG = LoggerFactory.getLogger(RetryResilienceStrategy.class);

    private static final ResilienceEvent ATTEMPT_EVENT =
            new ResilienceEvent(ResilienceEventSeverity.INFO, ExecutionAttemptArguments.EVENT_NAME);
    private static final ResilienceEvent HANDLED_ATTEMPT_EVENT =
            new ResilienceEvent(ResilienceEventSeverity.WARNING, ExecutionAttemptArguments.EVENT_NAME);
    private static final ResilienceEvent ON_RETRY_EVENT =
            new ResilienceEvent(ResilienceEventSeverity.WARNING, OnRetryArguments.EVENT_NAME);

    private final RetryStrategyOptions<T> options;
    private final TimeProvider timeProvider;
    private final ResilienceStrategyTelemetry telemetry;
    private final DoubleSupplier randomizer;

    /**
     * Creates a strategy using the system clock and no telemetry.
     */
    public RetryResilienceStrategy(RetryStrategyOptions<T> options) {
        this(options, TimeProvider.system(), TelemetrySink.noOp());
    }

    /**
     * Creates a strategy reporting to the given sink.
     */
    public RetryResilienceStrategy(RetryStrategyOptions<T> options, TimeProvider timeProvider, TelemetrySink sink) {
        this(options,
                timeProvider,
                new ResilienceStrategyTelemetry(
                        TelemetrySource.of(Objects.requireNonNull(options, "options must not be null").strategyName()), sink),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Creates a strategy with every collaborator supplied explicitly.
     *
     * @param options the retry configuration
     * @param timeProvider the source of timestamps and delays
     * @param telemetry the reporter for attempt and retry events
     * @param randomizer source of values in {@code [0, 1)} used for jitter
     */
    public RetryResilienceStrategy(RetryStrategyOptions<T> options, TimeProvider timeProvider,
                                   ResilienceStrategyTelemetry telemetry, DoubleSupplier randomizer) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.timeProvider = Objects.requireNonNull(timeProvider, "timeProvider must not be null");
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
        this.randomizer = Objects.requireNonNull(randomizer, "randomizer must not be null");
    }

    public RetryStrategyOptions<T> options() {
        return options;
    }

    @Override
    protected <S> Outcome<T> executeCore(ResilienceCallback<T, S> callback, ResilienceContext context, S state) {
        CancellationToken cancellationToken = context.cancellationToken();
        cancellationToken.throwIfCancellationRequested();

        int attempt = 0;
        while (true) {
            context.attemptNumber(attempt);
            long startTimestamp = timeProvider.timestamp();
            Outcome<T> outcome = invokeCallback(callback, context, state);
            Duration executionTime = timeProvider.elapsedSince(startTimestamp);

            if (outcome.exception() instanceof CancellationException cancellation
                    && cancellationToken.isCancellationRequested()) {
                throw cancellation;
            }

            boolean handled = options.shouldHandle()
                    .shouldHandle(new OutcomeArguments<>(context, outcome, new RetryPredicateArguments(attempt)));
            telemetry.report(handled ? HANDLED_ATTEMPT_EVENT : ATTEMPT_EVENT,
                    new OutcomeArguments<>(context, outcome, new ExecutionAttemptArguments(attempt, executionTime, handled)));

            if (!handled) {
                return outcome;
            }
            if (isLastAttempt(attempt)) {
                LOG.debug("Retries exhausted for [{}] after {} attempts", context.operationKey(), attempt + 1);
                return outcome;
            }

            Duration delay = computeDelay(context, outcome, attempt);
            OutcomeArguments<T, OnRetryArguments> retryArgs =
                    new OutcomeArguments<>(context, outcome, new OnRetryArguments(attempt, delay, executionTime));

            if (options.onRetry() != null) {
                options.onRetry().onRetry(retryArgs);
            }
            telemetry.report(ON_RETRY_EVENT, retryArgs);
            LOG.debug("Retrying [{}] after attempt {} in {}", context.operationKey(), attempt, delay);

            // The discarded outcome never reaches the caller.
            outcome.dispose();

            cancellationToken.throwIfCancellationRequested();
            timeProvider.delay(delay, cancellationToken);

            // Saturates so that an infinite retry count keeps a valid attempt number.
            attempt = attempt == Integer.MAX_VALUE ? attempt : attempt + 1;
        }
    }

    private boolean isLastAttempt(int attempt) {
        return !options.isInfinite() && attempt >= options.retryCount();
    }

    private Duration computeDelay(ResilienceContext context, Outcome<T> outcome, int attempt) {
        Duration delay = RetryHelper.getRetryDelay(
                options.backoffType(), options.useJitter(), attempt, options.baseDelay(), randomizer);

        RetryDelayGenerator<T> generator = options.retryDelayGenerator();
        if (generator != null) {
            Duration generated = generator.generate(
                    new OutcomeArguments<>(context, outcome, new RetryDelayArguments(attempt, delay)));
            if (generated != null && !generated.isNegative()) {
                delay = generated;
            }
        }
        return RetryHelper.applyMaxDelay(delay, options.maxDelay());
    }

    @Override
    public String toString() {
        return "RetryResilienceStrategy[" + options + "]";
    }
}
