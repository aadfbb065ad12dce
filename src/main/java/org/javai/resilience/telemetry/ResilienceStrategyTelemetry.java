package org.javai.resilience.telemetry;

import org.javai.resilience.OutcomeArguments;
import org.javai.resilience.ResilienceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Forwards the events of one strategy to a {@link TelemetrySink}.
 *
 * <p>An event is built and written only if the sink reports interest in its name. Reporting
 * never changes the outcome and never interrupts the strategy: an exception thrown by the
 * sink is logged and dropped.
 */
public final class ResilienceStrategyTelemetry {

    private static final Logger LOG = LoggerFactory.getLogger(ResilienceStrategyTelemetry.class);

    private final TelemetrySource source;
    private final TelemetrySink sink;

    public ResilienceStrategyTelemetry(TelemetrySource source, TelemetrySink sink) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    public TelemetrySource source() {
        return source;
    }

    /**
     * Reports an event about the outcome of an attempt.
     */
    public <T, A> void report(ResilienceEvent event, OutcomeArguments<T, A> args) {
        Objects.requireNonNull(args, "args must not be null");
        report(event, args.context(), args, args.arguments());
    }

    /**
     * Reports an event that is not tied to an outcome.
     */
    public <A> void report(ResilienceEvent event, ResilienceContext context, A arguments) {
        report(event, context, null, arguments);
    }

    private void report(ResilienceEvent event, ResilienceContext context, OutcomeArguments<?, ?> args, Object arguments) {
        Objects.requireNonNull(event, "event must not be null");
        try {
            if (!sink.isEnabled(event.eventName())) {
                return;
            }
            sink.write(new TelemetryEvent(event, source, context, args == null ? null : args.outcome(), arguments));
        } catch (RuntimeException e) {
            LOG.warn("Telemetry sink {} failed to write event {} from {}",
                    sink.getClass().getName(), event.eventName(), source.qualifiedName(), e);
        }
    }
}
