package org.javai.resilience.telemetry;

import org.javai.resilience.Outcome;
import org.javai.resilience.ResilienceContext;

import java.util.Objects;

/**
 * A single telemetry event delivered to a {@link TelemetrySink}.
 *
 * <p>Events are only valid for the duration of {@link TelemetrySink#write(TelemetryEvent)}: the
 * context is pooled and the outcome may be disposed right after. Sinks that need the data
 * later must copy what they need.
 *
 * @param event the kind of event
 * @param source the strategy that emitted it
 * @param context the execution context
 * @param outcome the outcome the event refers to, may be null
 * @param arguments the event-specific arguments
 */
public record TelemetryEvent(
        ResilienceEvent event,
        TelemetrySource source,
        ResilienceContext context,
        Outcome<?> outcome,
        Object arguments
) {

    public TelemetryEvent {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");
    }

    public String eventName() {
        return event.eventName();
    }

    public ResilienceEventSeverity severity() {
        return event.severity();
    }
}
