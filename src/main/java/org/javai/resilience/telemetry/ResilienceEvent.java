package org.javai.resilience.telemetry;

import java.util.Objects;

/**
 * Identifies a kind of telemetry event.
 *
 * @param severity how noteworthy the event is
 * @param eventName the name sinks use to decide whether they are interested
 */
public record ResilienceEvent(ResilienceEventSeverity severity, String eventName) {

    public ResilienceEvent {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(eventName, "eventName must not be null");
    }
}
