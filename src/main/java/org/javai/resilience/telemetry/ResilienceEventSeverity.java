package org.javai.resilience.telemetry;

/**
 * How noteworthy a telemetry event is. Sinks map it to log levels or alerting thresholds.
 */
public enum ResilienceEventSeverity {
    DEBUG,
    INFO,
    WARNING,
    ERROR
}
