package org.javai.resilience.telemetry;

/**
 * Receives telemetry events emitted by strategies.
 * Implementations might emit metrics, structured logs, or traces.
 */
public interface TelemetrySink {

    /**
     * Whether this sink wants events with the given name.
     * Strategies check this before building an event, so it should be cheap.
     *
     * @param eventName the event name, e.g. {@code "OnRetry"}
     * @return true if {@link #write(TelemetryEvent)} should be called for such events
     */
    default boolean isEnabled(String eventName) {
        return true;
    }

    /**
     * Writes an event. Called synchronously from the executing thread.
     */
    void write(TelemetryEvent event);

    /**
     * A sink that is interested in nothing.
     */
    static TelemetrySink noOp() {
        return new TelemetrySink() {
            @Override
            public boolean isEnabled(String eventName) {
                return false;
            }

            @Override
            public void write(TelemetryEvent event) {
                // Nothing to do
            }
        };
    }

    /**
     * Creates a composite sink that fans out to all given sinks.
     *
     * @param sinks the sinks to delegate to
     * @return a composite sink
     */
    static TelemetrySink composite(TelemetrySink... sinks) {
        return CompositeTelemetrySink.of(sinks);
    }
}
