package org.javai.resilience.telemetry;

import java.util.Objects;

/**
 * Identifies the strategy that emitted a telemetry event.
 *
 * @param pipelineName the name of the enclosing pipeline, may be null
 * @param strategyName the name of the strategy
 */
public record TelemetrySource(String pipelineName, String strategyName) {

    public TelemetrySource {
        Objects.requireNonNull(strategyName, "strategyName must not be null");
    }

    public static TelemetrySource of(String strategyName) {
        return new TelemetrySource(null, strategyName);
    }

    /**
     * Returns "pipeline/strategy", or just the strategy name when there is no pipeline.
     */
    public String qualifiedName() {
        return pipelineName == null ? strategyName : pipelineName + "/" + strategyName;
    }
}
