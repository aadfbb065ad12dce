package org.javai.resilience.telemetry.metrics;

import org.javai.resilience.Outcome;
import org.javai.resilience.retry.OnRetryArguments;
import org.javai.resilience.telemetry.ExecutionAttemptArguments;
import org.javai.resilience.telemetry.TelemetryEvent;
import org.javai.resilience.telemetry.TelemetrySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.format.DateTimeFormatter;

/**
 * Writes telemetry events as JSON-lines metrics via SLF4J.
 *
 * <p>Outputs one JSON object per event, suitable for metrics aggregation and analysis
 * pipelines. The tracking key is the operation key of the execution (or the strategy name
 * when the caller gave none), optionally prefixed with a namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"on_retry","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.order.fetch","attemptNumber":"0","delayMs":"2000",...}
 * }</pre>
 *
 * <p>Constructor options follow the Log4jTelemetrySink pattern:</p>
 * <ul>
 *   <li>{@link #MetricsTelemetrySink()} - no namespace, default logger</li>
 *   <li>{@link #MetricsTelemetrySink(String)} - with namespace, default logger</li>
 *   <li>{@link #MetricsTelemetrySink(String, String)} - with namespace and custom logger name</li>
 * </ul>
 */
public class MetricsTelemetrySink implements TelemetrySink {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.resilience.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsTelemetrySink with no namespace and the default logger.
	 */
	public MetricsTelemetrySink() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsTelemetrySink with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsTelemetrySink(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsTelemetrySink with the specified namespace and custom logger name.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsTelemetrySink(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsTelemetrySink with explicit configuration.
	 * Package-private for testing.
	 */
	MetricsTelemetrySink(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public boolean isEnabled(String eventName) {
		return logger.isInfoEnabled();
	}

	@Override
	public void write(TelemetryEvent event) {
		logger.info(buildJson(event));
	}

	String buildJson(TelemetryEvent event) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		if (event.arguments() instanceof ExecutionAttemptArguments attempt) {
			appendHeader(sb, "execution_attempt", event);
			appendField(sb, "attemptNumber", String.valueOf(attempt.attemptNumber()));
			appendField(sb, "handled", String.valueOf(attempt.handled()));
			appendField(sb, "executionTimeMs", String.valueOf(attempt.executionTime().toMillis()));
		} else if (event.arguments() instanceof OnRetryArguments retry) {
			appendHeader(sb, "on_retry", event);
			appendField(sb, "attemptNumber", String.valueOf(retry.attemptNumber()));
			appendField(sb, "delayMs", String.valueOf(retry.retryDelay().toMillis()));
			appendField(sb, "executionTimeMs", String.valueOf(retry.executionTime().toMillis()));
		} else {
			appendHeader(sb, event.eventName(), event);
			appendField(sb, "arguments", String.valueOf(event.arguments()));
		}
		appendOutcome(sb, event.outcome());
		sb.append("}");
		return sb.toString();
	}

	private void appendHeader(StringBuilder sb, String eventType, TelemetryEvent event) {
		sb.append("\"eventType\":\"").append(escapeJson(eventType)).append("\"");
		appendField(sb, "timestamp", ISO_FORMATTER.format(clock.instant()));
		appendField(sb, "trackingKey", buildTrackingKey(event));
		appendField(sb, "severity", event.severity().name());
		appendField(sb, "source", event.source().qualifiedName());
	}

	private void appendOutcome(StringBuilder sb, Outcome<?> outcome) {
		if (outcome == null) {
			return;
		}
		appendField(sb, "outcome", outcome.isOk() ? "ok" : "fail");
		if (outcome.isFail()) {
			appendField(sb, "exception", outcome.exception().getClass().getName());
		}
	}

	String buildTrackingKey(TelemetryEvent event) {
		String key = event.context().operationKey();
		if (key == null || key.isBlank()) {
			key = event.source().strategyName();
		}
		if (namespace == null) {
			return key;
		}
		return namespace + "." + key;
	}

	private static void appendField(StringBuilder sb, String key, String value) {
		sb.append(",\"").append(key).append("\":\"").append(escapeJson(value)).append("\"");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	static String escapeJson(String s) {
		if (s == null) {
			return "";
		}
		return s.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\r", "\\r")
				.replace("\t", "\\t");
	}
}
