package org.javai.resilience.telemetry.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.resilience.Outcome;
import org.javai.resilience.retry.OnRetryArguments;
import org.javai.resilience.telemetry.ExecutionAttemptArguments;
import org.javai.resilience.telemetry.ResilienceEventSeverity;
import org.javai.resilience.telemetry.TelemetryEvent;
import org.javai.resilience.telemetry.TelemetrySink;

/**
 * Writes telemetry events using Log4j2 structured logging.
 *
 * <p>Events are logged with levels based on their {@link ResilienceEventSeverity}:
 * <ul>
 *   <li>{@code ERROR} → ERROR</li>
 *   <li>{@code WARNING} → WARN</li>
 *   <li>{@code INFO} → INFO</li>
 *   <li>{@code DEBUG} → DEBUG</li>
 * </ul>
 *
 * <p>The sink reports interest only while its logger has WARN enabled; events whose level is
 * disabled are dropped in {@link #write(TelemetryEvent)}.
 */
public class Log4jTelemetrySink implements TelemetrySink {

	private static final Marker ATTEMPT_MARKER = MarkerManager.getMarker("EXECUTION_ATTEMPT");
	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker EVENT_MARKER = MarkerManager.getMarker("RESILIENCE_EVENT");

	private final Logger logger;

	/**
	 * Creates a Log4jTelemetrySink using the default logger name.
	 */
	public Log4jTelemetrySink() {
		this(LogManager.getLogger("org.javai.resilience.Telemetry"));
	}

	/**
	 * Creates a Log4jTelemetrySink with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jTelemetrySink(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jTelemetrySink with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jTelemetrySink(Logger logger) {
		this.logger = logger;
	}

	@Override
	public boolean isEnabled(String eventName) {
		// Retry events are logged at WARN at most; a logger off at WARN would drop all of them.
		return logger.isWarnEnabled();
	}

	@Override
	public void write(TelemetryEvent event) {
		Level level = levelFor(event.severity());
		if (!logger.isEnabled(level)) {
			return;
		}

		if (event.arguments() instanceof ExecutionAttemptArguments attempt) {
			logger.atLevel(level)
				.withMarker(ATTEMPT_MARKER)
				.withThrowable(exceptionOf(event.outcome()))
				.log("Execution attempt {} of [{}] by [{}]. Handled: {}, ExecutionTime: {}ms, Outcome: {}",
					attempt.attemptNumber(),
					operationKey(event),
					event.source().qualifiedName(),
					attempt.handled(),
					attempt.executionTime().toMillis(),
					describe(event.outcome()));
		} else if (event.arguments() instanceof OnRetryArguments retry) {
			logger.atLevel(level)
				.withMarker(RETRY_MARKER)
				.log("Retrying [{}] by [{}] after attempt {}. Delay: {}ms, ExecutionTime: {}ms, Outcome: {}",
					operationKey(event),
					event.source().qualifiedName(),
					retry.attemptNumber(),
					retry.retryDelay().toMillis(),
					retry.executionTime().toMillis(),
					describe(event.outcome()));
		} else {
			logger.atLevel(level)
				.withMarker(EVENT_MARKER)
				.log("Event {} of [{}] by [{}]: {}",
					event.eventName(),
					operationKey(event),
					event.source().qualifiedName(),
					event.arguments());
		}
	}

	private static String operationKey(TelemetryEvent event) {
		String key = event.context().operationKey();
		return key != null ? key : "";
	}

	private static Throwable exceptionOf(Outcome<?> outcome) {
		return outcome != null ? outcome.exception() : null;
	}

	static String describe(Outcome<?> outcome) {
		if (outcome == null) {
			return "none";
		}
		if (outcome.isOk()) {
			return "ok";
		}
		Throwable exception = outcome.exception();
		return "fail(" + exception.getClass().getName() + ": " + exception.getMessage() + ")";
	}

	static Level levelFor(ResilienceEventSeverity severity) {
		return switch (severity) {
			case ERROR -> Level.ERROR;
			case WARNING -> Level.WARN;
			case INFO -> Level.INFO;
			case DEBUG -> Level.DEBUG;
		};
	}
}
