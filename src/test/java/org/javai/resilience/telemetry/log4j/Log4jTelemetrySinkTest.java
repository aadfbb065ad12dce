package org.javai.resilience.telemetry.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.javai.resilience.Outcome;
import org.javai.resilience.ResilienceContextPool;
import org.javai.resilience.retry.OnRetryArguments;
import org.javai.resilience.telemetry.ExecutionAttemptArguments;
import org.javai.resilience.telemetry.ResilienceEvent;
import org.javai.resilience.telemetry.ResilienceEventSeverity;
import org.javai.resilience.telemetry.TelemetryEvent;
import org.javai.resilience.telemetry.TelemetrySource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class Log4jTelemetrySinkTest {

	private Logger logger;
	private CapturingAppender appender;
	private Log4jTelemetrySink sink;

	@BeforeEach
	void setUp() {
		logger = (Logger) LogManager.getLogger("org.javai.resilience.telemetry.log4j.test");
		appender = new CapturingAppender();
		appender.start();
		logger.addAppender(appender);
		logger.setAdditive(false);
		logger.setLevel(Level.ALL);
		sink = new Log4jTelemetrySink(logger);
	}

	@AfterEach
	void tearDown() {
		logger.removeAppender(appender);
		appender.stop();
	}

	@Test
	void write_handledAttempt_logsWarnWithMarker() {
		IOException failure = new IOException("connection reset");

		sink.write(event(ResilienceEventSeverity.WARNING, Outcome.fail(failure),
			new ExecutionAttemptArguments(0, Duration.ofMillis(12), true)));

		assertThat(appender.events).singleElement().satisfies(e -> {
			assertThat(e.getLevel()).isEqualTo(Level.WARN);
			assertThat(e.getMarker().getName()).isEqualTo("EXECUTION_ATTEMPT");
			assertThat(e.getMessage().getFormattedMessage())
				.contains("Execution attempt 0 of [orders.fetch] by [Retry]")
				.contains("Handled: true")
				.contains("fail(java.io.IOException: connection reset)");
			assertThat(e.getThrown()).isSameAs(failure);
		});
	}

	@Test
	void write_onRetry_logsDelay() {
		sink.write(event(ResilienceEventSeverity.WARNING, Outcome.ok("partial"),
			new OnRetryArguments(2, Duration.ofSeconds(6), Duration.ofMillis(3))));

		assertThat(appender.events).singleElement().satisfies(e -> {
			assertThat(e.getMarker().getName()).isEqualTo("RETRY");
			assertThat(e.getMessage().getFormattedMessage())
				.contains("after attempt 2")
				.contains("Delay: 6000ms");
		});
	}

	@Test
	void write_belowLoggerLevel_isDropped() {
		logger.setLevel(Level.WARN);

		sink.write(event(ResilienceEventSeverity.INFO, Outcome.ok("done"),
			new ExecutionAttemptArguments(0, Duration.ZERO, false)));

		assertThat(appender.events).isEmpty();
		assertThat(sink.isEnabled(ExecutionAttemptArguments.EVENT_NAME)).isTrue();
	}

	@Test
	void isEnabled_falseWhenWarnIsOff() {
		logger.setLevel(Level.ERROR);

		assertThat(sink.isEnabled(OnRetryArguments.EVENT_NAME)).isFalse();
	}

	@Test
	void levelFor_mapsEverySeverity() {
		assertThat(Log4jTelemetrySink.levelFor(ResilienceEventSeverity.ERROR)).isEqualTo(Level.ERROR);
		assertThat(Log4jTelemetrySink.levelFor(ResilienceEventSeverity.WARNING)).isEqualTo(Level.WARN);
		assertThat(Log4jTelemetrySink.levelFor(ResilienceEventSeverity.INFO)).isEqualTo(Level.INFO);
		assertThat(Log4jTelemetrySink.levelFor(ResilienceEventSeverity.DEBUG)).isEqualTo(Level.DEBUG);
	}

	@Test
	void describe_nullOutcome() {
		assertThat(Log4jTelemetrySink.describe(null)).isEqualTo("none");
	}

	private TelemetryEvent event(ResilienceEventSeverity severity, Outcome<String> outcome, Object arguments) {
		String name = arguments instanceof OnRetryArguments
			? OnRetryArguments.EVENT_NAME
			: ExecutionAttemptArguments.EVENT_NAME;
		return new TelemetryEvent(
			new ResilienceEvent(severity, name),
			TelemetrySource.of("Retry"),
			new ResilienceContextPool(0).get().operationKey("orders.fetch"),
			outcome,
			arguments);
	}

	private static final class CapturingAppender extends AbstractAppender {
		private final List<LogEvent> events = new ArrayList<>();

		CapturingAppender() {
			super("capturing", null, null, true, Property.EMPTY_ARRAY);
		}

		@Override
		public void append(LogEvent event) {
			events.add(event.toImmutable());
		}
	}
}
