package org.javai.resilience.telemetry;

import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.LegacyAbstractLogger;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.List;

/**
 * SLF4J logger that keeps formatted messages in memory.
 */
public class CapturingLogger extends LegacyAbstractLogger {

	private final List<String> messages = new ArrayList<>();
	private final Level threshold;

	public CapturingLogger() {
		this(Level.INFO);
	}

	public CapturingLogger(Level threshold) {
		this.name = "capturing";
		this.threshold = threshold;
	}

	public List<String> messages() {
		return messages;
	}

	@Override
	public boolean isTraceEnabled() {
		return enabled(Level.TRACE);
	}

	@Override
	public boolean isDebugEnabled() {
		return enabled(Level.DEBUG);
	}

	@Override
	public boolean isInfoEnabled() {
		return enabled(Level.INFO);
	}

	@Override
	public boolean isWarnEnabled() {
		return enabled(Level.WARN);
	}

	@Override
	public boolean isErrorEnabled() {
		return enabled(Level.ERROR);
	}

	private boolean enabled(Level level) {
		// slf4j orders levels by descending int value: ERROR=40 ... TRACE=0
		return level.toInt() >= threshold.toInt();
	}

	@Override
	protected String getFullyQualifiedCallerName() {
		return null;
	}

	@Override
	protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
											   Object[] arguments, Throwable throwable) {
		messages.add(MessageFormatter.basicArrayFormat(messagePattern, arguments));
	}
}
