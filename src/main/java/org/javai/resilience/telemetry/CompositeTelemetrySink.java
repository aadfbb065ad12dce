package org.javai.resilience.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A {@link TelemetrySink} that delegates to multiple sinks.
 *
 * <p>An event is enabled if any delegate is interested in it, and is written only to the
 * delegates that are. If a delegate throws, the exception is logged and the remaining
 * delegates still receive the event.
 *
 * <p>Example usage:
 * <pre>{@code
 * TelemetrySink sink = CompositeTelemetrySink.of(
 *     new Log4jTelemetrySink(),
 *     new MetricsTelemetrySink("myapp")
 * );
 *
 * // Or using the builder for more control:
 * TelemetrySink sink = CompositeTelemetrySink.builder()
 *     .add(new Log4jTelemetrySink())
 *     .addIf(metricsEnabled, new MetricsTelemetrySink("myapp"))
 *     .build();
 * }</pre>
 */
public final class CompositeTelemetrySink implements TelemetrySink {

	private static final Logger LOG = LoggerFactory.getLogger(CompositeTelemetrySink.class);

	private final List<TelemetrySink> sinks;

	private CompositeTelemetrySink(List<TelemetrySink> sinks) {
		this.sinks = List.copyOf(sinks);
	}

	/**
	 * Creates a composite sink from the given sinks.
	 *
	 * @param sinks the sinks to delegate to
	 * @return a composite that fans out to all given sinks
	 */
	public static CompositeTelemetrySink of(TelemetrySink... sinks) {
		return new CompositeTelemetrySink(Arrays.asList(sinks));
	}

	/**
	 * Creates a composite sink from a collection of sinks.
	 *
	 * @param sinks the sinks to delegate to
	 * @return a composite that fans out to all given sinks
	 */
	public static CompositeTelemetrySink of(Collection<? extends TelemetrySink> sinks) {
		return new CompositeTelemetrySink(new ArrayList<>(sinks));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public boolean isEnabled(String eventName) {
		for (TelemetrySink sink : sinks) {
			if (sink.isEnabled(eventName)) {
				return true;
			}
		}
		return false;
	}

	@Override
	public void write(TelemetryEvent event) {
		for (TelemetrySink sink : sinks) {
			try {
				if (sink.isEnabled(event.eventName())) {
					sink.write(event);
				}
			} catch (RuntimeException e) {
				LOG.warn("TelemetrySink.write failed for {} on event {}",
					sink.getClass().getName(), event.eventName(), e);
			}
		}
	}

	/**
	 * Returns the number of sinks in this composite.
	 */
	public int size() {
		return sinks.size();
	}

	/**
	 * Builder for creating a {@link CompositeTelemetrySink}.
	 */
	public static final class Builder {
		private final List<TelemetrySink> sinks = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a sink to the composite. Null is ignored.
		 *
		 * @param sink the sink to add
		 * @return this builder
		 */
		public Builder add(TelemetrySink sink) {
			if (sink != null) {
				sinks.add(sink);
			}
			return this;
		}

		public Builder addAll(Collection<? extends TelemetrySink> sinks) {
			for (TelemetrySink sink : sinks) {
				add(sink);
			}
			return this;
		}

		/**
		 * Conditionally adds a sink based on a flag.
		 *
		 * @param condition if true, the sink is added
		 * @param sink the sink to add
		 * @return this builder
		 */
		public Builder addIf(boolean condition, TelemetrySink sink) {
			if (condition) {
				add(sink);
			}
			return this;
		}

		public CompositeTelemetrySink build() {
			return new CompositeTelemetrySink(sinks);
		}
	}
}
