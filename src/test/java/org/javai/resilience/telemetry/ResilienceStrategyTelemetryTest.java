package org.javai.resilience.telemetry;

import org.javai.resilience.Outcome;
import org.javai.resilience.OutcomeArguments;
import org.javai.resilience.ResilienceContext;
import org.javai.resilience.ResilienceContextPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ResilienceStrategyTelemetryTest {

    private static final ResilienceEvent ATTEMPT =
            new ResilienceEvent(ResilienceEventSeverity.INFO, ExecutionAttemptArguments.EVENT_NAME);

    private final List<TelemetryEvent> written = new ArrayList<>();
    private final List<String> enabledChecks = new ArrayList<>();
    private ResilienceContext context;

    @BeforeEach
    void setUp() {
        context = new ResilienceContextPool(0).get().operationKey("orders.fetch");
    }

    @Test
    void report_buildsEventFromOutcomeArguments() {
        ResilienceStrategyTelemetry telemetry = new ResilienceStrategyTelemetry(
                new TelemetrySource("orders", "Retry"), recordingSink(true));
        Outcome<String> outcome = Outcome.ok("done");
        ExecutionAttemptArguments arguments = new ExecutionAttemptArguments(2, Duration.ofMillis(5), false);

        telemetry.report(ATTEMPT, new OutcomeArguments<>(context, outcome, arguments));

        assertThat(enabledChecks).containsExactly("ExecutionAttempt");
        assertThat(written).singleElement().satisfies(event -> {
            assertThat(event.eventName()).isEqualTo("ExecutionAttempt");
            assertThat(event.severity()).isEqualTo(ResilienceEventSeverity.INFO);
            assertThat(event.source().qualifiedName()).isEqualTo("orders/Retry");
            assertThat(event.context()).isSameAs(context);
            assertThat(event.outcome()).isSameAs(outcome);
            assertThat(event.arguments()).isEqualTo(arguments);
        });
    }

    @Test
    void report_withoutOutcome_leavesOutcomeNull() {
        ResilienceStrategyTelemetry telemetry = new ResilienceStrategyTelemetry(
                TelemetrySource.of("Retry"), recordingSink(true));

        telemetry.report(new ResilienceEvent(ResilienceEventSeverity.DEBUG, "Custom"), context, "payload");

        assertThat(written).singleElement().satisfies(event -> {
            assertThat(event.outcome()).isNull();
            assertThat(event.arguments()).isEqualTo("payload");
        });
    }

    @Test
    void report_disabledSink_isNotWritten() {
        ResilienceStrategyTelemetry telemetry = new ResilienceStrategyTelemetry(
                TelemetrySource.of("Retry"), recordingSink(false));

        telemetry.report(ATTEMPT, new OutcomeArguments<>(context, Outcome.ok("x"),
                new ExecutionAttemptArguments(0, Duration.ZERO, false)));

        assertThat(enabledChecks).containsExactly("ExecutionAttempt");
        assertThat(written).isEmpty();
    }

    @Test
    void report_throwingSink_isSwallowed() {
        TelemetrySink throwing = event -> {
            throw new IllegalStateException("sink down");
        };
        ResilienceStrategyTelemetry telemetry = new ResilienceStrategyTelemetry(TelemetrySource.of("Retry"), throwing);

        assertThatCode(() -> telemetry.report(ATTEMPT, new OutcomeArguments<>(context, Outcome.ok("x"),
                new ExecutionAttemptArguments(0, Duration.ZERO, false))))
                .doesNotThrowAnyException();
    }

    @Test
    void qualifiedName_withoutPipeline_isStrategyName() {
        assertThat(TelemetrySource.of("Retry").qualifiedName()).isEqualTo("Retry");
    }

    private TelemetrySink recordingSink(boolean enabled) {
        return new TelemetrySink() {
            @Override
            public boolean isEnabled(String eventName) {
                enabledChecks.add(eventName);
                return enabled;
            }

            @Override
            public void write(TelemetryEvent event) {
                written.add(event);
            }
        };
    }
}
