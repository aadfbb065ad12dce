package org.javai.resilience.cancel;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class CancellationTokenSourceTest {

    @Test
    void none_isNeverCancelled() {
        assertThat(CancellationToken.NONE.canBeCancelled()).isFalse();
        assertThat(CancellationToken.NONE.isCancellationRequested()).isFalse();
        assertThatCode(CancellationToken.NONE::throwIfCancellationRequested).doesNotThrowAnyException();
    }

    @Test
    void cancel_flipsTokenState() {
        CancellationTokenSource source = new CancellationTokenSource();
        CancellationToken token = source.token();

        assertThat(token.canBeCancelled()).isTrue();
        assertThat(token.isCancellationRequested()).isFalse();

        source.cancel();

        assertThat(token.isCancellationRequested()).isTrue();
        assertThatThrownBy(token::throwIfCancellationRequested)
                .isInstanceOf(CancellationException.class)
                .hasMessageContaining("cancelled");
    }

    @Test
    void cancel_runsCallbacksExactlyOnce() {
        CancellationTokenSource source = new CancellationTokenSource();
        AtomicInteger calls = new AtomicInteger();
        source.token().register(calls::incrementAndGet);

        source.cancel();
        source.cancel();

        assertThat(calls).hasValue(1);
    }

    @Test
    void register_afterCancel_runsImmediately() {
        CancellationTokenSource source = new CancellationTokenSource();
        source.cancel();
        AtomicInteger calls = new AtomicInteger();

        source.token().register(calls::incrementAndGet);

        assertThat(calls).hasValue(1);
    }

    @Test
    void closedRegistration_isNotInvoked() {
        CancellationTokenSource source = new CancellationTokenSource();
        AtomicInteger calls = new AtomicInteger();
        CancellationRegistration registration = source.token().register(calls::incrementAndGet);

        registration.close();
        source.cancel();

        assertThat(calls).hasValue(0);
    }

    @Test
    void cancel_runsAllCallbacksAndRethrowsFirstFailure() {
        CancellationTokenSource source = new CancellationTokenSource();
        AtomicInteger calls = new AtomicInteger();
        source.token().register(() -> {
            throw new IllegalStateException("first");
        });
        source.token().register(calls::incrementAndGet);
        source.token().register(() -> {
            throw new IllegalArgumentException("second");
        });

        assertThatThrownBy(source::cancel)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("first")
                .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
        assertThat(calls).hasValue(1);
        assertThat(source.isCancellationRequested()).isTrue();
    }

    @Test
    void register_onNone_returnsNoOpRegistration() {
        assertThat(CancellationToken.NONE.register(() -> {})).isSameAs(CancellationRegistration.NONE);
    }
}
