package org.javai.resilience;

import org.javai.resilience.cancel.CancellationToken;

import java.util.Objects;

/**
 * Per-execution state shared by the caller and the strategies executing on its behalf.
 *
 * <p>A context carries the caller's cancellation token, the current attempt number, an
 * optional operation key used in telemetry and logs, and a property bag. Contexts are
 * obtained from a {@link ResilienceContextPool} and must be released back to it once the
 * execution completes. A context must never be shared by two in-flight executions.
 */
public final class ResilienceContext {

    private final ResilienceProperties properties = new ResilienceProperties();
    private CancellationToken cancellationToken = CancellationToken.NONE;
    private String operationKey;
    private int attemptNumber;
    private boolean inUse;

    ResilienceContext() {}

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public ResilienceContext cancellationToken(CancellationToken cancellationToken) {
        this.cancellationToken = Objects.requireNonNull(cancellationToken, "cancellationToken must not be null");
        return this;
    }

    /**
     * The operation key, or null if the caller did not provide one.
     */
    public String operationKey() {
        return operationKey;
    }

    public ResilienceContext operationKey(String operationKey) {
        this.operationKey = operationKey;
        return this;
    }

    /**
     * The 0-based number of the attempt currently executing.
     */
    public int attemptNumber() {
        return attemptNumber;
    }

    /**
     * Updates the attempt number. Called by strategies before each invocation of the
     * wrapped callback.
     *
     * @param attemptNumber the 0-based attempt number
     */
    public void attemptNumber(int attemptNumber) {
        if (attemptNumber < 0) {
            throw new IllegalArgumentException("attemptNumber must be >= 0, was: " + attemptNumber);
        }
        this.attemptNumber = attemptNumber;
    }

    public ResilienceProperties properties() {
        return properties;
    }

    void markInUse() {
        inUse = true;
    }

    boolean isInUse() {
        return inUse;
    }

    void reset() {
        cancellationToken = CancellationToken.NONE;
        operationKey = null;
        attemptNumber = 0;
        properties.clear();
        inUse = false;
    }

    @Override
    public String toString() {
        return "ResilienceContext[operationKey=" + operationKey + ", attemptNumber=" + attemptNumber + "]";
    }
}
