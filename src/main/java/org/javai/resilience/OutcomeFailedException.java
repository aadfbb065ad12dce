package org.javai.resilience;

/**
 * Thrown when a failed {@link Outcome} carrying a checked exception is unwrapped, or when the
 * value of a discarded outcome cannot be released.
 * This is an unchecked exception so that callers of the convenience execution methods are not
 * forced to declare the checked exceptions of the wrapped operation.
 */
public class OutcomeFailedException extends RuntimeException {

    public OutcomeFailedException(Throwable cause) {
        super("Outcome failed: " + cause.getMessage(), cause);
    }

    public OutcomeFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
