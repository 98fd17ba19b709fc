package dev.quillbench.exception;

/**
 * Retryable failure: timeouts, rate limits, transient network faults, open circuits.
 */
public class TransientControllerException extends ControllerException {

    public TransientControllerException(String message) {
        super(message);
    }

    public TransientControllerException(String message, Throwable cause) {
        super(message, cause);
    }
}
