package dev.quillbench.exception;

/**
 * Non-retryable failure: invalid configuration, malformed workload, rejected request.
 */
public class PermanentControllerException extends ControllerException {

    public PermanentControllerException(String message) {
        super(message);
    }

    public PermanentControllerException(String message, Throwable cause) {
        super(message, cause);
    }
}
