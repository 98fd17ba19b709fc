package dev.quillbench.exception;

/**
 * Base type for errors a content controller may raise. The engine only
 * distinguishes the two subclasses; any other exception is treated as permanent.
 */
public abstract class ControllerException extends RuntimeException {

    protected ControllerException(String message) {
        super(message);
    }

    protected ControllerException(String message, Throwable cause) {
        super(message, cause);
    }
}
