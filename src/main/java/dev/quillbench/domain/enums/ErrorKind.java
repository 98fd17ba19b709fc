package dev.quillbench.domain.enums;

/**
 * Why a controller produced no content.
 *
 * TRANSIENT = retries exhausted | PERMANENT = non-retryable error |
 * RESOLUTION = controller could not be built | CANCELLED = run cancelled or deadline hit
 */
public enum ErrorKind {
    TRANSIENT, PERMANENT, RESOLUTION, CANCELLED
}
