package dev.quillbench.domain.valueobject;

import dev.quillbench.domain.enums.ErrorKind;

import java.util.Objects;

/**
 * Failure description attached to an unsuccessful controller result.
 *
 * @param exceptionType simple name of the underlying exception, or {@code null}
 *                      when the failure did not come from an exception
 */
public record ErrorDetail(ErrorKind kind, String message, String exceptionType) {

    public ErrorDetail {
        Objects.requireNonNull(kind, "kind");
        if (message == null || message.isBlank()) message = kind.name().toLowerCase();
    }

    public static ErrorDetail of(ErrorKind kind, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new ErrorDetail(kind, message, error.getClass().getSimpleName());
    }

    public static ErrorDetail resolution(String message) {
        return new ErrorDetail(ErrorKind.RESOLUTION, message, null);
    }

    public static ErrorDetail cancelled(String message) {
        return new ErrorDetail(ErrorKind.CANCELLED, message, null);
    }
}
