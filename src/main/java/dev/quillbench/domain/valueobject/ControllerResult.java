package dev.quillbench.domain.valueobject;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one controller within a benchmark run.
 *
 * <p>Invariant: a failed result has empty content and an error; a successful
 * result has no error.
 */
public record ControllerResult(
        String controllerType,
        String content,
        Duration elapsed,
        boolean success,
        ErrorDetail error,
        int attempts
) {
    public ControllerResult {
        Objects.requireNonNull(controllerType, "controllerType");
        Objects.requireNonNull(elapsed, "elapsed");
        if (content == null) content = "";
        if (attempts < 0) throw new IllegalArgumentException("attempts must be >= 0");
        if (success && error != null)
            throw new IllegalArgumentException("successful result must not carry an error");
        if (!success && (error == null || !content.isEmpty()))
            throw new IllegalArgumentException("failed result needs an error and empty content");
    }

    public static ControllerResult success(String type, String content, Duration elapsed, int attempts) {
        return new ControllerResult(type, content, elapsed, true, null, attempts);
    }

    public static ControllerResult failure(String type, ErrorDetail error, Duration elapsed, int attempts) {
        return new ControllerResult(type, "", elapsed, false, error, attempts);
    }
}
