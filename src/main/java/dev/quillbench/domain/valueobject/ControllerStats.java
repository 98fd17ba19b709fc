package dev.quillbench.domain.valueobject;

import dev.quillbench.domain.enums.ErrorKind;

import java.time.Duration;

/**
 * Per-controller line of {@link AggregateStats}, in run order.
 *
 * @param errorKind {@code null} for successful controllers
 */
public record ControllerStats(String controllerType, boolean success, Duration elapsed,
                              int attempts, int contentLength, ErrorKind errorKind) {

    public static ControllerStats from(ControllerResult result) {
        return new ControllerStats(result.controllerType(), result.success(), result.elapsed(),
                result.attempts(), result.content().length(),
                result.error() != null ? result.error().kind() : null);
    }
}
