package dev.quillbench.agent.retry;

import dev.quillbench.domain.valueobject.ErrorDetail;

import java.util.Objects;

/**
 * Terminal state of a {@link RetryInvoker} call. Failure after retries is a
 * value, not an exception, so callers can tell "failed" from "empty".
 */
public sealed interface RetryOutcome<T> permits RetryOutcome.Success, RetryOutcome.Failure {

    /** Number of times the operation was actually called. */
    int attempts();

    default boolean isSuccess() {
        return this instanceof Success;
    }

    record Success<T>(T value, int attempts) implements RetryOutcome<T> {}

    record Failure<T>(ErrorDetail error, int attempts) implements RetryOutcome<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }
    }
}
