package dev.quillbench.agent.retry;

import dev.quillbench.exception.TransientControllerException;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Bounded exponential-backoff retry configuration.
 *
 * <p>{@code maxRetries} is the total number of attempts, with a floor of one:
 * {@code 3} means three calls and two sleeps, {@code 0} means a single call.
 * The sleep before attempt {@code n} (0-indexed, {@code n >= 1}) is
 * {@code initialDelay * backoffMultiplier^(n-1)}.
 */
public record RetryPolicy(int maxRetries, Duration initialDelay, double backoffMultiplier,
                          Predicate<Throwable> retryable) {

    public RetryPolicy {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        Objects.requireNonNull(initialDelay, "initialDelay");
        if (initialDelay.isZero() || initialDelay.isNegative())
            throw new IllegalArgumentException("initialDelay must be positive");
        if (backoffMultiplier < 1.0) throw new IllegalArgumentException("backoffMultiplier must be >= 1");
        Objects.requireNonNull(retryable, "retryable");
    }

    /** Retries only {@link TransientControllerException}. */
    public static RetryPolicy of(int maxRetries, Duration initialDelay, double backoffMultiplier) {
        return new RetryPolicy(maxRetries, initialDelay, backoffMultiplier,
                TransientControllerException.class::isInstance);
    }

    public static RetryPolicy defaults() {
        return of(3, Duration.ofSeconds(1), 2.0);
    }

    public int maxAttempts() {
        return Math.max(1, maxRetries);
    }

    public boolean isRetryable(Throwable error) {
        return retryable.test(error);
    }

    /**
     * Delay to wait before the given 0-indexed attempt.
     *
     * @param attempt index of the attempt about to be made, {@code >= 1}
     */
    public Duration delayBefore(int attempt) {
        if (attempt < 1) throw new IllegalArgumentException("no delay before the first attempt");
        double nanos = initialDelay.toNanos() * Math.pow(backoffMultiplier, attempt - 1);
        return Duration.ofNanos(Math.round(nanos));
    }
}
