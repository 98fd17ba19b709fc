package dev.quillbench.agent.retry;

import dev.quillbench.domain.enums.ErrorKind;
import dev.quillbench.domain.valueobject.ErrorDetail;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Runs an operation under a {@link RetryPolicy}.
 *
 * <p>The invoker never throws: success, non-retryable failure, exhausted
 * retries and cancellation all come back as a {@link RetryOutcome}. An
 * {@link Error} raised by the operation is a failure like any other and is
 * classified by the policy predicate.
 *
 * <p>Cancellation is checked before every attempt and before every sleep; a
 * sleep in progress ends as soon as the signal fires. An attempt already
 * running is not interrupted by the signal.
 */
public class RetryInvoker {

    private final BackoffSleeper sleeper;
    private final Logger log;

    public RetryInvoker(BackoffSleeper sleeper, Logger log) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.log = Objects.requireNonNull(log, "log");
    }

    public <T> RetryOutcome<T> invoke(Callable<T> operation, RetryPolicy policy) {
        return invoke("operation", operation, policy, CancellationSignal.create());
    }

    public <T> RetryOutcome<T> invoke(Callable<T> operation, RetryPolicy policy, CancellationSignal signal) {
        return invoke("operation", operation, policy, signal);
    }

    /**
     * @param label used in log lines only
     */
    public <T> RetryOutcome<T> invoke(String label, Callable<T> operation, RetryPolicy policy,
                                      CancellationSignal signal) {
        int maxAttempts = policy.maxAttempts();
        Throwable lastError = null;
        int attempts = 0;

        while (attempts < maxAttempts) {
            if (signal.isCancelled()) {
                return cancelled(label, attempts, lastError);
            }
            attempts++;
            try {
                T value = operation.call();
                if (attempts > 1) log.info("{} succeeded on attempt {}/{}", label, attempts, maxAttempts);
                return new RetryOutcome.Success<>(value, attempts);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return cancelled(label, attempts, e);
            } catch (Exception | Error e) {
                lastError = e;
                if (!policy.isRetryable(e)) {
                    log.warn("{} failed with non-retryable {} on attempt {}: {}",
                            label, e.getClass().getSimpleName(), attempts, e.getMessage());
                    return new RetryOutcome.Failure<>(ErrorDetail.of(ErrorKind.PERMANENT, e), attempts);
                }
                if (attempts >= maxAttempts) {
                    break;
                }
                if (signal.isCancelled()) {
                    return cancelled(label, attempts, e);
                }
                Duration delay = policy.delayBefore(attempts);
                log.warn("{} failed on attempt {}/{}, retrying in {} ms: {}",
                        label, attempts, maxAttempts, delay.toMillis(), e.getMessage());
                try {
                    if (!sleeper.sleep(delay, signal)) {
                        return cancelled(label, attempts, e);
                    }
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return cancelled(label, attempts, e);
                }
            }
        }

        log.error("{} failed after {} attempts: {}", label, attempts,
                lastError != null ? lastError.getMessage() : "no attempt made");
        ErrorDetail detail = lastError != null
                ? new ErrorDetail(ErrorKind.TRANSIENT,
                        "Retries exhausted after %d attempts: %s".formatted(attempts, messageOf(lastError)),
                        lastError.getClass().getSimpleName())
                : new ErrorDetail(ErrorKind.TRANSIENT, "No attempt made", null);
        return new RetryOutcome.Failure<>(detail, attempts);
    }

    private <T> RetryOutcome<T> cancelled(String label, int attempts, Throwable lastError) {
        log.warn("{} cancelled after {} attempt(s)", label, attempts);
        String message = lastError != null
                ? "Cancelled after %d attempt(s); last error: %s".formatted(attempts, messageOf(lastError))
                : "Cancelled after %d attempt(s)".formatted(attempts);
        return new RetryOutcome.Failure<>(ErrorDetail.cancelled(message), attempts);
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
