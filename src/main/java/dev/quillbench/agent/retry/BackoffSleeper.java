package dev.quillbench.agent.retry;

import java.time.Duration;

/**
 * Waits between retry attempts. Implementations must return early when the
 * signal is cancelled.
 */
@FunctionalInterface
public interface BackoffSleeper {

    /**
     * @return {@code true} if the full delay elapsed, {@code false} if cut short by cancellation
     */
    boolean sleep(Duration delay, CancellationSignal signal) throws InterruptedException;

    static BackoffSleeper cancellable() {
        return (delay, signal) -> !signal.await(delay);
    }
}
