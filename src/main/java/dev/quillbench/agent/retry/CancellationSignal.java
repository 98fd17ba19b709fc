package dev.quillbench.agent.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One-shot cancellation flag shared by a run, its controllers and their backoff sleeps.
 * Cancelling wakes every thread blocked in {@link #await(Duration)}.
 */
public final class CancellationSignal {

    private final CompletableFuture<Void> cancelled = new CompletableFuture<>();

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.complete(null);
    }

    public boolean isCancelled() {
        return cancelled.isDone();
    }

    /**
     * Blocks for up to {@code timeout} or until cancelled.
     *
     * @return {@code true} if the signal was cancelled before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (isCancelled()) return true;
        try {
            cancelled.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("cancellation future failed", e);
        }
    }

    /** Completes when {@link #cancel()} is called. Read-only view. */
    public CompletableFuture<Void> whenCancelled() {
        return cancelled.copy();
    }
}
