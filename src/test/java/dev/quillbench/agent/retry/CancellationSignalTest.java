package dev.quillbench.agent.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationSignalTest {

    @Test
    @DisplayName("await times out when nobody cancels")
    void awaitTimesOut() throws Exception {
        assertThat(CancellationSignal.create().await(Duration.ofMillis(20))).isFalse();
    }

    @Test
    @DisplayName("cancel wakes a waiting thread")
    void cancelWakesWaiter() throws Exception {
        CancellationSignal signal = CancellationSignal.create();
        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return signal.await(Duration.ofMinutes(1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });

        signal.cancel();

        assertThat(waiter.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(signal.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("completing the exposed future does not cancel the signal")
    void whenCancelledIsReadOnly() {
        CancellationSignal signal = CancellationSignal.create();

        signal.whenCancelled().complete(null);

        assertThat(signal.isCancelled()).isFalse();
        signal.cancel();
        assertThat(signal.whenCancelled()).isDone();
    }
}
