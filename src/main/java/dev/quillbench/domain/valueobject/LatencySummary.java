package dev.quillbench.domain.valueobject;

import java.time.Duration;

/** Latency distribution over successful results. All zero when nothing succeeded. */
public record LatencySummary(Duration min, Duration median, Duration max) {
    public static final LatencySummary EMPTY = new LatencySummary(Duration.ZERO, Duration.ZERO, Duration.ZERO);
}
