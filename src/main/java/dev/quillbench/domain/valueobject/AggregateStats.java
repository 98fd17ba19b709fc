package dev.quillbench.domain.valueobject;

import java.time.Duration;
import java.util.List;

/**
 * Summary statistics derived from exactly one {@link BenchmarkRun}.
 * Never persisted; recompute from the run when needed.
 */
public record AggregateStats(
        int total,
        int successes,
        int failures,
        double successRate,
        Duration meanElapsed,
        LatencySummary latency,
        Duration totalElapsed,
        List<ControllerStats> perController
) {
    public AggregateStats {
        perController = List.copyOf(perController);
    }
}
