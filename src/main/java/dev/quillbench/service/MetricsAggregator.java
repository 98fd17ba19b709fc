package dev.quillbench.service;

import dev.quillbench.domain.valueobject.AggregateStats;
import dev.quillbench.domain.valueobject.BenchmarkRun;
import dev.quillbench.domain.valueobject.ControllerResult;
import dev.quillbench.domain.valueobject.ControllerStats;
import dev.quillbench.domain.valueobject.LatencySummary;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Derives summary statistics from a finished run. Pure: equal runs give equal stats.
 *
 * <p>Failed results count towards the success-rate denominator but are left
 * out of every latency figure.
 */
@Service
public class MetricsAggregator {

    public AggregateStats aggregate(BenchmarkRun run) {
        List<ControllerResult> results = run.results();
        int total = results.size();
        int successes = (int) results.stream().filter(ControllerResult::success).count();
        double successRate = total == 0 ? 0.0 : (double) successes / total;

        List<Duration> latencies = results.stream()
                .filter(ControllerResult::success)
                .map(ControllerResult::elapsed)
                .filter(d -> !d.isNegative())
                .sorted()
                .toList();

        List<ControllerStats> perController = results.stream().map(ControllerStats::from).toList();

        return new AggregateStats(total, successes, total - successes, successRate,
                mean(latencies), summarize(latencies), run.totalElapsed(), perController);
    }

    private static Duration mean(List<Duration> sorted) {
        if (sorted.isEmpty()) return Duration.ZERO;
        long totalNanos = 0;
        for (Duration d : sorted) totalNanos += d.toNanos();
        return Duration.ofNanos(totalNanos / sorted.size());
    }

    private static LatencySummary summarize(List<Duration> sorted) {
        if (sorted.isEmpty()) return LatencySummary.EMPTY;
        int size = sorted.size();
        Duration median = size % 2 == 1
                ? sorted.get(size / 2)
                : Duration.ofNanos((sorted.get(size / 2 - 1).toNanos() + sorted.get(size / 2).toNanos()) / 2);
        return new LatencySummary(sorted.get(0), median, sorted.get(size - 1));
    }
}
