package dev.quillbench.domain.valueobject;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One execution of a workload across a set of controllers.
 * {@code results} is index-aligned with {@code requestedControllerTypes}.
 */
public record BenchmarkRun(
        UUID runId,
        String category,
        String style,
        List<String> requestedControllerTypes,
        List<ControllerResult> results,
        Instant startedAt,
        Instant finishedAt
) {
    public BenchmarkRun {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(finishedAt, "finishedAt");
        requestedControllerTypes = List.copyOf(requestedControllerTypes);
        results = List.copyOf(results);
        if (results.size() != requestedControllerTypes.size()) {
            throw new IllegalArgumentException("expected %d results, got %d"
                    .formatted(requestedControllerTypes.size(), results.size()));
        }
        for (int i = 0; i < results.size(); i++) {
            if (!results.get(i).controllerType().equals(requestedControllerTypes.get(i))) {
                throw new IllegalArgumentException("result %d is for %s, expected %s"
                        .formatted(i, results.get(i).controllerType(), requestedControllerTypes.get(i)));
            }
        }
    }

    public Duration totalElapsed() {
        return Duration.between(startedAt, finishedAt);
    }
}
