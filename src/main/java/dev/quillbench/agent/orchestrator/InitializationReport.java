package dev.quillbench.agent.orchestrator;

import dev.quillbench.domain.valueobject.ErrorDetail;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link BenchmarkOrchestrator#initializeControllers(List)}.
 *
 * @param initialized types that now have a live controller, in request order
 * @param failures    resolution errors keyed by type, in request order
 */
public record InitializationReport(List<String> initialized, Map<String, ErrorDetail> failures) {
    public InitializationReport {
        initialized = List.copyOf(initialized);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
