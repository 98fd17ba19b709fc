package dev.quillbench.domain.valueobject;

import java.util.Objects;

/**
 * The (category, style) pair every controller in a run is asked to produce content for.
 */
public record Workload(String category, String style) {
    public Workload {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(style, "style");
        if (category.isBlank()) throw new IllegalArgumentException("category must not be blank");
    }
}
