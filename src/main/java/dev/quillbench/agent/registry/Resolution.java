package dev.quillbench.agent.registry;

import dev.quillbench.agent.ContentController;
import dev.quillbench.domain.valueobject.ErrorDetail;

/**
 * Result of looking up a controller type: either a built controller or the reason it could not be built.
 */
public sealed interface Resolution permits Resolution.Resolved, Resolution.Unresolved {

    String typeId();

    default boolean isResolved() {
        return this instanceof Resolved;
    }

    record Resolved(String typeId, ContentController controller) implements Resolution {}

    record Unresolved(String typeId, ErrorDetail error) implements Resolution {}
}
