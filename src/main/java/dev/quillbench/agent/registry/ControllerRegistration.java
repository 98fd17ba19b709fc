package dev.quillbench.agent.registry;

import dev.quillbench.agent.ControllerFactory;

import java.util.Objects;

/**
 * One registry entry. Declare as a bean to have it picked up by the registry.
 */
public record ControllerRegistration(String typeId, String description, ControllerFactory factory) {
    public ControllerRegistration {
        Objects.requireNonNull(typeId, "typeId");
        Objects.requireNonNull(factory, "factory");
        if (typeId.isBlank()) throw new IllegalArgumentException("typeId must not be blank");
        if (description == null || description.isBlank()) description = typeId;
    }
}
