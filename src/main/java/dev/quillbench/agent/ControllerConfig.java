package dev.quillbench.agent;

import java.util.List;
import java.util.Objects;

/**
 * Immutable controller configuration. An empty role list means "use the
 * controller's built-in crew".
 */
public record ControllerConfig(String model, double temperature, int maxOutputTokens,
                               List<AgentRole> roles, List<String> tools) {
    public ControllerConfig {
        Objects.requireNonNull(model, "model");
        if (model.isBlank()) throw new IllegalArgumentException("model must not be blank");
        if (temperature < 0) temperature = 0.7;
        if (maxOutputTokens <= 0) maxOutputTokens = 2048;
        roles = roles == null ? List.of() : List.copyOf(roles);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public static ControllerConfig forModel(String model) {
        return new ControllerConfig(model, 0.7, 2048, List.of(), List.of());
    }

    /** Configured roles, or the given defaults when none are configured. */
    public List<AgentRole> rolesOr(List<AgentRole> defaults) {
        return roles.isEmpty() ? defaults : roles;
    }
}
