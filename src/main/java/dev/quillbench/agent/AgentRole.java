package dev.quillbench.agent;

import java.util.Objects;

/**
 * One agent persona inside a controller: what it is, what it wants, where it comes from.
 */
public record AgentRole(String role, String goal, String backstory) {
    public AgentRole {
        Objects.requireNonNull(role, "role");
        if (goal == null) goal = "";
        if (backstory == null) backstory = "";
    }
}
