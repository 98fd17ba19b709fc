package dev.quillbench.agent;

import java.util.List;
import java.util.Optional;

/**
 * Shared prompt construction for content controllers.
 */
public final class PromptTemplates {

    private PromptTemplates() {}

    /**
     * Builds a complete prompt: persona + task + optional tool list + optional prior output.
     */
    public static String forRole(AgentRole role, String task, List<String> tools, Optional<String> context) {
        var sb = new StringBuilder();
        sb.append("You are the ").append(role.role()).append('.');
        if (!role.goal().isBlank()) sb.append("\nGoal: ").append(role.goal());
        if (!role.backstory().isBlank()) sb.append("\nBackground: ").append(role.backstory());
        if (!tools.isEmpty()) sb.append("\nAvailable tools: ").append(String.join(", ", tools));
        sb.append("\n\nTask:\n").append(task);
        context.filter(c -> !c.isBlank())
               .ifPresent(c -> sb.append("\n\n--- PREVIOUS OUTPUT ---\n")
                                 .append(c)
                                 .append("\n--- END PREVIOUS OUTPUT ---"));
        return sb.toString();
    }

    /** Short description of the workload used as the subject of every task. */
    public static String workload(String category, String style) {
        return style == null || style.isBlank()
                ? "category \"%s\"".formatted(category)
                : "category \"%s\" written in a %s style".formatted(category, style);
    }
}
