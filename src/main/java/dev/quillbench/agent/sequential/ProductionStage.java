package dev.quillbench.agent.sequential;

import dev.quillbench.agent.AgentRole;

/**
 * Fixed pipeline of the custom sequential controller. Each stage hands its output to the next.
 */
public enum ProductionStage {
    TOPIC_DISCOVERY(new AgentRole("Topic Advisor",
            "Find a timely, high-quality topic",
            "Editor who tracks what readers in this field care about this week"),
            "Propose one concrete article topic for %s. Reply with a title and a two-sentence angle."),
    RESEARCH(new AgentRole("Content Researcher",
            "Collect accurate, comprehensive material for the article",
            "Analyst who checks every claim against primary sources"),
            "Research the proposed topic for %s. List the key facts, figures and open questions."),
    WRITING(new AgentRole("Content Writer",
            "Write an engaging, well-structured article",
            "Journalist with a decade of long-form experience"),
            "Write the full article for %s from the research notes. Use a title and section headings."),
    STYLE(new AgentRole("Style Specialist",
            "Adapt the article to the requested style and audience",
            "Copy editor who has worked across many publications"),
            "Rewrite the article so it reads naturally for %s. Keep all facts unchanged."),
    REVIEW(new AgentRole("Content Editor",
            "Guarantee quality, accuracy and consistency",
            "Managing editor with final sign-off"),
            "Review the article for %s and return the corrected final version only.");

    private final AgentRole defaultRole;
    private final String taskTemplate;

    ProductionStage(AgentRole defaultRole, String taskTemplate) {
        this.defaultRole = defaultRole;
        this.taskTemplate = taskTemplate;
    }

    public AgentRole defaultRole() {
        return defaultRole;
    }

    public String task(String workload) {
        return taskTemplate.formatted(workload);
    }
}
