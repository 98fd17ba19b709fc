package dev.quillbench.agent.crew;

import dev.quillbench.agent.AgentRole;

import java.util.List;

/**
 * Built-in personas shared by the crew controllers.
 */
public final class CrewRoles {

    private CrewRoles() {}

    public static final AgentRole MANAGER = new AgentRole("Editorial Manager",
            "Plan the article, delegate work to the crew and deliver the final piece",
            "Editor-in-chief who coordinates specialists under deadline");

    public static final List<AgentRole> DEFAULT_CREW = List.of(
            new AgentRole("Topic Advisor",
                    "Find a timely, high-quality topic",
                    "Editor who tracks what readers in this field care about this week"),
            new AgentRole("Content Researcher",
                    "Collect accurate, comprehensive material for the article",
                    "Analyst who checks every claim against primary sources"),
            new AgentRole("Content Writer",
                    "Write an engaging, well-structured article",
                    "Journalist with a decade of long-form experience"),
            new AgentRole("Style Specialist",
                    "Adapt the article to the requested style and audience",
                    "Copy editor who has worked across many publications"));
}
