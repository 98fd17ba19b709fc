package dev.quillbench.agent.crew;

import dev.quillbench.agent.AbstractContentController;
import dev.quillbench.agent.AgentRole;
import dev.quillbench.agent.ControllerConfig;
import dev.quillbench.agent.PromptTemplates;
import dev.quillbench.infrastructure.ai.ContentModelGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Hierarchical process: a manager writes a plan, every crew member
 * contributes against that plan, and the manager merges the contributions
 * into the final article.
 */
public class CrewManagerController extends AbstractContentController {

    public static final String TYPE = "crew_manager";
    public static final String DESCRIPTION = "Crew hierarchical process (CrewManagerController)";

    private static final Logger log = LoggerFactory.getLogger(CrewManagerController.class);

    public CrewManagerController(ControllerConfig config, ContentModelGateway gateway) {
        super(TYPE, config, gateway);
    }

    @Override
    public String process(String category, String style) {
        String workload = PromptTemplates.workload(category, style);
        List<AgentRole> crew = config().rolesOr(CrewRoles.DEFAULT_CREW);
        String roster = crew.stream().map(AgentRole::role).collect(Collectors.joining(", "));

        String plan = ask(CrewRoles.MANAGER,
                "Plan an article on %s. Assign one concrete assignment to each of: %s."
                        .formatted(workload, roster),
                Optional.empty());
        log.debug("Manager plan ready ({} chars), delegating to {} members", plan.length(), crew.size());

        StringBuilder contributions = new StringBuilder();
        for (AgentRole member : crew) {
            String work = ask(member,
                    "Carry out your assignment from the manager's plan for an article on %s.".formatted(workload),
                    Optional.of(plan));
            contributions.append("### ").append(member.role()).append("\n").append(work).append("\n\n");
        }

        return ask(CrewRoles.MANAGER,
                "Merge the crew contributions into the final article on %s. Return the article only."
                        .formatted(workload),
                Optional.of(contributions.toString().strip()));
    }
}
