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

/**
 * Crew members work one after another; each task receives the previous member's output.
 * The last member's output is the article.
 */
public class CrewSequentialController extends AbstractContentController {

    public static final String TYPE = "crew_sequential";
    public static final String DESCRIPTION = "Crew standard sequential process (CrewSequentialController)";

    private static final Logger log = LoggerFactory.getLogger(CrewSequentialController.class);

    public CrewSequentialController(ControllerConfig config, ContentModelGateway gateway) {
        super(TYPE, config, gateway);
    }

    @Override
    public String process(String category, String style) {
        String workload = PromptTemplates.workload(category, style);
        List<AgentRole> crew = config().rolesOr(CrewRoles.DEFAULT_CREW);
        Optional<String> previous = Optional.empty();

        for (int i = 0; i < crew.size(); i++) {
            AgentRole member = crew.get(i);
            boolean last = i == crew.size() - 1;
            String task = last
                    ? "Produce the final article on %s, building on the previous output.".formatted(workload)
                    : "Contribute your part to an article on %s, building on the previous output.".formatted(workload);
            log.debug("Task {}/{} for {}", i + 1, crew.size(), member.role());
            previous = Optional.of(ask(member, task, previous));
        }
        return previous.orElse("");
    }
}
