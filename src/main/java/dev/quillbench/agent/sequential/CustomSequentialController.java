package dev.quillbench.agent.sequential;

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
 * Hand-rolled staged pipeline: topic discovery, research, writing, style, review.
 * Configured roles replace the stage personas by position.
 */
public class CustomSequentialController extends AbstractContentController {

    public static final String TYPE = "custom_sequential";
    public static final String DESCRIPTION = "Custom sequential pipeline (ContentController)";

    private static final Logger log = LoggerFactory.getLogger(CustomSequentialController.class);

    public CustomSequentialController(ControllerConfig config, ContentModelGateway gateway) {
        super(TYPE, config, gateway);
    }

    @Override
    public String process(String category, String style) {
        String workload = PromptTemplates.workload(category, style);
        List<AgentRole> roles = config().roles();
        Optional<String> previous = Optional.empty();

        for (ProductionStage stage : ProductionStage.values()) {
            AgentRole role = stage.ordinal() < roles.size() ? roles.get(stage.ordinal()) : stage.defaultRole();
            log.debug("Stage {} as {}", stage, role.role());
            previous = Optional.of(ask(role, stage.task(workload), previous));
        }
        return previous.orElse("");
    }
}
