package dev.quillbench.agent;

import dev.quillbench.infrastructure.ai.ContentModelGateway;

import java.util.Objects;
import java.util.Optional;

/**
 * Common plumbing for model-backed controllers: identity, configuration and one-call-per-role prompting.
 */
public abstract class AbstractContentController implements ContentController {

    private final String type;
    private final ControllerConfig config;
    private final ContentModelGateway gateway;

    protected AbstractContentController(String type, ControllerConfig config, ContentModelGateway gateway) {
        this.type = Objects.requireNonNull(type, "type");
        this.config = Objects.requireNonNull(config, "config");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public ControllerConfig config() {
        return config;
    }

    /** Sends one task to the model in the voice of {@code role}. */
    protected String ask(AgentRole role, String task, Optional<String> context) {
        return gateway.generate(PromptTemplates.forRole(role, task, config.tools(), context), config);
    }
}
