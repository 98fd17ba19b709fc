package dev.quillbench.config;

import dev.quillbench.agent.AgentRole;
import dev.quillbench.agent.ControllerConfig;
import dev.quillbench.agent.retry.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Engine settings: retry policy, concurrency cap, cancellation grace,
 * report output and per-controller crew overrides.
 */
@ConfigurationProperties(prefix = "quillbench.benchmark")
public record BenchmarkProperties(RetrySettings retry, int maxConcurrency, Duration cancellationGrace,
                                  Path reportDirectory, int previewLength,
                                  Map<String, ControllerSettings> controllers) {
    public BenchmarkProperties {
        if (retry == null) retry = new RetrySettings(3, Duration.ofSeconds(1), 2.0);
        if (maxConcurrency <= 0) maxConcurrency = 4;
        if (cancellationGrace == null || cancellationGrace.isNegative()) cancellationGrace = Duration.ofSeconds(5);
        if (reportDirectory == null) reportDirectory = Path.of(".");
        if (previewLength <= 0) previewLength = 200;
        controllers = controllers == null ? Map.of() : Map.copyOf(controllers);
    }

    public record RetrySettings(int maxRetries, Duration initialDelay, double backoffMultiplier) {
        public RetrySettings {
            if (maxRetries < 0) maxRetries = 3;
            if (initialDelay == null || initialDelay.isZero() || initialDelay.isNegative()) initialDelay = Duration.ofSeconds(1);
            if (backoffMultiplier < 1.0) backoffMultiplier = 2.0;
        }

        public RetryPolicy toPolicy() {
            return RetryPolicy.of(maxRetries, initialDelay, backoffMultiplier);
        }
    }

    /** Optional crew override for one controller type. */
    public record ControllerSettings(List<AgentRole> roles, List<String> tools, Double temperature) {}

    /**
     * Effective configuration for a controller type: model defaults from
     * {@link AiProperties}, the requested model, then any per-type override.
     */
    public ControllerConfig controllerConfig(String typeId, String model, AiProperties ai) {
        ControllerSettings settings = controllers.get(typeId);
        if (settings == null) {
            return new ControllerConfig(model, ai.temperature(), ai.maxOutputTokens(), List.of(), List.of());
        }
        double temperature = settings.temperature() != null ? settings.temperature() : ai.temperature();
        return new ControllerConfig(model, temperature, ai.maxOutputTokens(), settings.roles(), settings.tools());
    }
}
