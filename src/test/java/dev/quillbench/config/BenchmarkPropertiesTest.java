package dev.quillbench.config;

import dev.quillbench.agent.AgentRole;
import dev.quillbench.agent.ControllerConfig;
import dev.quillbench.agent.retry.RetryPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BenchmarkPropertiesTest {

    private static final AiProperties AI = new AiProperties(null, 0.7, 2048);

    @Test
    @DisplayName("missing values fall back to engine defaults")
    void defaults() {
        BenchmarkProperties props = new BenchmarkProperties(null, 0, null, null, 0, null);

        assertThat(props.maxConcurrency()).isEqualTo(4);
        assertThat(props.cancellationGrace()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.reportDirectory()).isEqualTo(Path.of("."));
        assertThat(props.previewLength()).isEqualTo(200);
        RetryPolicy policy = props.retry().toPolicy();
        assertThat(policy.maxAttempts()).isEqualTo(3);
        assertThat(policy.delayBefore(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(AI.defaultModel()).isEqualTo("amazon.nova-pro-v1:0");
    }

    @Test
    @DisplayName("per-controller overrides apply only to their type")
    void controllerOverrides() {
        var override = new BenchmarkProperties.ControllerSettings(
                List.of(new AgentRole("Solo Writer", "write", "")), List.of("web_search"), 0.2);
        BenchmarkProperties props = new BenchmarkProperties(null, 2, null, null, 0,
                Map.of("crew_sequential", override));

        ControllerConfig crew = props.controllerConfig("crew_sequential", "m1", AI);
        ControllerConfig other = props.controllerConfig("crew_manager", "m1", AI);

        assertThat(crew.model()).isEqualTo("m1");
        assertThat(crew.temperature()).isEqualTo(0.2);
        assertThat(crew.tools()).containsExactly("web_search");
        assertThat(crew.roles()).extracting(AgentRole::role).containsExactly("Solo Writer");
        assertThat(other.temperature()).isEqualTo(0.7);
        assertThat(other.roles()).isEmpty();
    }
}
