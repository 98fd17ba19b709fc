package dev.quillbench.agent.sequential;

import dev.quillbench.agent.AgentRole;
import dev.quillbench.agent.ControllerConfig;
import dev.quillbench.exception.TransientControllerException;
import dev.quillbench.infrastructure.ai.ContentModelGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CustomSequentialControllerTest {

    private ContentModelGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = mock(ContentModelGateway.class);
    }

    @Test
    @DisplayName("runs the five stages in order, each fed the previous output")
    void chainsStages() {
        when(gateway.generate(anyString(), any())).thenReturn("topic", "notes", "draft", "styled", "final article");
        var controller = new CustomSequentialController(ControllerConfig.forModel("m"), gateway);

        String result = controller.process("AI", "tech");

        assertThat(result).isEqualTo("final article");
        assertThat(controller.type()).isEqualTo("custom_sequential");
        ArgumentCaptor<String> prompts = ArgumentCaptor.forClass(String.class);
        verify(gateway, times(5)).generate(prompts.capture(), any());
        List<String> sent = prompts.getAllValues();
        assertThat(sent.get(0)).contains("Topic Advisor").contains("category \"AI\" written in a tech style")
                .doesNotContain("PREVIOUS OUTPUT");
        assertThat(sent.get(1)).contains("Content Researcher").contains("topic");
        assertThat(sent.get(4)).contains("Content Editor").contains("styled");
    }

    @Test
    @DisplayName("configured roles replace stage personas by position")
    void configuredRoles() {
        when(gateway.generate(anyString(), any())).thenReturn("out");
        var config = new ControllerConfig("m", 0.7, 1024,
                List.of(new AgentRole("Trend Scout", "find trends", "")), List.of());

        new CustomSequentialController(config, gateway).process("Finance", "casual");

        ArgumentCaptor<String> prompts = ArgumentCaptor.forClass(String.class);
        verify(gateway, times(5)).generate(prompts.capture(), any());
        assertThat(prompts.getAllValues().get(0)).contains("Trend Scout").doesNotContain("Topic Advisor");
        assertThat(prompts.getAllValues().get(1)).contains("Content Researcher");
    }

    @Test
    @DisplayName("a transient model failure aborts the pipeline")
    void propagatesTransientFailure() {
        when(gateway.generate(anyString(), any()))
                .thenReturn("topic")
                .thenThrow(new TransientControllerException("throttled"));
        var controller = new CustomSequentialController(ControllerConfig.forModel("m"), gateway);

        assertThatThrownBy(() -> controller.process("AI", "tech")).isInstanceOf(TransientControllerException.class);
        verify(gateway, times(2)).generate(anyString(), any());
    }
}
