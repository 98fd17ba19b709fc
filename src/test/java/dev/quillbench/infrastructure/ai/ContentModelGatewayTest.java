package dev.quillbench.infrastructure.ai;

import dev.quillbench.agent.ControllerConfig;
import dev.quillbench.exception.PermanentControllerException;
import dev.quillbench.exception.TransientControllerException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ContentModelGatewayTest {

    private static final ControllerConfig CONFIG =
            new ControllerConfig("amazon.nova-pro-v1:0", 0.4, 512, List.of(), List.of());

    private ChatModel chatModel;
    private ContentModelGateway gateway;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        gateway = new ContentModelGateway(chatModel, CircuitBreakerRegistry.ofDefaults());
    }

    private static ChatResponse response(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @Test
    @DisplayName("passes model options and returns the answer text")
    void returnsText() {
        when(chatModel.call(any(Prompt.class))).thenReturn(response("An article"));

        String text = gateway.generate("Write something", CONFIG);

        assertThat(text).isEqualTo("An article");
        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        assertThat(captor.getValue().getContents()).contains("Write something");
        assertThat(captor.getValue().getOptions().getModel()).isEqualTo("amazon.nova-pro-v1:0");
        assertThat(captor.getValue().getOptions().getTemperature()).isEqualTo(0.4);
        assertThat(captor.getValue().getOptions().getMaxTokens()).isEqualTo(512);
    }

    @Test
    @DisplayName("blank answer is transient")
    void blankAnswerIsTransient() {
        when(chatModel.call(any(Prompt.class))).thenReturn(response("  "));

        assertThatThrownBy(() -> gateway.generate("p", CONFIG))
                .isInstanceOf(TransientControllerException.class)
                .hasMessageContaining("empty response");
    }

    @Test
    @DisplayName("transient AI errors map to TransientControllerException")
    void transientMapping() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new TransientAiException("throttled"));

        assertThatThrownBy(() -> gateway.generate("p", CONFIG))
                .isInstanceOf(TransientControllerException.class)
                .hasMessage("throttled");
    }

    @Test
    @DisplayName("timeouts map to TransientControllerException")
    void timeoutMapping() {
        when(chatModel.call(any(Prompt.class)))
                .thenThrow(new RuntimeException("I/O", new SocketTimeoutException("read timed out")));

        assertThatThrownBy(() -> gateway.generate("p", CONFIG))
                .isInstanceOf(TransientControllerException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    @DisplayName("non-transient AI errors map to PermanentControllerException")
    void permanentMapping() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new NonTransientAiException("access denied"));

        assertThatThrownBy(() -> gateway.generate("p", CONFIG))
                .isInstanceOf(PermanentControllerException.class)
                .hasMessage("access denied");
    }

    @Test
    @DisplayName("unclassified errors propagate unchanged")
    void otherErrorsPropagate() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("bug"));

        assertThatThrownBy(() -> gateway.generate("p", CONFIG)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("open circuit rejects calls as transient without reaching the model")
    void openCircuit() {
        CircuitBreakerRegistry breakers = CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .waitDurationInOpenState(Duration.ofMinutes(1))
                .build());
        breakers.circuitBreaker("model-" + CONFIG.model()).transitionToOpenState();
        ContentModelGateway guarded = new ContentModelGateway(chatModel, breakers);

        assertThatThrownBy(() -> guarded.generate("p", CONFIG))
                .isInstanceOf(TransientControllerException.class)
                .hasMessageContaining("Circuit open");
        verify(chatModel, never()).call(any(Prompt.class));
    }
}
