package dev.quillbench.infrastructure.ai;

import dev.quillbench.agent.ControllerConfig;
import dev.quillbench.exception.PermanentControllerException;
import dev.quillbench.exception.TransientControllerException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.stereotype.Component;

import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Single entry point from controllers to the chat model.
 *
 * <p>Translates model failures into the engine's two-error contract:
 * <ul>
 *   <li>{@link TransientAiException}, timeouts, an open circuit, or an empty
 *       answer → {@link TransientControllerException}</li>
 *   <li>{@link NonTransientAiException} and invalid arguments →
 *       {@link PermanentControllerException}</li>
 * </ul>
 *
 * <p>Each model id has its own circuit breaker. Retrying is left to the
 * engine's retry invoker, so this class makes exactly one model call per
 * {@link #generate} invocation.
 */
@Component
public class ContentModelGateway {

    private static final Logger log = LoggerFactory.getLogger(ContentModelGateway.class);

    private final ChatModel chatModel;
    private final CircuitBreakerRegistry circuitBreakers;

    public ContentModelGateway(ChatModel chatModel, CircuitBreakerRegistry circuitBreakers) {
        this.chatModel = chatModel;
        this.circuitBreakers = circuitBreakers;
    }

    public String generate(String prompt, ControllerConfig config) {
        CircuitBreaker breaker = circuitBreakers.circuitBreaker("model-" + config.model());
        try {
            return breaker.executeSupplier(() -> callModel(prompt, config));
        } catch (CallNotPermittedException e) {
            throw new TransientControllerException("Circuit open for model " + config.model(), e);
        } catch (TransientAiException e) {
            throw new TransientControllerException(e.getMessage(), e);
        } catch (NonTransientAiException | IllegalArgumentException e) {
            throw new PermanentControllerException(e.getMessage(), e);
        } catch (TransientControllerException | PermanentControllerException e) {
            throw e;
        } catch (RuntimeException e) {
            if (hasTimeoutCause(e)) {
                throw new TransientControllerException("Model call timed out: " + e.getMessage(), e);
            }
            throw e;
        }
    }

    private String callModel(String prompt, ControllerConfig config) {
        log.debug("Calling model {} ({} prompt chars)", config.model(), prompt.length());
        ChatOptions options = ChatOptions.builder()
                .model(config.model())
                .temperature(config.temperature())
                .maxTokens(config.maxOutputTokens())
                .build();
        ChatResponse response = chatModel.call(new Prompt(prompt, options));
        String text = response != null && response.getResult() != null
                ? response.getResult().getOutput().getText()
                : null;
        if (text == null || text.isBlank()) {
            throw new TransientControllerException("Model " + config.model() + " returned an empty response");
        }
        return text;
    }

    private static boolean hasTimeoutCause(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof TimeoutException) return true;
        }
        return false;
    }
}
