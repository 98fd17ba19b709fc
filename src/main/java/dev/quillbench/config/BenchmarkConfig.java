package dev.quillbench.config;

import dev.quillbench.agent.crew.CrewManagerController;
import dev.quillbench.agent.crew.CrewSequentialController;
import dev.quillbench.agent.orchestrator.BenchmarkOrchestrator;
import dev.quillbench.agent.orchestrator.ControllerExecutorFactory;
import dev.quillbench.agent.registry.ControllerRegistration;
import dev.quillbench.agent.registry.ControllerRegistry;
import dev.quillbench.agent.retry.BackoffSleeper;
import dev.quillbench.agent.retry.RetryInvoker;
import dev.quillbench.agent.sequential.CustomSequentialController;
import dev.quillbench.infrastructure.ai.ContentModelGateway;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import java.time.Clock;
import java.time.Duration;

/**
 * Engine wiring: controller registrations, retry invoker, circuit breakers and the orchestrator factory.
 * Registration order here is the default run order.
 */
@Configuration
public class BenchmarkConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .build());
    }

    @Bean
    public RetryInvoker retryInvoker() {
        return new RetryInvoker(BackoffSleeper.cancellable(), LoggerFactory.getLogger("dev.quillbench.retry"));
    }

    @Bean
    @Order(1)
    public ControllerRegistration customSequentialRegistration(ContentModelGateway gateway) {
        return new ControllerRegistration(CustomSequentialController.TYPE, CustomSequentialController.DESCRIPTION,
                config -> new CustomSequentialController(config, gateway));
    }

    @Bean
    @Order(2)
    public ControllerRegistration crewManagerRegistration(ContentModelGateway gateway) {
        return new ControllerRegistration(CrewManagerController.TYPE, CrewManagerController.DESCRIPTION,
                config -> new CrewManagerController(config, gateway));
    }

    @Bean
    @Order(3)
    public ControllerRegistration crewSequentialRegistration(ContentModelGateway gateway) {
        return new ControllerRegistration(CrewSequentialController.TYPE, CrewSequentialController.DESCRIPTION,
                config -> new CrewSequentialController(config, gateway));
    }

    @Bean
    public BenchmarkOrchestrator.Factory orchestratorFactory(ControllerRegistry registry,
                                                             RetryInvoker retryInvoker,
                                                             BenchmarkProperties properties,
                                                             AiProperties aiProperties,
                                                             ControllerExecutorFactory executorFactory,
                                                             MeterRegistry meterRegistry,
                                                             Clock clock) {
        BenchmarkOrchestrator.Settings settings = new BenchmarkOrchestrator.Settings(
                properties.retry().toPolicy(), properties.maxConcurrency(), properties.cancellationGrace());
        return model -> {
            String effectiveModel = model != null && !model.isBlank() ? model : aiProperties.defaultModel();
            return new BenchmarkOrchestrator(registry, retryInvoker, settings,
                    type -> properties.controllerConfig(type, effectiveModel, aiProperties),
                    executorFactory, meterRegistry, clock);
        };
    }
}
