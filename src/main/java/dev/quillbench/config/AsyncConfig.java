package dev.quillbench.config;

import dev.quillbench.agent.orchestrator.ControllerExecutorFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.Executors;

/**
 * Async execution configuration.
 *
 * <p>Each benchmark run gets its own fixed pool sized to the run's
 * concurrency, with MDC propagation. Worker threads are daemons and never
 * outlive the JVM.
 */
@Configuration
public class AsyncConfig {

    @Bean
    public ControllerExecutorFactory controllerExecutorFactory() {
        return threads -> {
            CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("controller-");
            threadFactory.setDaemon(true);
            return new MdcPropagatingExecutorService(Executors.newFixedThreadPool(threads, threadFactory));
        };
    }
}
