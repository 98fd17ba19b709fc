package dev.quillbench.agent.orchestrator;

import java.util.concurrent.ExecutorService;

/**
 * Creates the worker pool for one benchmark run. The orchestrator owns and shuts down the pool.
 */
@FunctionalInterface
public interface ControllerExecutorFactory {
    ExecutorService create(int threads);
}
