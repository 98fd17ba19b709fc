package dev.quillbench.agent;

/**
 * Builds a controller instance from configuration.
 * May throw; the registry turns factory failures into resolution errors.
 */
@FunctionalInterface
public interface ControllerFactory {
    ContentController create(ControllerConfig config);
}
