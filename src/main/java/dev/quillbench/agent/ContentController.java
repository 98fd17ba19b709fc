package dev.quillbench.agent;

import dev.quillbench.exception.PermanentControllerException;
import dev.quillbench.exception.TransientControllerException;

/**
 * Strategy contract for content-generation controllers under comparison.
 * Controllers are built by a {@link ControllerFactory} registered in the
 * {@link dev.quillbench.agent.registry.ControllerRegistry}.
 */
public interface ContentController {

    /** Registry key this controller was built for. */
    String type();

    ControllerConfig config();

    /**
     * Produces content for one workload.
     *
     * @throws TransientControllerException when a retry may succeed
     * @throws PermanentControllerException when retrying is pointless
     */
    String process(String category, String style);

    /**
     * Whether the engine may have several {@link #process} calls outstanding on
     * this instance at once. Defaults to {@code false}.
     */
    default boolean isThreadSafe() {
        return false;
    }
}
