package dev.quillbench.agent;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted controller for engine tests. Each call runs {@code behaviour} with the call number (1-based).
 */
public class StubController implements ContentController {

    @FunctionalInterface
    public interface Behaviour {
        String apply(int call, String category, String style) throws Exception;
    }

    private final String type;
    private final ControllerConfig config;
    private final Behaviour behaviour;
    private final boolean threadSafe;
    private final AtomicInteger calls = new AtomicInteger();

    public StubController(String type, Behaviour behaviour) {
        this(type, behaviour, false);
    }

    public StubController(String type, Behaviour behaviour, boolean threadSafe) {
        this.type = type;
        this.config = ControllerConfig.forModel("test-model");
        this.behaviour = behaviour;
        this.threadSafe = threadSafe;
    }

    public static StubController returning(String type, String content) {
        return new StubController(type, (call, category, style) -> content);
    }

    public static StubController throwing(String type, RuntimeException error) {
        return new StubController(type, (call, category, style) -> {
            throw error;
        });
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public ControllerConfig config() {
        return config;
    }

    @Override
    public String process(String category, String style) {
        try {
            return behaviour.apply(calls.incrementAndGet(), category, style);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public boolean isThreadSafe() {
        return threadSafe;
    }

    public int calls() {
        return calls.get();
    }
}
