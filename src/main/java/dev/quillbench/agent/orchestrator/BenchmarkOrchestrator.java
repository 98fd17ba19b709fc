package dev.quillbench.agent.orchestrator;

import dev.quillbench.agent.ContentController;
import dev.quillbench.agent.ControllerConfig;
import dev.quillbench.agent.registry.ControllerRegistry;
import dev.quillbench.agent.registry.Resolution;
import dev.quillbench.agent.retry.CancellationSignal;
import dev.quillbench.agent.retry.RetryInvoker;
import dev.quillbench.agent.retry.RetryOutcome;
import dev.quillbench.agent.retry.RetryPolicy;
import dev.quillbench.domain.enums.ErrorKind;
import dev.quillbench.domain.valueobject.BenchmarkRun;
import dev.quillbench.domain.valueobject.ControllerResult;
import dev.quillbench.domain.valueobject.ErrorDetail;
import dev.quillbench.domain.valueobject.Workload;
import dev.quillbench.exception.RunStructureException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Runs every requested controller against one workload and collects the outcomes.
 *
 * <p>The orchestration flow:
 *
 * <pre>
 *  1. Default the request to every registered type when none is given
 *  2. Build missing controllers through the registry (failures are recorded, not thrown)
 *  3. Pre-fill a failed RESOLUTION result for every type that could not be built
 *  4. Fan out the rest to a bounded pool, each call wrapped in the retry invoker
 *  5. Await all tasks, or cancellation / deadline followed by a grace period
 *  6. Fill any slot still empty with a CANCELLED result
 *  7. Freeze the slots into an immutable BenchmarkRun
 * </pre>
 *
 * <p>Each result slot is written exactly once, by index, so the run's result
 * order always matches the request order regardless of completion order.
 * A single controller failing never fails the run; only an empty request
 * raises {@link RunStructureException}.
 *
 * <p>Timestamps and elapsed times come from the injected {@link Clock}.
 *
 * <p>Controllers are built once and reused by later runs on this
 * orchestrator. A controller that is not thread-safe never has more than one
 * call outstanding, even when its type appears twice in a request.
 */
public class BenchmarkOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkOrchestrator.class);

    private final ControllerRegistry registry;
    private final RetryInvoker retryInvoker;
    private final Settings settings;
    private final Function<String, ControllerConfig> configSource;
    private final ControllerExecutorFactory executorFactory;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Timer runTimer;

    private final Map<String, ManagedController> controllers = new ConcurrentHashMap<>();

    public BenchmarkOrchestrator(ControllerRegistry registry,
                                 RetryInvoker retryInvoker,
                                 Settings settings,
                                 Function<String, ControllerConfig> configSource,
                                 ControllerExecutorFactory executorFactory,
                                 MeterRegistry meterRegistry,
                                 Clock clock) {
        this.registry = registry;
        this.retryInvoker = retryInvoker;
        this.settings = settings;
        this.configSource = configSource;
        this.executorFactory = executorFactory;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.runTimer = Timer.builder("quillbench.benchmark.duration")
                .description("End-to-end benchmark run time")
                .register(meterRegistry);
    }

    /**
     * Engine settings for one orchestrator.
     *
     * @param maxConcurrency    cap on controllers in flight at once
     * @param cancellationGrace time in-flight controllers get to finish their current attempt
     */
    public record Settings(RetryPolicy retryPolicy, int maxConcurrency, Duration cancellationGrace) {
        public Settings {
            Objects.requireNonNull(retryPolicy, "retryPolicy");
            if (maxConcurrency < 1) throw new IllegalArgumentException("maxConcurrency must be >= 1");
            Objects.requireNonNull(cancellationGrace, "cancellationGrace");
        }
    }

    /** Creates an orchestrator whose controllers all use the given model. */
    @FunctionalInterface
    public interface Factory {
        BenchmarkOrchestrator forModel(String model);
    }

    // ── Initialization ─────────────────────────────────────────────

    /** Builds every registered controller type. */
    public InitializationReport initializeControllers() {
        return initializeControllers(null);
    }

    /**
     * Builds controllers for the given types, or for every registered type when
     * {@code typeIds} is {@code null}. Types already built are kept as they are.
     */
    public synchronized InitializationReport initializeControllers(List<String> typeIds) {
        List<String> types = typeIds == null ? registry.registeredTypes() : typeIds;
        List<String> initialized = new ArrayList<>();
        Map<String, ErrorDetail> failures = new LinkedHashMap<>();

        for (String type : new LinkedHashSet<>(types)) {
            if (controllers.containsKey(type)) {
                initialized.add(type);
                continue;
            }
            log.info("Initializing controller: {}", registry.description(type));
            Resolution resolution = registry.resolve(type, configSource.apply(type));
            if (resolution instanceof Resolution.Resolved resolved) {
                controllers.put(type, new ManagedController(resolved.controller()));
                initialized.add(type);
            } else if (resolution instanceof Resolution.Unresolved unresolved) {
                log.warn("Controller '{}' unavailable: {}", type, unresolved.error().message());
                failures.put(type, unresolved.error());
            }
        }
        return new InitializationReport(initialized, failures);
    }

    /** Types with a live controller. */
    public List<String> initializedTypes() {
        return List.copyOf(controllers.keySet());
    }

    // ── Execution ──────────────────────────────────────────────────

    /**
     * Runs the workload on the given controller types ({@code null} = all registered).
     */
    public BenchmarkRun runBenchmark(Workload workload, List<String> typeIds) {
        return runBenchmark(workload, typeIds, CancellationSignal.create(), null);
    }

    /**
     * Runs the workload, honouring an external cancellation signal and an optional deadline.
     *
     * @param deadline maximum run time before the signal is fired, or {@code null} for none
     * @throws RunStructureException when there is nothing to run
     */
    public BenchmarkRun runBenchmark(Workload workload, List<String> typeIds,
                                     CancellationSignal signal, Duration deadline) {
        Objects.requireNonNull(workload, "workload");
        Objects.requireNonNull(signal, "signal");
        List<String> requested = typeIds == null ? registry.registeredTypes() : List.copyOf(typeIds);
        if (requested.isEmpty()) {
            throw new RunStructureException(registry.registeredTypes().isEmpty()
                    ? "No controllers are registered"
                    : "No controller types requested");
        }

        List<String> missing = requested.stream().filter(t -> !controllers.containsKey(t)).distinct().toList();
        Map<String, ErrorDetail> resolutionFailures = missing.isEmpty()
                ? Map.of()
                : initializeControllers(missing).failures();

        UUID runId = UUID.randomUUID();
        String previousRunId = MDC.get("runId");
        MDC.put("runId", runId.toString().substring(0, 8));
        Timer.Sample timerSample = Timer.start(meterRegistry);
        Instant startedAt = clock.instant();

        try {
            log.info("Starting benchmark {} - category: {}, style: {}, controllers: {}",
                    runId, workload.category(), workload.style(), requested);

            int n = requested.size();
            AtomicReferenceArray<ControllerResult> slots = new AtomicReferenceArray<>(n);
            Map<Integer, Instant> slotStarts = new ConcurrentHashMap<>();
            List<Integer> runnable = new ArrayList<>();

            for (int i = 0; i < n; i++) {
                String type = requested.get(i);
                if (controllers.containsKey(type)) {
                    runnable.add(i);
                } else {
                    ErrorDetail error = resolutionFailures.getOrDefault(type,
                            ErrorDetail.resolution("Controller not initialized: " + type));
                    slots.set(i, ControllerResult.failure(type, error, Duration.ZERO, 0));
                    recordMetrics(slots.get(i));
                }
            }

            if (!runnable.isEmpty()) {
                executeConcurrently(requested, runnable, workload, signal, deadline, slots, slotStarts);
            }

            List<ControllerResult> results = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                results.add(slots.get(i));
            }
            BenchmarkRun run = new BenchmarkRun(runId, workload.category(), workload.style(),
                    requested, results, startedAt, clock.instant());

            long successCount = results.stream().filter(ControllerResult::success).count();
            log.info("Benchmark {} completed: {}/{} controllers succeeded",
                    runId, successCount, results.size());
            return run;
        } finally {
            timerSample.stop(runTimer);
            if (previousRunId != null) {
                MDC.put("runId", previousRunId);
            } else {
                MDC.remove("runId");
            }
        }
    }

    // ── Internal ───────────────────────────────────────────────────

    private void executeConcurrently(List<String> requested, List<Integer> runnable, Workload workload,
                                     CancellationSignal signal, Duration deadline,
                                     AtomicReferenceArray<ControllerResult> slots,
                                     Map<Integer, Instant> slotStarts) {
        int threads = Math.min(runnable.size(), settings.maxConcurrency());
        ExecutorService executor = executorFactory.create(threads);
        boolean cleanFinish = false;
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>(runnable.size());
            for (int index : runnable) {
                String type = requested.get(index);
                ManagedController controller = controllers.get(type);
                futures.add(CompletableFuture.runAsync(() -> {
                    slotStarts.put(index, clock.instant());
                    ControllerResult result;
                    try {
                        result = execute(type, controller, workload, signal);
                    } catch (Throwable t) {
                        result = unexpectedFailure(type, t, slotStarts.get(index));
                    }
                    if (!slots.compareAndSet(index, null, result)) {
                        log.debug("Late result for '{}' discarded, slot already closed", type);
                    }
                }, executor));
            }

            CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
            cleanFinish = awaitCompletion(all, signal, deadline);

            for (int index : runnable) {
                if (slots.get(index) == null) {
                    String type = requested.get(index);
                    Instant started = slotStarts.get(index);
                    Duration elapsed = started != null ? Duration.between(started, clock.instant()) : Duration.ZERO;
                    ControllerResult cancelled = ControllerResult.failure(type,
                            ErrorDetail.cancelled("Did not finish within the cancellation grace period"),
                            elapsed, started != null ? 1 : 0);
                    if (slots.compareAndSet(index, null, cancelled)) {
                        log.warn("Controller '{}' recorded as cancelled", type);
                        recordMetrics(cancelled);
                    }
                }
            }
        } finally {
            if (cleanFinish) {
                executor.shutdown();
            } else {
                executor.shutdownNow();
            }
        }
    }

    /**
     * Waits for every task, or for cancellation / the deadline plus the grace period.
     *
     * @return {@code true} when every task finished
     */
    private boolean awaitCompletion(CompletableFuture<Void> all, CancellationSignal signal, Duration deadline) {
        CompletableFuture<Object> doneOrCancelled = CompletableFuture.anyOf(all, signal.whenCancelled());
        try {
            if (deadline == null) {
                doneOrCancelled.get();
            } else {
                doneOrCancelled.get(deadline.toNanos(), TimeUnit.NANOSECONDS);
            }
        } catch (TimeoutException e) {
            log.warn("Benchmark deadline of {} ms reached, cancelling", deadline.toMillis());
            signal.cancel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Benchmark interrupted, cancelling");
            signal.cancel();
            return all.isDone();
        } catch (ExecutionException e) {
            log.error("Controller task failed outside its result slot: {}", e.getCause().toString());
        }

        if (all.isDone()) {
            return true;
        }
        signal.cancel();
        Duration grace = settings.cancellationGrace();
        log.info("Run cancelled, giving in-flight controllers {} ms to finish their current attempt",
                grace.toMillis());
        try {
            all.get(grace.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("Some controllers did not finish within the grace period");
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return all.isDone();
        } catch (ExecutionException e) {
            log.error("Controller task failed outside its result slot: {}", e.getCause().toString());
            return true;
        }
    }

    private ControllerResult execute(String type, ManagedController controller, Workload workload,
                                     CancellationSignal signal) {
        MDC.put("controller", type);
        Instant start = clock.instant();
        try {
            log.info("Running controller: {}", registry.description(type));
            RetryOutcome<String> outcome = retryInvoker.invoke(type,
                    () -> controller.process(workload), settings.retryPolicy(), signal);
            Duration elapsed = Duration.between(start, clock.instant());

            ControllerResult result;
            if (outcome instanceof RetryOutcome.Success<String> success) {
                result = ControllerResult.success(type, success.value(), elapsed, success.attempts());
                log.info("Controller '{}' finished in {} ms after {} attempt(s)",
                        type, elapsed.toMillis(), success.attempts());
            } else {
                RetryOutcome.Failure<String> failure = (RetryOutcome.Failure<String>) outcome;
                result = ControllerResult.failure(type, failure.error(), elapsed, failure.attempts());
                log.warn("Controller '{}' failed ({}) after {} attempt(s): {}",
                        type, failure.error().kind(), failure.attempts(), failure.error().message());
            }
            recordMetrics(result);
            return result;
        } finally {
            MDC.remove("controller");
        }
    }

    private ControllerResult unexpectedFailure(String type, Throwable error, Instant started) {
        log.error("Controller '{}' failed unexpectedly", type, error);
        Duration elapsed = started != null ? Duration.between(started, clock.instant()) : Duration.ZERO;
        ControllerResult result = ControllerResult.failure(type, ErrorDetail.of(ErrorKind.PERMANENT, error), elapsed, 1);
        recordMetrics(result);
        return result;
    }

    private void recordMetrics(ControllerResult result) {
        String outcome = result.success() ? "success" : result.error().kind().name().toLowerCase();
        Timer.builder("quillbench.controller.duration")
                .description("Time spent in one controller including retries")
                .tag("controller", result.controllerType())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .record(result.elapsed());
        Counter.builder("quillbench.controller.attempts")
                .tag("controller", result.controllerType())
                .register(meterRegistry)
                .increment(result.attempts());
    }

    /**
     * A built controller plus the lock serializing calls on it when it is not thread-safe.
     */
    private static final class ManagedController {
        private final ContentController controller;
        private final ReentrantLock lock = new ReentrantLock();

        ManagedController(ContentController controller) {
            this.controller = controller;
        }

        String process(Workload workload) throws InterruptedException {
            if (controller.isThreadSafe()) {
                return controller.process(workload.category(), workload.style());
            }
            lock.lockInterruptibly();
            try {
                return controller.process(workload.category(), workload.style());
            } finally {
                lock.unlock();
            }
        }
    }
}
