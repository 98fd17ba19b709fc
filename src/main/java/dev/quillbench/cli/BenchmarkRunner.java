package dev.quillbench.cli;

import dev.quillbench.agent.orchestrator.BenchmarkOrchestrator;
import dev.quillbench.agent.orchestrator.InitializationReport;
import dev.quillbench.agent.retry.CancellationSignal;
import dev.quillbench.domain.valueobject.AggregateStats;
import dev.quillbench.domain.valueobject.BenchmarkRun;
import dev.quillbench.domain.valueobject.Report;
import dev.quillbench.domain.valueobject.Workload;
import dev.quillbench.exception.ReportWriteException;
import dev.quillbench.service.MetricsAggregator;
import dev.quillbench.service.ReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Batch entry point: parse options, run the benchmark, write the report.
 *
 * <p>Exit code 0 on success, 1 on a usage error, user interrupt or any
 * unhandled exception. This is the one place where unclassified failures are
 * caught; they are logged and turned into the exit code.
 */
@Component
public class BenchmarkRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final BenchmarkOrchestrator.Factory orchestratorFactory;
    private final MetricsAggregator aggregator;
    private final ReportGenerator reportGenerator;
    private final PrintStream out;

    private final CancellationSignal signal = CancellationSignal.create();
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile int exitCode = EXIT_OK;

    @Autowired
    public BenchmarkRunner(BenchmarkOrchestrator.Factory orchestratorFactory,
                           MetricsAggregator aggregator,
                           ReportGenerator reportGenerator) {
        this(orchestratorFactory, aggregator, reportGenerator, System.out);
    }

    BenchmarkRunner(BenchmarkOrchestrator.Factory orchestratorFactory, MetricsAggregator aggregator,
                    ReportGenerator reportGenerator, PrintStream out) {
        this.orchestratorFactory = orchestratorFactory;
        this.aggregator = aggregator;
        this.reportGenerator = reportGenerator;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        Thread interruptHook = new Thread(this::onInterrupt, "benchmark-interrupt");
        Runtime.getRuntime().addShutdownHook(interruptHook);
        try {
            exitCode = execute(args);
        } finally {
            finished.countDown();
            removeHook(interruptHook);
        }
    }

    int execute(String... args) {
        BenchmarkCommand command;
        try {
            command = BenchmarkCommand.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments {}: {}", Arrays.toString(args), e.getMessage());
            return EXIT_FAILURE;
        }

        try {
            BenchmarkOrchestrator orchestrator = orchestratorFactory.forModel(command.model());

            log.info("Initializing controllers: {}",
                    command.controllers() != null ? command.controllers() : "all");
            InitializationReport init = orchestrator.initializeControllers(command.controllers());
            if (!init.isComplete()) {
                log.warn("Controllers unavailable for this run: {}", init.failures().keySet());
            }

            log.info("Starting benchmark - category: {}, style: {}", command.category(), command.style());
            BenchmarkRun run = orchestrator.runBenchmark(new Workload(command.category(), command.style()),
                    command.controllers(), signal, null);
            if (signal.isCancelled()) {
                log.warn("Benchmark interrupted by user");
                return EXIT_FAILURE;
            }

            AggregateStats stats = aggregator.aggregate(run);
            Report report;
            try {
                report = reportGenerator.generate(run, stats, command.output());
            } catch (ReportWriteException e) {
                if (command.verbose()) printSummary(e.getReport());
                throw e;
            }
            log.info("Benchmark complete, report saved to {}", report.path());

            if (command.verbose()) printSummary(report);
            return EXIT_OK;
        } catch (Exception e) {
            log.error("Benchmark failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /** First 10 lines, and the last 10 when the report has more than 20. */
    void printSummary(Report report) {
        List<String> lines = report.markdown().lines().toList();
        out.println();
        out.println("=".repeat(50));
        out.println("Comparison report summary:");
        out.println("=".repeat(50));
        lines.stream().limit(10).forEach(out::println);
        if (lines.size() > 20) {
            out.println("...");
            lines.subList(lines.size() - 10, lines.size()).forEach(out::println);
        }
        out.println();
        out.println("Full report: " + report.path());
    }

    private void onInterrupt() {
        if (finished.getCount() == 0) {
            return;
        }
        log.info("User interrupt, cancelling benchmark...");
        signal.cancel();
        try {
            finished.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        Runtime.getRuntime().halt(EXIT_FAILURE);
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, interrupt hook stays registered");
        }
    }
}
