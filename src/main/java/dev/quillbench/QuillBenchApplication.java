package dev.quillbench;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * QuillBench: compares content-generation controllers on one workload.
 *
 * <p>Architecture overview:
 * <pre>
 * BenchmarkRunner (CLI) → BenchmarkOrchestrator → ControllerRegistry → [Controller1, Controller2, ...]
 *   → RetryInvoker (per controller, bounded backoff) → BenchmarkRun
 *   → MetricsAggregator → ReportGenerator (Markdown file)
 * </pre>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class QuillBenchApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(QuillBenchApplication.class, args)));
    }
}
