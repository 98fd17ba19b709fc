package dev.quillbench.service;

import dev.quillbench.agent.registry.ControllerRegistry;
import dev.quillbench.config.BenchmarkProperties;
import dev.quillbench.domain.valueobject.AggregateStats;
import dev.quillbench.domain.valueobject.BenchmarkRun;
import dev.quillbench.domain.valueobject.ControllerResult;
import dev.quillbench.domain.valueobject.Report;
import dev.quillbench.exception.ReportWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders a run and its statistics as Markdown and writes it to disk.
 *
 * <p>Section order is fixed: title, header, controllers, performance
 * comparison, content preview, overall statistics. Everything except the
 * run id and the timestamps depends only on the run and its stats.
 */
@Service
public class ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(ReportGenerator.class);

    private static final DateTimeFormatter DISPLAY_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ControllerRegistry registry;
    private final Path reportDirectory;
    private final int previewLength;
    private final Clock clock;

    public ReportGenerator(ControllerRegistry registry, BenchmarkProperties properties, Clock clock) {
        this.registry = registry;
        this.reportDirectory = properties.reportDirectory();
        this.previewLength = properties.previewLength();
        this.clock = clock;
    }

    /**
     * Renders and writes the report.
     *
     * @param outputPath destination, or {@code null} for a timestamped file in the report directory
     * @throws ReportWriteException if the file cannot be written; it carries the rendered report
     */
    public Report generate(BenchmarkRun run, AggregateStats stats, Path outputPath) {
        Path target = outputPath != null ? outputPath : defaultPath(run);
        Report report = new Report(render(run, stats), target);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(target, report.markdown(), StandardCharsets.UTF_8);
            log.info("Report saved to {}", target);
        } catch (IOException e) {
            log.error("Failed to save report to {}: {}", target, e.getMessage());
            throw new ReportWriteException(report, e);
        }
        return report;
    }

    /** {@code <reportDirectory>/benchmark_report_<yyyyMMdd_HHmmss>.md}, stamped with the run start. */
    public Path defaultPath(BenchmarkRun run) {
        String stamp = FILE_STAMP.format(run.startedAt().atZone(clock.getZone()));
        return reportDirectory.resolve("benchmark_report_" + stamp + ".md");
    }

    /** Renders the report text without touching the filesystem. */
    public String render(BenchmarkRun run, AggregateStats stats) {
        List<ControllerResult> results = run.results();
        StringBuilder sb = new StringBuilder();

        sb.append("# Content Controller Benchmark Report\n\n");
        sb.append("- **Category**: ").append(run.category()).append('\n');
        sb.append("- **Style**: ").append(run.style()).append('\n');
        sb.append("- **Run ID**: `").append(run.runId()).append("`\n");
        sb.append("- **Started**: ").append(DISPLAY_TIME.format(run.startedAt().atZone(clock.getZone()))).append('\n');
        sb.append("- **Generated**: ").append(DISPLAY_TIME.format(clock.instant().atZone(clock.getZone()))).append("\n\n");

        sb.append("## Controllers\n\n");
        for (int i = 0; i < results.size(); i++) {
            String type = results.get(i).controllerType();
            sb.append(i + 1).append(". `").append(type).append("` - ").append(registry.description(type)).append('\n');
        }
        sb.append('\n');

        sb.append("## Performance Comparison\n\n");
        sb.append("| Controller | Status | Elapsed | Attempts | Error |\n");
        sb.append("| --- | --- | --- | --- | --- |\n");
        for (ControllerResult r : results) {
            sb.append("| ").append(cell(r.controllerType()))
              .append(" | ").append(r.success() ? "✅ success" : "❌ failed")
              .append(" | ").append(seconds(r.elapsed()))
              .append(" | ").append(r.attempts())
              .append(" | ").append(r.success() ? "-" : cell(r.error().kind() + ": " + r.error().message()))
              .append(" |\n");
        }
        sb.append('\n');

        sb.append("## Content Preview\n");
        for (ControllerResult r : results) {
            sb.append("\n### ").append(r.controllerType()).append("\n\n");
            if (r.success()) {
                sb.append("Length: ").append(r.content().length()).append(" characters\n\n");
                sb.append("```\n").append(preview(r.content())).append("\n```\n");
            } else {
                sb.append("*No content (").append(r.error().kind()).append(")*\n");
            }
        }
        sb.append('\n');

        sb.append("## Overall Statistics\n\n");
        sb.append("| Metric | Value |\n");
        sb.append("| --- | --- |\n");
        sb.append("| Controllers | ").append(stats.total()).append(" |\n");
        sb.append("| Succeeded | ").append(stats.successes()).append(" |\n");
        sb.append("| Failed | ").append(stats.failures()).append(" |\n");
        sb.append("| Success rate | ").append(String.format(Locale.ROOT, "%.1f%%", stats.successRate() * 100)).append(" |\n");
        sb.append("| Mean elapsed (successful) | ").append(seconds(stats.meanElapsed())).append(" |\n");
        sb.append("| Fastest / median / slowest | ")
          .append(seconds(stats.latency().min())).append(" / ")
          .append(seconds(stats.latency().median())).append(" / ")
          .append(seconds(stats.latency().max())).append(" |\n");
        sb.append("| Total run time | ").append(seconds(stats.totalElapsed())).append(" |\n");

        return sb.toString();
    }

    private String preview(String content) {
        String text = content.strip().replace("```", "'''");
        return text.length() > previewLength ? text.substring(0, previewLength) + "..." : text;
    }

    private static String seconds(Duration d) {
        return String.format(Locale.ROOT, "%.2f s", d.toNanos() / 1_000_000_000.0);
    }

    private static String cell(String text) {
        return text.replace("|", "\\|").replace("\r", " ").replace("\n", " ");
    }
}
