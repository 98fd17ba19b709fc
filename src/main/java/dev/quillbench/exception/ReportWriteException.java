package dev.quillbench.exception;

import dev.quillbench.domain.valueobject.Report;

import java.io.IOException;

/**
 * Report file could not be written. The rendered report is still available
 * through {@link #getReport()}.
 */
public class ReportWriteException extends RuntimeException {

    private final transient Report report;

    public ReportWriteException(Report report, IOException cause) {
        super("Failed to write report to " + report.path() + ": " + cause.getMessage(), cause);
        this.report = report;
    }

    public Report getReport() {
        return report;
    }
}
