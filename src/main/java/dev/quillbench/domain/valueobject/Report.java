package dev.quillbench.domain.valueobject;

import java.nio.file.Path;

/** Rendered comparison report and the file it was (or was meant to be) written to. */
public record Report(String markdown, Path path) {}
