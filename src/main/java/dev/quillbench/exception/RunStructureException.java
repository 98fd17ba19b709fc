package dev.quillbench.exception;

/**
 * Raised when a benchmark run has nothing to execute.
 */
public class RunStructureException extends RuntimeException {

    public RunStructureException(String message) {
        super(message);
    }
}
