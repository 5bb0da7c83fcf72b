package org.logsim.compiler.api;

import org.logsim.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when a definition file is rejected or cannot be read.
 * <p>
 * It is part of the public API and hides the internal exception types of the compiler.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        this(message, List.of());
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
        this.diagnostics = List.of();
    }

    /**
     * Constructs a new compilation exception carrying the diagnostics that led to the rejection.
     * @param message The detail message.
     * @param diagnostics The collected diagnostics.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message, null);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The diagnostics collected before the file was rejected; empty for I/O failures.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
