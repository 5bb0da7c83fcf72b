package org.logsim.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors, warnings)
 * that occur while a definition file is scanned, parsed and built.
 * <p>
 * This decouples the record of what went wrong from how it is rendered for the user,
 * which is the job of the {@link DiagnosticSink}.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code         The diagnostic kind.
     * @param message      The error message.
     * @param fileName     The file in which the error occurred.
     * @param lineNumber   The line number of the error.
     * @param columnNumber The column of the error.
     */
    public void reportError(String code, String message, String fileName, int lineNumber, int columnNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, fileName, lineNumber, columnNumber));
    }

    /**
     * Reports a warning.
     *
     * @param code         The diagnostic kind.
     * @param message      The warning message.
     * @param fileName     The file in which the warning occurred.
     * @param lineNumber   The line number of the warning.
     * @param columnNumber The column of the warning.
     */
    public void reportWarning(String code, String message, String fileName, int lineNumber, int columnNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, message, fileName, lineNumber, columnNumber));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return The number of reported errors.
     */
    public int errorCount() {
        return (int) diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
    }

    /**
     * @return The number of reported warnings.
     */
    public int warningCount() {
        return (int) diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.WARNING).count();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
