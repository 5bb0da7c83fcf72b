package org.logsim.compiler.api;

import org.logsim.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Outcome of an accepted definition file. The network itself lives in the collaborators
 * that were passed to the compiler.
 *
 * @param diagnostics The warnings collected while building.
 * @param renderedMessages The buffered diagnostic text, or "" when diagnostics went to the console.
 */
public record CompilationResult(List<Diagnostic> diagnostics, String renderedMessages) {

    public CompilationResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return true if the build produced warnings.
     */
    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.WARNING);
    }
}
