package org.logsim.compiler.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs during the compilation of a definition file.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code A stable identifier of the diagnostic kind, e.g. {@code SYNTAX_22} or {@code DEVICE_PRESENT}.
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param lineNumber The line number of the issue, or 0 if the issue has no position.
 * @param columnNumber The column the caret points at, or 0 if the issue has no position.
 */
public record Diagnostic(
        Type type,
        String code,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, fileName, lineNumber, columnNumber, message);
    }
}
