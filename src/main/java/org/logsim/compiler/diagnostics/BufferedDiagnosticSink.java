package org.logsim.compiler.diagnostics;

/**
 * Accumulates diagnostics in memory for embedded use.
 */
public class BufferedDiagnosticSink implements DiagnosticSink {

    private final StringBuilder buffer = new StringBuilder();

    @Override
    public void write(String text) {
        buffer.append(text);
    }

    @Override
    public String contents() {
        return buffer.toString();
    }

    /**
     * Discards everything written so far.
     */
    public void clear() {
        buffer.setLength(0);
    }
}
