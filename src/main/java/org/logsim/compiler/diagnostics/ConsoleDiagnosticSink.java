package org.logsim.compiler.diagnostics;

import java.io.PrintStream;

/**
 * Writes diagnostics straight to a print stream, standard output by default.
 */
public class ConsoleDiagnosticSink implements DiagnosticSink {

    private final PrintStream out;

    public ConsoleDiagnosticSink() {
        this(System.out);
    }

    /**
     * @param out The stream to write to.
     */
    public ConsoleDiagnosticSink(PrintStream out) {
        this.out = out;
    }

    @Override
    public void write(String text) {
        out.print(text);
        out.flush();
    }

    @Override
    public String contents() {
        return "";
    }
}
