package org.logsim.compiler.diagnostics;

/**
 * Destination for rendered diagnostic text.
 * <p>
 * A console sink writes each diagnostic as it happens; a buffering sink keeps
 * everything for a host (for example a GUI) that fetches the text in bulk once
 * the file has been accepted or rejected.
 */
public interface DiagnosticSink {

    /**
     * Writes one rendered diagnostic block. The block already ends with a line break.
     * @param text The rendered text.
     */
    void write(String text);

    /**
     * @return All text accumulated so far, or an empty string if the sink does not keep it.
     */
    String contents();
}
