package org.logsim.compiler.frontend.lexer;

/**
 * Outcome of {@link Symbol#isWaveform(String)}.
 *
 * @param valid Whether the text is a non-empty run of 0s and 1s.
 * @param firstBadOffset The offset of the first offending character, or null when valid.
 */
public record WaveformCheck(boolean valid, Integer firstBadOffset) {

    static final WaveformCheck VALID = new WaveformCheck(true, null);

    static WaveformCheck invalidAt(int offset) {
        return new WaveformCheck(false, offset);
    }
}
