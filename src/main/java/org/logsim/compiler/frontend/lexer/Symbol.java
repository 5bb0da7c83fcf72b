package org.logsim.compiler.frontend.lexer;

import java.util.Optional;

/**
 * Represents a single symbol extracted from a definition file by the {@link Scanner}.
 * <p>
 * The symbol does not carry its text; the text is interned in the
 * {@link org.logsim.compiler.frontend.names.NameTable} and referenced through {@code id}.
 * The static helpers below are pure checks on raw token text used for classification
 * and for pinpointing the offending character in diagnostics.
 *
 * @param id The name-table id of the symbol text.
 * @param type The syntactic category of the symbol.
 * @param line The 1-based line on which the symbol starts.
 * @param column The 1-based column of the first character of the symbol.
 */
public record Symbol(int id, SymbolType type, int line, int column) {

    /**
     * Creates a symbol, classifying it from its text.
     * @param text The token text.
     * @param id The name-table id of the text.
     * @param line The 1-based line number.
     * @param column The 1-based column number.
     * @return The new symbol.
     */
    public static Symbol of(String text, int id, int line, int column) {
        return new Symbol(id, SymbolType.classify(text), line, column);
    }

    /**
     * @param text The token text.
     * @return true if the text is non-empty and consists of letters, digits and underscores only.
     */
    public static boolean isString(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!isWordChar(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param text The token text.
     * @return true if the text is a valid device name: a lowercase letter followed by
     *         lowercase letters, digits and underscores.
     */
    public static boolean isName(String text) {
        return indexNotName(text).isEmpty();
    }

    /**
     * @param text The token text.
     * @return true if the text is a non-empty run of digits.
     */
    public static boolean isNumber(String text) {
        return indexNotNumber(text).isEmpty();
    }

    /**
     * @param text The token text.
     * @return true if the text is a run of digits without a leading zero.
     */
    public static boolean isInteger(String text) {
        return indexNotInteger(text).isEmpty();
    }

    /**
     * Locates the first character that keeps the text from being a valid name.
     * @param text The token text.
     * @return The offending offset and the kind of violation, or empty if the text is a valid name.
     */
    public static Optional<NameViolation> indexNotName(String text) {
        if (text == null || text.isEmpty() || !isLowercaseLetter(text.charAt(0))) {
            return Optional.of(new NameViolation(0, NameViolation.NOT_LOWERCASE_LETTER_FIRST));
        }
        for (int i = 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!isWordChar(c)) {
                return Optional.of(new NameViolation(i, NameViolation.NOT_WORD_CHARACTER));
            }
            if (c >= 'A' && c <= 'Z') {
                return Optional.of(new NameViolation(i, NameViolation.NOT_LOWERCASE));
            }
        }
        return Optional.empty();
    }

    /**
     * @param text The token text.
     * @return The offset of the first non-digit, or empty if the text is a number.
     */
    public static Optional<Integer> indexNotNumber(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.of(0);
        }
        for (int i = 0; i < text.length(); i++) {
            if (!isDigit(text.charAt(i))) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }

    /**
     * @param text The token text.
     * @return The offset of the first character that keeps the text from being an integer
     *         (a leading zero counts), or empty if the text is an integer.
     */
    public static Optional<Integer> indexNotInteger(String text) {
        if (text == null || text.isEmpty() || text.charAt(0) == '0') {
            return Optional.of(0);
        }
        return indexNotNumber(text);
    }

    /**
     * Checks that the text is a non-empty run of 0s and 1s.
     * @param text The token text.
     * @return The outcome, with the offset of the first bad character for invalid text.
     */
    public static WaveformCheck isWaveform(String text) {
        if (text == null || text.isEmpty()) {
            return WaveformCheck.invalidAt(0);
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '0' && c != '1') {
                return WaveformCheck.invalidAt(i);
            }
        }
        return WaveformCheck.VALID;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLowercaseLetter(char c) {
        return c >= 'a' && c <= 'z';
    }

    private static boolean isWordChar(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                isDigit(c) || c == '_';
    }
}
