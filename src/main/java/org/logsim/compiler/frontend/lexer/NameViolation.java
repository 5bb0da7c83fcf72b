package org.logsim.compiler.frontend.lexer;

/**
 * The first rule violation found in a would-be device name.
 *
 * @param offset The 0-based offset of the offending character within the token.
 * @param subcode One of {@link #NOT_LOWERCASE_LETTER_FIRST}, {@link #NOT_WORD_CHARACTER}
 *                or {@link #NOT_LOWERCASE}.
 */
public record NameViolation(int offset, int subcode) {
    /** The first character is not a lowercase letter. */
    public static final int NOT_LOWERCASE_LETTER_FIRST = 1;
    /** A character is not a letter, digit or underscore. */
    public static final int NOT_WORD_CHARACTER = 2;
    /** A character is an uppercase letter. */
    public static final int NOT_LOWERCASE = 3;
}
