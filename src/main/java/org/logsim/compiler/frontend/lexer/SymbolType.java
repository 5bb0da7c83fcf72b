package org.logsim.compiler.frontend.lexer;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Defines the syntactic categories that the {@link Scanner} assigns to symbols.
 */
public enum SymbolType {
    // Reserved words.
    /** A section or device keyword, such as DEVICES or NAND. */
    KEYWORD,
    /** An input pin name, such as I3 or CLK. */
    INPUT_PIN,
    /** An output pin name, Q or QBAR. */
    OUTPUT_PIN,

    // Words and literals.
    /** A lowercase identifier usable as a device name. */
    NAME,
    /** Any other run of letters, digits and underscores. */
    STRING,
    /** A run of digits with a leading zero. */
    NUMBER,
    /** A run of digits without a leading zero. */
    INTEGER,

    // Single-character punctuation.
    /** The ';' character. */
    SEMICOLON,
    /** The ':' character. */
    COLON,
    /** The ',' character. */
    COMMA,
    /** The '.' character. */
    DOT,
    /** The '>' character. */
    ARROW,

    /** Anything else. */
    OTHER;

    /** The largest fan-in of a logic gate, and so the highest numbered gate input pin. */
    public static final int MAX_INPUT_PINS = 16;

    private static final Set<String> KEYWORDS = Set.of(
            "DEVICES", "CONNECT", "MONITOR", "END",
            "AND", "NAND", "OR", "NOR", "DTYPE", "XOR", "SWITCH", "CLOCK", "RC", "SIGGEN");

    private static final Set<String> INPUT_PINS = Stream.concat(
                    IntStream.rangeClosed(1, MAX_INPUT_PINS).mapToObj(i -> "I" + i),
                    Stream.of("DATA", "SET", "CLEAR", "CLK"))
            .collect(Collectors.toUnmodifiableSet());

    private static final Set<String> OUTPUT_PINS = Set.of("Q", "QBAR");

    private static final Map<String, SymbolType> PUNCTUATION = Map.of(
            ";", SEMICOLON,
            ":", COLON,
            ",", COMMA,
            ".", DOT,
            ">", ARROW);

    /**
     * Determines the category of a piece of source text. The result depends only on the text.
     * @param text The token text.
     * @return The category of the text.
     */
    public static SymbolType classify(String text) {
        if (text == null || text.isEmpty()) {
            return OTHER;
        }
        if (INPUT_PINS.contains(text)) return INPUT_PIN;
        if (OUTPUT_PINS.contains(text)) return OUTPUT_PIN;
        if (KEYWORDS.contains(text)) return KEYWORD;
        if (Symbol.isNumber(text)) {
            return Symbol.isInteger(text) ? INTEGER : NUMBER;
        }
        if (Symbol.isString(text)) {
            return Symbol.isName(text) ? NAME : STRING;
        }
        return PUNCTUATION.getOrDefault(text, OTHER);
    }

    /**
     * @param text The token text.
     * @return true if the text is one of the reserved keywords.
     */
    public static boolean isKeyword(String text) {
        return KEYWORDS.contains(text);
    }
}
