package org.logsim.compiler.frontend.parser;

import org.logsim.compiler.frontend.lexer.Symbol;
import org.logsim.compiler.frontend.lexer.SymbolType;

/**
 * Gives item handlers access to the symbol stream and to error reporting,
 * without coupling them to the parser itself.
 * <p>
 * {@link #advance()} never returns past the end of the file: it reports
 * {@link SyntaxError#PREMATURE_END_OF_FILE} and unwinds the whole parse instead.
 */
public interface ParsingContext {

    /**
     * @return The symbol under the cursor.
     */
    Symbol current();

    /**
     * @return The symbol before the current one, or null at the start of the file.
     */
    Symbol previous();

    /**
     * Moves to the next symbol.
     * @return The new current symbol.
     */
    Symbol advance();

    /**
     * @param type The symbol type to check.
     * @return true if the current symbol is of the given type.
     */
    boolean check(SymbolType type);

    /**
     * Looks at the symbol after the current one without consuming anything.
     * @param types The symbol types to check.
     * @return true if there is a next symbol and it is of one of the given types.
     */
    boolean checkNext(SymbolType... types);

    /**
     * @return true if the current symbol is ',' or ';'.
     */
    boolean isSeparator();

    /**
     * @param keyword The keyword text.
     * @return true if the current symbol is that keyword.
     */
    boolean isKeyword(String keyword);

    /**
     * @param symbol A symbol of the scanned file.
     * @return The text of the symbol.
     */
    String text(Symbol symbol);

    /**
     * Reports a syntax error and renders it with a caret under the symbol.
     * @param error The error.
     * @param at The offending symbol; may be null.
     * @param caretOffset How far right of the symbol's first character the caret goes.
     */
    void reportSyntaxError(SyntaxError error, Symbol at, int caretOffset);

    /**
     * Reports {@link SyntaxError#INVALID_DEVICE_NAME} for the current symbol, naming the broken rule
     * and pointing at the first offending character.
     */
    void reportInvalidName();

    /**
     * Discards symbols until a ',' or ';' or the keyword that follows the section.
     * @param section The section being parsed.
     */
    void synchronize(Section section);
}
