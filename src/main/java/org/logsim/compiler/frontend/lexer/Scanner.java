package org.logsim.compiler.frontend.lexer;

import org.logsim.compiler.diagnostics.CompilerLogger;
import org.logsim.compiler.diagnostics.ConsoleDiagnosticSink;
import org.logsim.compiler.diagnostics.DiagnosticSink;
import org.logsim.compiler.frontend.names.NameTable;
import org.logsim.compiler.internal.i18n.Messages;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The Scanner converts a circuit definition file into a sequence of {@link Symbol}s.
 * <p>
 * The whole file is tokenized once at construction and cached, together with its lines.
 * {@link #getSymbol()} walks the cached sequence with a cursor that rewinds after running
 * past the end, so the sequence can be replayed. The scanner also renders positioned
 * diagnostics (message, source line, caret line) into a {@link DiagnosticSink}.
 */
public class Scanner {

    private static final String TERMINATORS = ";:,.";

    private final NameTable names;
    private final DiagnosticSink sink;
    private final boolean lineNumberPrefix;
    private final String fileName;
    private final String source;
    private final List<String> lines;
    private final List<Symbol> symbols = new ArrayList<>();

    private int cursor = -1;

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine;
    private int startColumn;
    private int unterminatedCommentLine = 0;
    private int unterminatedCommentColumn = 0;

    /**
     * Creates a scanner that writes diagnostics to standard output.
     * @param path The definition file.
     * @param names The name table the symbol texts are interned into.
     * @throws UncheckedIOException if the file cannot be read.
     */
    public Scanner(Path path, NameTable names) {
        this(path, names, new ConsoleDiagnosticSink(), true);
    }

    /**
     * Creates a scanner for a definition file.
     * @param path The definition file.
     * @param names The name table the symbol texts are interned into.
     * @param sink Where rendered diagnostics go.
     * @param lineNumberPrefix Whether source lines in diagnostics are prefixed with {@code "Line N: "}.
     * @throws UncheckedIOException if the file cannot be read.
     */
    public Scanner(Path path, NameTable names, DiagnosticSink sink, boolean lineNumberPrefix) {
        this(readSource(path), path.toString(), names, sink, lineNumberPrefix);
    }

    /**
     * Creates a scanner for in-memory source text.
     * @param source The definition text.
     * @param fileName The logical file name, used in logs and diagnostics.
     * @param names The name table the symbol texts are interned into.
     * @param sink Where rendered diagnostics go.
     * @param lineNumberPrefix Whether source lines in diagnostics are prefixed with {@code "Line N: "}.
     */
    public Scanner(String source, String fileName, NameTable names, DiagnosticSink sink, boolean lineNumberPrefix) {
        this.source = source;
        this.fileName = fileName;
        this.names = names;
        this.sink = sink;
        this.lineNumberPrefix = lineNumberPrefix;
        this.lines = splitLines(source);
        scanSymbols();
        CompilerLogger.debug("Scanned {} symbols on {} lines from {}", symbols.size(), lines.size(), fileName);
        if (hasUnterminatedComment()) {
            CompilerLogger.warn("Unterminated comment in {} starting at line {}", fileName, unterminatedCommentLine);
            render(unterminatedCommentLine, unterminatedCommentColumn, Messages.get("scanner.unterminated.comment"));
        }
    }

    private static String readSource(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read definition file " + path, e);
        }
    }

    // Lines end at '\n' only, as in the scanning loop; a '\r' before it is dropped.
    private static List<String> splitLines(String source) {
        List<String> result = new ArrayList<>();
        int from = 0;
        while (from < source.length()) {
            int end = source.indexOf('\n', from);
            if (end < 0) {
                end = source.length();
            }
            String text = source.substring(from, end);
            result.add(text.endsWith("\r") ? text.substring(0, text.length() - 1) : text);
            from = end + 1;
        }
        return result;
    }

    /**
     * Returns the next symbol. After the last symbol one empty result is returned and the
     * cursor rewinds, so that the following call starts again with the first symbol.
     * @return The next symbol, or empty past the end of the file.
     */
    public Optional<Symbol> getSymbol() {
        cursor++;
        if (cursor >= symbols.size()) {
            cursor = -1;
            return Optional.empty();
        }
        return Optional.of(symbols.get(cursor));
    }

    /**
     * @return The symbol the next {@link #getSymbol()} call returns, without consuming it.
     */
    public Optional<Symbol> peekSymbol() {
        int next = cursor + 1;
        return next < symbols.size() ? Optional.of(symbols.get(next)) : Optional.empty();
    }

    /**
     * @return All symbols of the file, in order. The list is cached and unmodifiable.
     */
    public List<Symbol> getAllSymbols() {
        return Collections.unmodifiableList(symbols);
    }

    /**
     * @return The last symbol of the file, or empty for a file without symbols.
     */
    public Optional<Symbol> lastSymbol() {
        return symbols.isEmpty() ? Optional.empty() : Optional.of(symbols.get(symbols.size() - 1));
    }

    /**
     * Reads a line of the source, independent of the cursor.
     * @param lineNumber The 1-based line number.
     * @return The line without its terminator, or empty if there is no such line.
     */
    public Optional<String> getLine(int lineNumber) {
        if (lineNumber < 1 || lineNumber > lines.size()) {
            return Optional.empty();
        }
        return Optional.of(lines.get(lineNumber - 1));
    }

    /**
     * Renders a diagnostic pointing at a symbol: the message, the source line and a caret line.
     * @param symbol The symbol the diagnostic refers to; may be null.
     * @param arrowOffset How many characters right of the symbol's first character the caret goes.
     * @param message The message text.
     * @return false if there is no symbol or its line cannot be read, true otherwise.
     */
    public boolean printError(Symbol symbol, int arrowOffset, String message) {
        if (symbol == null) {
            return false;
        }
        return render(symbol.line(), symbol.column() + arrowOffset, message);
    }

    /**
     * Writes an unpositioned message line, e.g. a summary.
     * @param message The message text.
     */
    public void printMessage(String message) {
        sink.write(message + "\n");
    }

    /**
     * @return Everything rendered so far when the scanner buffers its diagnostics, otherwise "".
     */
    public String getErrorMessages() {
        return sink.contents();
    }

    /**
     * @return true if a {@code !} comment was still open at the end of the file.
     */
    public boolean hasUnterminatedComment() {
        return unterminatedCommentLine > 0;
    }

    /**
     * @return The line of the opening {@code !} of an unterminated comment, or 0.
     */
    public int getUnterminatedCommentLine() {
        return unterminatedCommentLine;
    }

    /**
     * @return The logical name of the scanned file.
     */
    public String getFileName() {
        return fileName;
    }

    private boolean render(int lineNumber, int caretColumn, String message) {
        Optional<String> text = getLine(lineNumber);
        if (text.isEmpty()) {
            return false;
        }
        String prefix = lineNumberPrefix ? "Line " + lineNumber + ": " : "";
        String caret = " ".repeat(Math.max(0, prefix.length() + caretColumn - 1)) + "^";
        sink.write(message + "\n" + prefix + text.get() + "\n" + caret + "\n");
        return true;
    }

    private void scanSymbols() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanSymbol();
        }
    }

    private void scanSymbol() {
        char c = advance();
        switch (c) {
            case '#':
                // A comment goes until the end of the line.
                while (peek() != '\n' && !isAtEnd()) advance();
                break;
            case '!':
                multiLineComment();
                break;
            case '\n':
                newLine();
                break;
            default:
                if (Character.isWhitespace(c)) {
                    break;
                }
                if (isDigit(c)) {
                    number();
                } else if (isLetter(c)) {
                    word();
                } else {
                    addSymbol();
                }
                break;
        }
    }

    private void multiLineComment() {
        while (!isAtEnd()) {
            char c = advance();
            if (c == '!') {
                return;
            }
            if (c == '\n') {
                newLine();
            }
        }
        unterminatedCommentLine = startLine;
        unterminatedCommentColumn = startColumn;
    }

    private void number() {
        while (isDigit(peek())) advance();
        addSymbol();
    }

    private void word() {
        // Stray characters other than the terminators stay in the word; the parser rejects them.
        while (!isAtEnd() && !Character.isWhitespace(peek()) && TERMINATORS.indexOf(peek()) < 0) {
            advance();
        }
        addSymbol();
    }

    private void addSymbol() {
        String text = source.substring(start, current);
        symbols.add(Symbol.of(text, names.intern(text), startLine, startColumn));
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
