package org.logsim.compiler.frontend.parser;

import org.logsim.compiler.api.IDevices;
import org.logsim.compiler.api.IMonitors;
import org.logsim.compiler.api.INetwork;
import org.logsim.compiler.api.SemanticErrorKind;
import org.logsim.compiler.diagnostics.CompilerLogger;
import org.logsim.compiler.diagnostics.DiagnosticsEngine;
import org.logsim.compiler.frontend.lexer.NameViolation;
import org.logsim.compiler.frontend.lexer.Scanner;
import org.logsim.compiler.frontend.lexer.Symbol;
import org.logsim.compiler.frontend.lexer.SymbolType;
import org.logsim.compiler.frontend.names.NameTable;
import org.logsim.compiler.frontend.semantics.NetworkBuilder;
import org.logsim.compiler.frontend.semantics.SemanticErrorHandler;
import org.logsim.compiler.internal.i18n.Messages;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/**
 * The parser for circuit definition files. It pulls symbols from the {@link Scanner},
 * checks them against the grammar
 * <pre>
 *   file    = "DEVICES" ":" devices ";" "CONNECT" ":" [connections] ";" "MONITOR" ":" [monitors] ";" "END" ";"
 *   devices = device { "," device }
 * </pre>
 * and, if the file has no syntax errors, builds the network through the device, network
 * and monitor collaborators.
 * <p>
 * After a syntax error the parser resynchronizes at the next ',' or ';' (or at the keyword
 * of the next section) and carries on, so that one run reports as many independent errors as
 * possible. Running out of symbols ends the parse immediately. A parser reads its file once.
 */
public class Parser implements ParsingContext {

    private static final String END_KEYWORD = "END";

    private final NameTable names;
    private final Scanner scanner;
    private final DiagnosticsEngine diagnostics;
    private final ItemHandlerRegistry itemHandlers;
    private final SemanticErrorHandler semanticErrorHandler;
    private final NetworkBuilder networkBuilder;

    private Symbol current;
    private Symbol previous;
    private int errorCount = 0;

    /**
     * Constructs a parser with its own diagnostics engine and the default warning kinds.
     * @param names The name table the scanner interns into.
     * @param devices The device store to build into.
     * @param network The connection graph to build into.
     * @param monitors The monitors to build into.
     * @param scanner The scanner of the definition file.
     */
    public Parser(NameTable names, IDevices devices, INetwork network, IMonitors monitors, Scanner scanner) {
        this(names, devices, network, monitors, scanner, new DiagnosticsEngine(), SemanticErrorHandler.DEFAULT_WARNINGS);
    }

    /**
     * Constructs a parser.
     * @param names The name table the scanner interns into.
     * @param devices The device store to build into.
     * @param network The connection graph to build into.
     * @param monitors The monitors to build into.
     * @param scanner The scanner of the definition file.
     * @param diagnostics The engine for recording errors and warnings.
     * @param warningKinds The semantic failure kinds that do not stop the build.
     */
    public Parser(NameTable names, IDevices devices, INetwork network, IMonitors monitors, Scanner scanner,
                  DiagnosticsEngine diagnostics, Set<SemanticErrorKind> warningKinds) {
        this.names = names;
        this.scanner = scanner;
        this.diagnostics = diagnostics;
        this.itemHandlers = ItemHandlerRegistry.initialize();
        this.semanticErrorHandler = new SemanticErrorHandler(
                names, devices, network, monitors, scanner, diagnostics, warningKinds);
        this.networkBuilder = new NetworkBuilder(names, devices, network, monitors, semanticErrorHandler);
    }

    /**
     * Parses the file and, if it is free of syntax errors, builds the network.
     * @return true if the file was accepted and the network built without fatal errors.
     */
    public boolean parseNetwork() {
        Optional<NetworkDescription> description = parseFile();
        if (description.isEmpty()) {
            return false;
        }
        boolean built = networkBuilder.build(description.get());
        if (built) {
            CompilerLogger.info("Built network from {} ({} items, {} warnings)", scanner.getFileName(),
                    description.get().itemCount(), semanticErrorHandler.getWarningCount());
        } else {
            CompilerLogger.info("Network from {} rejected with a semantic error", scanner.getFileName());
        }
        return built;
    }

    /**
     * Checks the syntax of the whole file. When syntax errors were found a summary line
     * with their count is written after the individual diagnostics.
     * @return The parsed description, or empty if there was at least one syntax error.
     */
    public Optional<NetworkDescription> parseFile() {
        NetworkDescription description = parseDescription();
        if (errorCount == 0) {
            CompilerLogger.debug("No syntax errors in {}", scanner.getFileName());
            return Optional.of(description);
        }
        String summaryKey = errorCount == 1 ? "syntax.summary.one" : "syntax.summary.many";
        scanner.printMessage(Messages.get(summaryKey, errorCount));
        CompilerLogger.info("{} syntax error(s) in {}", errorCount, scanner.getFileName());
        return Optional.empty();
    }

    /**
     * Runs the syntax pass. Items with a syntax error are kept as placeholders,
     * and a premature end of file leaves the description as far as it got.
     * @return The description, complete or not.
     */
    NetworkDescription parseDescription() {
        NetworkDescription description = new NetworkDescription();
        try {
            advance();
            for (Section section : Section.values()) {
                sectionHeader(section, description);
                itemList(section, description);
            }
            end();
        } catch (PrematureEndOfFileException e) {
            CompilerLogger.debug("{}", e.getMessage());
        }
        return description;
    }

    /**
     * @return The number of syntax errors reported so far.
     */
    public int getErrorCount() {
        return errorCount;
    }

    /**
     * @return The engine holding every syntax and semantic diagnostic.
     */
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    /**
     * @return The handler that reported the semantic diagnostics.
     */
    public SemanticErrorHandler getSemanticErrorHandler() {
        return semanticErrorHandler;
    }

    private void sectionHeader(Section section, NetworkDescription description) {
        if (isKeyword(section.keyword())) {
            description.setKeywordSymbol(section, current);
            advance();
            if (check(SymbolType.COLON)) {
                advance();
            } else {
                reportSyntaxError(SyntaxError.MISSING_COLON, current, 0);
            }
            return;
        }
        reportSyntaxError(section.missingKeywordError(), current, 0);
        if (checkNext(SymbolType.COLON)) {
            // A misspelt keyword: step over it and its colon.
            advance();
            advance();
        }
    }

    private void itemList(Section section, NetworkDescription description) {
        if (check(SymbolType.SEMICOLON)) {
            if (!section.allowsEmpty()) {
                reportSyntaxError(SyntaxError.NO_DEVICES, current, 0);
            }
            advance();
            return;
        }
        IItemHandler handler = itemHandlers.get(section);
        description.add(section, handler.parse(this));
        while (check(SymbolType.COMMA)) {
            Symbol comma = current;
            advance();
            if (isKeyword(section.followingKeyword())) {
                reportSyntaxError(section.separatorError(), comma, 0);
                return;
            }
            description.add(section, handler.parse(this));
        }
        // Handlers stop at ',', ';' or the next section keyword. At the keyword the ';' is
        // missing, and the item that stopped there has already been reported.
        if (check(SymbolType.SEMICOLON)) {
            advance();
        }
    }

    private void end() {
        if (!isKeyword(END_KEYWORD)) {
            reportSyntaxError(SyntaxError.MISSING_END_KEYWORD, current, 0);
        }
        advance(SyntaxError.MISSING_FINAL_SEMICOLON);
        if (!check(SymbolType.SEMICOLON)) {
            reportSyntaxError(SyntaxError.MISSING_FINAL_SEMICOLON, current, 0);
        }
        scanner.peekSymbol().ifPresent(trailing ->
                CompilerLogger.debug("Ignoring symbols after END in {} from line {}", scanner.getFileName(), trailing.line()));
    }

    @Override
    public Symbol current() {
        return current;
    }

    @Override
    public Symbol previous() {
        return previous;
    }

    @Override
    public Symbol advance() {
        return advance(SyntaxError.PREMATURE_END_OF_FILE);
    }

    private Symbol advance(SyntaxError atEndOfFile) {
        Optional<Symbol> next = scanner.getSymbol();
        if (next.isEmpty()) {
            reportSyntaxError(atEndOfFile, scanner.lastSymbol().orElse(null), 0);
            throw new PrematureEndOfFileException(scanner.getFileName());
        }
        previous = current;
        current = next.get();
        CompilerLogger.trace("Symbol {} '{}' at {}:{}", current.type(), text(current), current.line(), current.column());
        return current;
    }

    @Override
    public boolean check(SymbolType type) {
        return current != null && current.type() == type;
    }

    @Override
    public boolean checkNext(SymbolType... types) {
        Optional<Symbol> next = scanner.peekSymbol();
        return next.isPresent() && Arrays.asList(types).contains(next.get().type());
    }

    @Override
    public boolean isSeparator() {
        return check(SymbolType.COMMA) || check(SymbolType.SEMICOLON);
    }

    @Override
    public boolean isKeyword(String keyword) {
        return check(SymbolType.KEYWORD) && keyword.equals(text(current));
    }

    @Override
    public String text(Symbol symbol) {
        return names.resolve(symbol.id()).orElse("");
    }

    @Override
    public void reportSyntaxError(SyntaxError error, Symbol at, int caretOffset) {
        report(error, at, caretOffset, error.message());
    }

    @Override
    public void reportInvalidName() {
        Optional<NameViolation> violation = Symbol.indexNotName(text(current));
        int offset = violation.map(NameViolation::offset).orElse(0);
        String message = SyntaxError.INVALID_DEVICE_NAME.message();
        if (violation.isPresent()) {
            message = message + " " + Messages.get("name.violation." + violation.get().subcode());
        }
        report(SyntaxError.INVALID_DEVICE_NAME, current, offset, message);
    }

    @Override
    public void synchronize(Section section) {
        while (!isSeparator() && !isKeyword(section.followingKeyword())) {
            advance();
        }
    }

    private void report(SyntaxError error, Symbol at, int caretOffset, String message) {
        errorCount++;
        int line = at == null ? 0 : at.line();
        int column = at == null ? 0 : at.column() + caretOffset;
        diagnostics.reportError(error.code(), message, scanner.getFileName(), line, column);
        scanner.printError(at, caretOffset, message);
    }
}
