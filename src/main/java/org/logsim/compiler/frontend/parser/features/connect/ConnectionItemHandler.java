package org.logsim.compiler.frontend.parser.features.connect;

import org.logsim.compiler.frontend.lexer.Symbol;
import org.logsim.compiler.frontend.lexer.SymbolType;
import org.logsim.compiler.frontend.parser.IItemHandler;
import org.logsim.compiler.frontend.parser.ItemDescriptor;
import org.logsim.compiler.frontend.parser.ParsingContext;
import org.logsim.compiler.frontend.parser.Section;
import org.logsim.compiler.frontend.parser.SyntaxError;

import java.util.ArrayList;
import java.util.List;

/**
 * Handles connection items: {@code dev[.OUTPUT] > dev.INPUT}.
 */
public class ConnectionItemHandler implements IItemHandler {

    @Override
    public ItemDescriptor parse(ParsingContext context) {
        List<Symbol> symbols = new ArrayList<>(7);

        if (!context.check(SymbolType.NAME)) {
            return failOnName(context);
        }
        symbols.add(context.current());
        context.advance();

        if (context.check(SymbolType.DOT)) {
            symbols.add(context.current());
            context.advance();
            if (!context.check(SymbolType.OUTPUT_PIN)) {
                return fail(context, SyntaxError.INVALID_OUTPUT_PIN);
            }
            symbols.add(context.current());
            context.advance();
        }

        if (!context.check(SymbolType.ARROW)) {
            return fail(context, SyntaxError.MISSING_ARROW);
        }
        symbols.add(context.current());
        context.advance();

        if (!context.check(SymbolType.NAME)) {
            return failOnName(context);
        }
        symbols.add(context.current());
        context.advance();

        if (!context.check(SymbolType.DOT)) {
            return fail(context, SyntaxError.MISSING_INPUT_PIN);
        }
        symbols.add(context.current());
        context.advance();

        if (!context.check(SymbolType.INPUT_PIN)) {
            return fail(context, SyntaxError.INVALID_INPUT_PIN);
        }
        symbols.add(context.current());
        context.advance();

        if (!context.isSeparator()) {
            return fail(context, SyntaxError.BAD_CONNECTION_SEPARATOR);
        }
        return ItemDescriptor.of(symbols);
    }

    private ItemDescriptor fail(ParsingContext context, SyntaxError error) {
        context.reportSyntaxError(error, context.current(), 0);
        context.synchronize(Section.CONNECT);
        return ItemDescriptor.failedItem();
    }

    private ItemDescriptor failOnName(ParsingContext context) {
        context.reportInvalidName();
        context.synchronize(Section.CONNECT);
        return ItemDescriptor.failedItem();
    }
}
