package org.logsim.compiler.frontend.parser.features.monitor;

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
 * Handles monitor items: {@code dev} or {@code dev.OUTPUT}.
 */
public class MonitorItemHandler implements IItemHandler {

    @Override
    public ItemDescriptor parse(ParsingContext context) {
        if (!context.check(SymbolType.NAME)) {
            context.reportInvalidName();
            context.synchronize(Section.MONITOR);
            return ItemDescriptor.failedItem();
        }
        List<Symbol> symbols = new ArrayList<>(3);
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

        if (!context.isSeparator()) {
            return fail(context, SyntaxError.BAD_MONITOR_SEPARATOR);
        }
        return ItemDescriptor.of(symbols);
    }

    private ItemDescriptor fail(ParsingContext context, SyntaxError error) {
        context.reportSyntaxError(error, context.current(), 0);
        context.synchronize(Section.MONITOR);
        return ItemDescriptor.failedItem();
    }
}
