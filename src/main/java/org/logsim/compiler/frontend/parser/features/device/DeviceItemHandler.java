package org.logsim.compiler.frontend.parser.features.device;

import org.logsim.compiler.frontend.lexer.Symbol;
import org.logsim.compiler.frontend.lexer.SymbolType;
import org.logsim.compiler.frontend.parser.IItemHandler;
import org.logsim.compiler.frontend.parser.ItemDescriptor;
import org.logsim.compiler.frontend.parser.ParsingContext;
import org.logsim.compiler.frontend.parser.Section;
import org.logsim.compiler.frontend.parser.SyntaxError;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Handles device items: {@code KEYWORD name [property]}.
 * A ',' between the name and a numeric property is tolerated, e.g. {@code SWITCH sw1, 0}.
 */
public class DeviceItemHandler implements IItemHandler {

    @Override
    public ItemDescriptor parse(ParsingContext context) {
        Symbol keyword = context.current();
        Optional<DeviceKind> kind = DeviceKind.fromKeyword(context.text(keyword));
        if (kind.isEmpty()) {
            return fail(context, SyntaxError.UNKNOWN_DEVICE_TYPE, keyword, 0);
        }
        List<Symbol> symbols = new ArrayList<>(3);
        symbols.add(keyword);

        Symbol name = context.advance();
        if (context.isSeparator()) {
            // Keyword directly followed by ',' or ';': the list loop takes it from here.
            context.reportSyntaxError(kind.get().missingParameterError(), name, 0);
            return ItemDescriptor.failedItem();
        }
        if (!context.check(SymbolType.NAME)) {
            context.reportInvalidName();
            context.synchronize(Section.DEVICES);
            return ItemDescriptor.failedItem();
        }
        symbols.add(name);
        context.advance();

        if (kind.get().hasProperty()) {
            if (context.check(SymbolType.COMMA) && context.checkNext(SymbolType.NUMBER, SymbolType.INTEGER)) {
                context.advance();
            }
            if (context.isSeparator()) {
                context.reportSyntaxError(SyntaxError.MISSING_DEVICE_PARAMETER, context.current(), 0);
                return ItemDescriptor.failedItem();
            }
            Symbol property = context.current();
            PropertyRule rule = kind.get().propertyRule();
            Optional<Integer> violation = rule.violation(property, context.text(property));
            if (violation.isPresent()) {
                return fail(context, rule.error(), property, violation.get());
            }
            symbols.add(property);
            context.advance();
        }

        if (!context.isSeparator()) {
            return fail(context, SyntaxError.BAD_DEVICE_SEPARATOR, context.current(), 0);
        }
        return ItemDescriptor.of(symbols);
    }

    private ItemDescriptor fail(ParsingContext context, SyntaxError error, Symbol at, int caretOffset) {
        context.reportSyntaxError(error, at, caretOffset);
        context.synchronize(Section.DEVICES);
        return ItemDescriptor.failedItem();
    }
}
