package org.logsim.compiler.frontend.parser;

import org.logsim.compiler.frontend.lexer.Symbol;

import java.util.List;

/**
 * The ordered symbols of one device, connection or monitor item.
 * <p>
 * Device items are {@code [keyword, name]} or {@code [keyword, name, property]}.
 * Connection items are {@code [dev, >, dev, ., pin]} or {@code [dev, ., pin, >, dev, ., pin]}.
 * Monitor items are {@code [dev]} or {@code [dev, ., pin]}.
 * An item that failed to parse is kept as a placeholder without symbols.
 *
 * @param symbols The symbols of the item.
 * @param failed Whether the item is a placeholder for a syntax error.
 */
public record ItemDescriptor(List<Symbol> symbols, boolean failed) {

    private static final ItemDescriptor FAILED = new ItemDescriptor(List.of(), true);

    public ItemDescriptor {
        symbols = List.copyOf(symbols);
    }

    /**
     * @param symbols The symbols of a well-formed item.
     * @return The item.
     */
    public static ItemDescriptor of(List<Symbol> symbols) {
        return new ItemDescriptor(symbols, false);
    }

    /**
     * @return The placeholder for an item with a syntax error.
     */
    public static ItemDescriptor failedItem() {
        return FAILED;
    }

    public int size() {
        return symbols.size();
    }

    public Symbol get(int index) {
        return symbols.get(index);
    }

    public Symbol last() {
        return symbols.get(symbols.size() - 1);
    }
}
