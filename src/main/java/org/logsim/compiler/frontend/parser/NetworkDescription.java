package org.logsim.compiler.frontend.parser;

import org.logsim.compiler.frontend.lexer.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The syntactic outcome of parsing a definition file: the items of each section, in file order.
 * Items with a syntax error are kept as placeholders. Only descriptions without syntax errors
 * are handed out by {@link Parser#parseFile()}.
 */
public class NetworkDescription {

    private final Map<Section, List<ItemDescriptor>> items = new EnumMap<>(Section.class);
    private final Map<Section, Symbol> keywordSymbols = new EnumMap<>(Section.class);

    public NetworkDescription() {
        for (Section section : Section.values()) {
            items.put(section, new ArrayList<>());
        }
    }

    void add(Section section, ItemDescriptor item) {
        items.get(section).add(item);
    }

    void setKeywordSymbol(Section section, Symbol symbol) {
        keywordSymbols.put(section, symbol);
    }

    /**
     * @param section The section.
     * @return The items of the section, in file order.
     */
    public List<ItemDescriptor> items(Section section) {
        return Collections.unmodifiableList(items.get(section));
    }

    /**
     * @param section The section.
     * @return The keyword symbol that opened the section, if it was spelt correctly.
     */
    public Optional<Symbol> keywordSymbol(Section section) {
        return Optional.ofNullable(keywordSymbols.get(section));
    }

    /**
     * @return The number of items over all sections.
     */
    public int itemCount() {
        return items.values().stream().mapToInt(List::size).sum();
    }
}
