package org.logsim.compiler.frontend.semantics;

import org.logsim.compiler.frontend.lexer.Symbol;
import org.logsim.compiler.frontend.lexer.SymbolType;
import org.logsim.compiler.frontend.parser.ItemDescriptor;

/**
 * The labelled symbols of a connection item {@code first[.port] > second[.port]}.
 *
 * @param firstDevice The device before the '>'.
 * @param firstPort The port after the first device, or null.
 * @param secondDevice The device after the '>'.
 * @param secondPort The port after the second device, or null.
 */
public record ConnectionRoles(Symbol firstDevice, Symbol firstPort, Symbol secondDevice, Symbol secondPort) {

    /**
     * Labels the symbols of a connection-shaped item by their position.
     * @param item A connection item of 5 or 7 symbols, or any item of at least 3 symbols.
     * @return The labelled symbols.
     */
    public static ConnectionRoles from(ItemDescriptor item) {
        Symbol first = item.get(0);
        if (isDot(item, 1)) {
            Symbol firstPort = item.get(2);
            Symbol second = item.size() > 4 ? item.get(4) : null;
            Symbol secondPort = isDot(item, 5) && item.size() > 6 ? item.get(6) : null;
            return new ConnectionRoles(first, firstPort, second, secondPort);
        }
        Symbol second = item.get(2);
        Symbol secondPort = isDot(item, 3) && item.size() > 4 ? item.get(4) : null;
        return new ConnectionRoles(first, null, second, secondPort);
    }

    private static boolean isDot(ItemDescriptor item, int index) {
        return item.size() > index && item.get(index).type() == SymbolType.DOT;
    }

    public Integer firstPortId() {
        return firstPort == null ? null : firstPort.id();
    }

    public Integer secondPortId() {
        return secondPort == null ? null : secondPort.id();
    }
}
