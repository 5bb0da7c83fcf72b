package org.logsim.compiler.frontend.parser;

/**
 * Parses the items of one section.
 */
public interface IItemHandler {

    /**
     * Parses one item, starting at the current symbol. On success the cursor is left on the
     * ',' or ';' after the item; after a syntax error it is left wherever resynchronization stopped.
     *
     * @param context The parsing context.
     * @return The parsed item, or {@link ItemDescriptor#failedItem()} after a syntax error.
     */
    ItemDescriptor parse(ParsingContext context);
}
