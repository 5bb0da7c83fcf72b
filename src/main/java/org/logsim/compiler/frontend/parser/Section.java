package org.logsim.compiler.frontend.parser;

/**
 * The three item sections of a definition file, in the order they must appear.
 */
public enum Section {
    DEVICES("DEVICES", SyntaxError.MISSING_DEVICES_KEYWORD, SyntaxError.BAD_DEVICE_SEPARATOR, "CONNECT"),
    CONNECT("CONNECT", SyntaxError.MISSING_CONNECT_KEYWORD, SyntaxError.BAD_CONNECTION_SEPARATOR, "MONITOR"),
    MONITOR("MONITOR", SyntaxError.MISSING_MONITOR_KEYWORD, SyntaxError.BAD_MONITOR_SEPARATOR, "END");

    private final String keyword;
    private final SyntaxError missingKeywordError;
    private final SyntaxError separatorError;
    private final String followingKeyword;

    Section(String keyword, SyntaxError missingKeywordError, SyntaxError separatorError, String followingKeyword) {
        this.keyword = keyword;
        this.missingKeywordError = missingKeywordError;
        this.separatorError = separatorError;
        this.followingKeyword = followingKeyword;
    }

    public String keyword() {
        return keyword;
    }

    public SyntaxError missingKeywordError() {
        return missingKeywordError;
    }

    /**
     * @return The error for items that are not followed by ',' or ';'.
     */
    public SyntaxError separatorError() {
        return separatorError;
    }

    /**
     * @return The keyword that opens whatever comes after this section.
     */
    public String followingKeyword() {
        return followingKeyword;
    }

    /**
     * @return true if the section may be an empty list ({@code CONNECT: ;}).
     */
    public boolean allowsEmpty() {
        return this != DEVICES;
    }
}
