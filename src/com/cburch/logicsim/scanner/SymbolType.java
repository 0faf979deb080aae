package com.cburch.logicsim.scanner;

/**
 * Lexical class of a {@link Symbol}. The display names are used in
 * "Expected a ..." error messages.
 */
public enum SymbolType {
    KEYWORD("KEYWORD"),
    DEVICE_TYPE("DEVICE TYPE"),
    NAME("NAME"),
    PROPERTY("INITIAL STATE"),
    NUMBER("NUMBER"),
    COLON("COLON"),
    SEMICOLON("SEMI COLON"),
    ARROW("ARROW (->)"),
    PERIOD("PERIOD (.)"),
    EOF("END OF FILE"),
    /** A character sequence the scanner could not classify, e.g. '-' not followed by '>'. */
    UNKNOWN("UNKNOWN SYMBOL");

    private final String displayName;

    SymbolType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() { return displayName; }
}
