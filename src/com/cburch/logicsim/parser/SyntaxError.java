package com.cburch.logicsim.parser;

import com.cburch.logicsim.util.ErrorKind;

/** Errors detected by the parser itself rather than by the network model. */
public enum SyntaxError implements ErrorKind {
    /** A list keyword was expected. */
    KEYWORD_ERROR("keyword", Recovery.LIST),
    SYNTAX_COLON("colon", Recovery.LIST),
    /** The symbol has the wrong lexical class for this position. */
    SYMBOL_TYPE_ERROR("symbolType", Recovery.ITEM),
    UNKNOWN_DEVICE("unknownDevice", Recovery.ITEM),
    /** The word after a device type is not usable as a device name. */
    BAD_NAME("badName", Recovery.ITEM),
    /** A specific punctuation symbol was expected. */
    EXPECTED_SYMBOL("expectedSymbol", Recovery.ITEM),
    IDENTIFIER_PRESENT("identifierPresent", Recovery.ITEM),
    NO_IDENTIFIER("noIdentifier", Recovery.ITEM),
    END_ERROR("end", Recovery.SECTION),
    UNCONNECTED_INPUTS("unconnectedInputs", Recovery.NONE),
    NO_MONITOR("noMonitor", Recovery.NONE),
    NO_EOF("noEof", Recovery.NONE);

    private final String key;
    private final Recovery recovery;

    SyntaxError(String key, Recovery recovery) {
        this.key = key;
        this.recovery = recovery;
    }

    public Recovery recovery() { return recovery; }

    @Override public String messageKey() { return "error.syntax." + key; }
}
