package com.cburch.logicsim.parser;

/**
 * How far the parser skips after reporting an error. End of file always
 * stops the skip.
 */
public enum Recovery {
    /** Stay on the offending symbol. */
    NONE,
    /** Skip to the next ';' or END, ending the current item. */
    ITEM,
    /** Skip to the next END, abandoning the rest of the list. */
    LIST,
    /** Skip to the next list keyword. */
    SECTION
}
