package com.cburch.logicsim.util;

/**
 * An error the definition-file parser can report. Implemented by the error
 * enums of the device model, the network, the monitors and the parser
 * itself; the key selects the message template.
 */
public interface ErrorKind {

    /** Key of the message template in the parser resource bundle. */
    String messageKey();
}
