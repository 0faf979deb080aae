package com.cburch.logicsim.parser;

import com.cburch.logicsim.util.ErrorKind;

/**
 * One entry of the error report.
 *
 * @param kind what went wrong
 * @param message complete message, including the resume note if any
 * @param line line of the offending symbol, from 1
 * @param column column of the offending symbol, from 1
 */
public record ParseError(ErrorKind kind, String message, int line, int column) {

    @Override public String toString() {
        return line + ":" + column + " " + message;
    }
}
