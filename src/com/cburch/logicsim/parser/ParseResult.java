package com.cburch.logicsim.parser;

import java.util.List;

/**
 * Outcome of parsing one definition file.
 * @param valid true iff the end of the file was reached without any error,
 *              in which case the network is complete
 * @param errors every error found, in source order
 */
public record ParseResult(boolean valid, List<ParseError> errors) {
    public ParseResult {
        errors = List.copyOf(errors);
    }
}
