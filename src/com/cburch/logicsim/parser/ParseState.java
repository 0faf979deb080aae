package com.cburch.logicsim.parser;

import com.cburch.logicsim.scanner.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of one parse: the symbol under examination, the errors
 * found so far and the two flags that cut sections short.
 */
public final class ParseState {
    private Symbol current;
    private final List<ParseError> errors = new ArrayList<>();

    // lista sin END: la sección se abandona sin volver a comprobar END
    private boolean missingEnd;
    // la recuperación llegó al final del fichero
    private boolean reachedEof;

    ParseState(Symbol first) {
        this.current = first;
    }

    public Symbol current() { return current; }

    void setCurrent(Symbol s) { current = s; }

    void addError(ParseError e) { errors.add(e); }

    public List<ParseError> errors() { return Collections.unmodifiableList(errors); }

    public int errorCount() { return errors.size(); }

    public boolean missingEnd() { return missingEnd; }

    void setMissingEnd(boolean v) { missingEnd = v; }

    public boolean reachedEof() { return reachedEof; }

    void setReachedEof(boolean v) { reachedEof = v; }
}
