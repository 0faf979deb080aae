package com.cburch.logicsim.scanner;

/**
 * A classified lexical unit. {@code id} is the symbol-table id of the
 * token's text (numbers included); {@code line} and {@code column} locate its
 * first character, both counted from 1.
 */
public record Symbol(SymbolType type, int id, int line, int column) {

    public boolean is(SymbolType t) { return type == t; }

    public boolean isEof() { return type == SymbolType.EOF; }

    @Override public String toString() {
        return type + "#" + id + "@" + line + ":" + column;
    }
}
