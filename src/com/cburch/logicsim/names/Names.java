package com.cburch.logicsim.names;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Symbol table shared by the scanner, the device model and the parser.
 * Every distinct string gets a stable integer id, handed out in order
 * starting at 0. Error codes come from a separate counter so they can never
 * collide with each other.
 */
public final class Names {
    private final List<String> byId = new ArrayList<>();
    private final Map<String, Integer> byName = new HashMap<>();
    private int errorCodeCount = 0;

    /**
     * Returns the ids of the given strings, interning the ones not yet known.
     * @param nameStrings strings to look up
     * @return ids in the same order as the strings
     */
    public List<Integer> lookup(List<String> nameStrings) {
        List<Integer> ids = new ArrayList<>(nameStrings.size());
        for (String s : nameStrings) ids.add(lookup(s));
        return ids;
    }

    /** Single-string form of {@link #lookup(List)}. */
    public int lookup(String nameString) {
        Objects.requireNonNull(nameString, "nameString");
        Integer id = byName.get(nameString);
        if (id != null) return id;

        int fresh = byId.size();
        byId.add(nameString);
        byName.put(nameString, fresh);
        return fresh;
    }

    /** Returns the id of a string, or null if it was never interned. */
    public Integer query(String nameString) {
        if (nameString == null) return null;
        return byName.get(nameString);
    }

    /** Returns the string for an id, or null if no such id exists. */
    public String getNameString(int nameId) {
        if (nameId < 0) throw new IllegalArgumentException("Negative name id: " + nameId);
        return nameId < byId.size() ? byId.get(nameId) : null;
    }

    /**
     * Allocates a block of error codes that no earlier call has returned.
     * @param numErrorCodes how many codes to allocate, at least one
     */
    public List<Integer> uniqueErrorCodes(int numErrorCodes) {
        if (numErrorCodes <= 0) {
            throw new IllegalArgumentException("Expected a positive number of error codes: " + numErrorCodes);
        }
        List<Integer> codes = new ArrayList<>(numErrorCodes);
        for (int i = 0; i < numErrorCodes; i++) codes.add(errorCodeCount++);
        return codes;
    }

    public int size() { return byId.size(); }
}
