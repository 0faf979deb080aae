package com.cburch.logicsim.devices;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public enum DeviceKind {
    // Puertas
    AND    ("AND",    Category.GATE),
    NAND   ("NAND",   Category.GATE),
    OR     ("OR",     Category.GATE),
    NOR    ("NOR",    Category.GATE),
    XOR    ("XOR",    Category.GATE),

    // Secuenciales
    D_TYPE ("DTYPE",  Category.FLIP_FLOP),

    // Fuentes
    CLOCK  ("CLOCK",  Category.SOURCE),
    SWITCH ("SWITCH", Category.SOURCE),
    SIGGEN ("SIGGEN", Category.SOURCE);

    public enum Category { GATE, FLIP_FLOP, SOURCE }

    private final String keyword;
    private final Category category;

    DeviceKind(String keyword, Category category) {
        this.keyword = keyword;
        this.category = category;
    }

    /** Spelling of this kind in a definition file. */
    public String keyword() { return keyword; }
    public Category category() { return category; }

    public boolean isGate() { return category == Category.GATE; }

    // ------- Índice estático -------
    private static final Map<String, DeviceKind> INDEX;
    static {
        Map<String, DeviceKind> m = new HashMap<>();
        for (DeviceKind k : values()) m.put(k.keyword, k);
        INDEX = Collections.unmodifiableMap(m);
    }

    public static Optional<DeviceKind> fromKeyword(String keyword) {
        return Optional.ofNullable(INDEX.get(keyword));
    }
}
