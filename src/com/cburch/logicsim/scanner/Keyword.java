package com.cburch.logicsim.scanner;

/** List keywords delimiting the three sections of a definition file. */
public enum Keyword {
    DEVICE_LIST,
    CONNECTION_LIST,
    MONITOR_LIST,
    END;

    public String text() { return name(); }
}
