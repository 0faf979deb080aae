package com.cburch.logicsim.monitors;

import com.cburch.logicsim.util.ErrorKind;

/** Reasons {@link Monitors#makeMonitor} can refuse a monitor point. */
public enum MonitorError implements ErrorKind {
    /** The device does not exist or the pin is not one of its outputs. */
    NOT_OUTPUT("monitor.notOutput"),
    /** The point is already being recorded. */
    MONITOR_PRESENT("monitor.present");

    private final String key;

    MonitorError(String key) {
        this.key = key;
    }

    @Override public String messageKey() { return "error." + key; }
}
