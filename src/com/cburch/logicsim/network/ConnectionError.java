package com.cburch.logicsim.network;

import com.cburch.logicsim.util.ErrorKind;

/** Reasons {@link Network#makeConnection} can refuse a connection. */
public enum ConnectionError implements ErrorKind {
    DEVICE_ABSENT("network.deviceAbsent"),
    PORT_ABSENT("network.portAbsent"),
    /** The source end is an input, so both ends are inputs. */
    INPUT_TO_INPUT("network.inputToInput"),
    /** The destination end is an output, so both ends are outputs. */
    OUTPUT_TO_OUTPUT("network.outputToOutput"),
    /** Source is an input and destination an output. */
    REVERSED("network.reversed"),
    /** The input already has a driver. */
    INPUT_CONNECTED("network.inputConnected");

    private final String key;

    ConnectionError(String key) {
        this.key = key;
    }

    @Override public String messageKey() { return "error." + key; }
}
