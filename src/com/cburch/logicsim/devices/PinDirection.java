package com.cburch.logicsim.devices;

/**
 * Direction of a pin on a device. NONE is returned for a pin name the device
 * does not have.
 */
public enum PinDirection {
    INPUT,
    OUTPUT,
    NONE;

    public boolean isInput()  { return this == INPUT; }
    public boolean isOutput() { return this == OUTPUT; }
}
