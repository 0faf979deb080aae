package com.cburch.logicsim.devices;

/**
 * Property text exactly as it appeared after a device name, before it is
 * checked against the device kind.
 *
 * @param numeric true for a digit string, false for ON/OFF
 * @param text the literal text
 */
public record RawProperty(boolean numeric, String text) {

    public static RawProperty number(String digits) { return new RawProperty(true, digits); }

    public static RawProperty state(String word) { return new RawProperty(false, word); }
}
