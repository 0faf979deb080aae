package com.cburch.logicsim.devices;

/**
 * A pin of a device. {@code pinId} is null for the single unnamed output of
 * gates, clocks, switches and signal generators.
 */
public record PinRef(int deviceId, Integer pinId) {

    public static PinRef of(int deviceId, Integer pinId) { return new PinRef(deviceId, pinId); }
}
