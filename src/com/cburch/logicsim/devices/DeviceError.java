package com.cburch.logicsim.devices;

import com.cburch.logicsim.util.ErrorKind;

/** Reasons {@link Devices#makeDevice} can refuse to create a device. */
public enum DeviceError implements ErrorKind {
    /** Another device already has this name. */
    DEVICE_PRESENT("device.present"),
    /** The kind needs a property and none was given. */
    NO_PROPERTY("device.noProperty"),
    /** A property was given but is out of range or of the wrong shape. */
    INVALID_PROPERTY("device.invalidProperty"),
    /** The kind takes no property but one was given. */
    PROPERTY_PRESENT("device.propertyPresent");

    private final String key;

    DeviceError(String key) {
        this.key = key;
    }

    @Override public String messageKey() { return "error." + key; }
}
