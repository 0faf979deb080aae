package com.cburch.logicsim.devices;

import com.cburch.logicsim.names.Names;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The device model: every declared device, in declaration order.
 * Devices are only added while a definition file is parsed; afterwards the
 * model changes through switch settings, cold starts and the per-cycle pin
 * updates made by the network.
 */
public final class Devices {
    private static final Logger LOG = LogManager.getLogger(Devices.class);

    public static final List<String> DTYPE_INPUTS = List.of("DATA", "CLK", "SET", "CLEAR");
    public static final List<String> DTYPE_OUTPUTS = List.of("Q", "QBAR");

    private final Names names;
    private final Map<Integer, Device> devices = new LinkedHashMap<>();

    public final int dataId;
    public final int clkId;
    public final int setId;
    public final int clearId;
    public final int qId;
    public final int qBarId;

    public Devices(Names names) {
        this.names = Objects.requireNonNull(names);
        List<Integer> in = names.lookup(DTYPE_INPUTS);
        List<Integer> out = names.lookup(DTYPE_OUTPUTS);
        dataId = in.get(0);
        clkId = in.get(1);
        setId = in.get(2);
        clearId = in.get(3);
        qId = out.get(0);
        qBarId = out.get(1);
    }

    public Names names() { return names; }

    /** Returns the device with this id, or null if there is none. */
    public Device getDevice(int deviceId) { return devices.get(deviceId); }

    /** Looks a device up by its declared name. */
    public Optional<Device> resolve(String name) {
        Integer id = names.query(name);
        return id == null ? Optional.empty() : Optional.ofNullable(devices.get(id));
    }

    /** All devices in declaration order. */
    public List<Device> all() { return Collections.unmodifiableList(new ArrayList<>(devices.values())); }

    public int size() { return devices.size(); }

    /** Ids of the devices of the given kinds, or of every device when no kind is given. */
    public List<Integer> findDevices(DeviceKind... kinds) {
        Set<DeviceKind> wanted = kinds.length == 0
                ? EnumSet.allOf(DeviceKind.class)
                : EnumSet.copyOf(Arrays.asList(kinds));
        List<Integer> ids = new ArrayList<>();
        for (Device d : devices.values()) {
            if (wanted.contains(d.kind())) ids.add(d.id());
        }
        return ids;
    }

    /**
     * Declares a device.
     * @param deviceId name id of the new device
     * @param kind device kind
     * @param property property written after the name, or null
     * @return the reason the device was refused, empty on success
     */
    public Optional<DeviceError> makeDevice(int deviceId, DeviceKind kind, RawProperty property) {
        Objects.requireNonNull(kind, "kind");
        if (devices.containsKey(deviceId)) return Optional.of(DeviceError.DEVICE_PRESENT);

        DeviceConfig config;
        try {
            config = configure(kind, property);
        } catch (IllegalArgumentException e) {
            LOG.debug("Rejected property {} for {}: {}", property, kind, e.getMessage());
            return Optional.of(DeviceError.INVALID_PROPERTY);
        }
        if (config == null) {
            return Optional.of(property == null ? DeviceError.NO_PROPERTY : DeviceError.PROPERTY_PRESENT);
        }

        Device device = new Device(deviceId, kind, config, inputPins(kind, config), outputPins(kind));
        devices.put(deviceId, device);
        LOG.debug("Added {} {} ({})", kind, names.getNameString(deviceId), config);
        return Optional.empty();
    }

    /*
     * Maps a property to the configuration its kind accepts. Returns null when
     * the property is missing for a kind that needs one, or present for a kind
     * that takes none; throws IllegalArgumentException when it has the wrong
     * shape.
     */
    private static DeviceConfig configure(DeviceKind kind, RawProperty property) {
        return switch (kind) {
            case AND, NAND, OR, NOR -> property == null ? null
                    : new DeviceConfig.GateInputs(number(property));
            case XOR -> property != null ? null : new DeviceConfig.GateInputs(2);
            case D_TYPE -> property != null ? null : new DeviceConfig.None();
            case CLOCK -> property == null ? null
                    : new DeviceConfig.ClockPeriod(number(property));
            case SWITCH -> property == null ? null
                    : new DeviceConfig.SwitchState(switchState(property));
            case SIGGEN -> {
                if (property == null) yield null;
                if (!property.numeric()) throw new IllegalArgumentException("Pattern must be numeric");
                yield new DeviceConfig.SignalPattern(property.text());
            }
        };
    }

    private static int number(RawProperty p) {
        if (!p.numeric()) throw new IllegalArgumentException("Expected a number: " + p.text());
        // una cadena de dígitos demasiado larga también es inválida
        if (p.text().length() > 9) throw new IllegalArgumentException("Number too large: " + p.text());
        return Integer.parseInt(p.text());
    }

    private static Signal switchState(RawProperty p) {
        return switch (p.text()) {
            case "OFF", "0" -> Signal.LOW;
            case "ON", "1" -> Signal.HIGH;
            default -> throw new IllegalArgumentException("Not a switch state: " + p.text());
        };
    }

    private List<Integer> inputPins(DeviceKind kind, DeviceConfig config) {
        if (kind == DeviceKind.D_TYPE) return List.of(dataId, clkId, setId, clearId);
        if (config instanceof DeviceConfig.GateInputs g) {
            List<Integer> pins = new ArrayList<>(g.count());
            for (int i = 1; i <= g.count(); i++) pins.add(names.lookup(gateInputName(i)));
            return pins;
        }
        return List.of();
    }

    private List<Integer> outputPins(DeviceKind kind) {
        if (kind == DeviceKind.D_TYPE) return List.of(qId, qBarId);
        return Collections.singletonList(null);
    }

    /** Name of the n-th input of a gate, counting from 1. */
    public static String gateInputName(int n) { return gateInputName(String.valueOf(n)); }

    /** Same as {@link #gateInputName(int)} for an ordinal written as digits, e.g. "g1.2". */
    public static String gateInputName(String ordinal) { return "I" + ordinal; }

    /**
     * Sets a switch. Takes effect from the next cycle on.
     * @return false if the device does not exist or is not a switch
     */
    public boolean setSwitch(int deviceId, Signal state) {
        Device d = devices.get(deviceId);
        if (d == null || d.kind() != DeviceKind.SWITCH) return false;
        if (state.level() != Signal.LOW && state.level() != Signal.HIGH) {
            throw new IllegalArgumentException("Switch state must be LOW or HIGH: " + state);
        }
        d.setSwitchState(state.level());
        return true;
    }

    /**
     * Resets every clock, flip-flop and signal generator to its initial
     * condition and blanks every pin. Switch settings are left alone.
     */
    public void coldStartup() {
        for (Device d : devices.values()) d.coldStart();
        LOG.debug("Cold start of {} device(s)", devices.size());
    }

    /** Readable name of an output or input, e.g. "sw1" or "d1.QBAR". */
    public String getSignalName(int deviceId, Integer pinId) {
        String dev = names.getNameString(deviceId);
        if (dev == null || !devices.containsKey(deviceId)) return null;
        return pinId == null ? dev : dev + "." + names.getNameString(pinId);
    }

    /** Parses a signal name such as "d1.Q"; empty if no such device or pin exists. */
    public Optional<PinRef> getSignalIds(String signalName) {
        if (signalName == null || signalName.isBlank()) return Optional.empty();
        String[] parts = signalName.trim().split("\\.", 2);
        Integer devId = names.query(parts[0]);
        if (devId == null || !devices.containsKey(devId)) return Optional.empty();
        if (parts.length == 1) return Optional.of(PinRef.of(devId, null));

        Integer pinId = names.query(parts[1]);
        if (pinId == null) return Optional.empty();
        Device d = devices.get(devId);
        if (d.direction(pinId) == PinDirection.NONE) return Optional.empty();
        return Optional.of(PinRef.of(devId, pinId));
    }
}
