package com.cburch.logicsim.devices;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A device in the network: its kind, validated configuration, pins and the
 * sequential state carried from one cycle to the next. Inputs hold no value
 * of their own; an input reads whatever output it is connected to.
 */
public final class Device {
    private final int id;
    private final DeviceKind kind;
    private final DeviceConfig config;
    private final List<Integer> inputs;
    // pinId -> valor; la salida sin nombre usa la clave null
    private final Map<Integer, Signal> outputs = new LinkedHashMap<>();

    private Signal switchState = Signal.LOW;
    private int clockCounter = 0;
    private Signal clockLevel = Signal.LOW;
    private Signal memory = Signal.LOW;
    private int cursor = 0;

    Device(int id, DeviceKind kind, DeviceConfig config, List<Integer> inputs, List<Integer> outputs) {
        this.id = id;
        this.kind = Objects.requireNonNull(kind);
        this.config = Objects.requireNonNull(config);
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        for (Integer out : outputs) this.outputs.put(out, Signal.BLANK);
        if (config instanceof DeviceConfig.SwitchState s) switchState = s.initial();
    }

    public int id() { return id; }
    public DeviceKind kind() { return kind; }
    public DeviceConfig config() { return config; }

    /** Input pin ids in declaration order. */
    public List<Integer> inputs() { return inputs; }

    /** Output pin ids in declaration order; may contain null. */
    public List<Integer> outputIds() { return new ArrayList<>(outputs.keySet()); }

    public boolean hasInput(Integer pinId) { return pinId != null && inputs.contains(pinId); }

    public boolean hasOutput(Integer pinId) { return outputs.containsKey(pinId); }

    public PinDirection direction(Integer pinId) {
        if (hasOutput(pinId)) return PinDirection.OUTPUT;
        if (hasInput(pinId)) return PinDirection.INPUT;
        return PinDirection.NONE;
    }

    /** Current value of an output pin, or null if the device has no such output. */
    public Signal getOutput(Integer pinId) { return outputs.get(pinId); }

    public void setOutput(Integer pinId, Signal value) {
        if (!outputs.containsKey(pinId)) {
            throw new IllegalArgumentException("Device " + id + " has no output " + pinId);
        }
        outputs.put(pinId, Objects.requireNonNull(value));
    }

    /** Snapshot of every output value, keyed by pin id. */
    public Map<Integer, Signal> outputValues() { return new LinkedHashMap<>(outputs); }

    /* ===== estado secuencial ===== */

    public Signal switchState() { return switchState; }
    void setSwitchState(Signal s) { switchState = s; }

    public int clockCounter() { return clockCounter; }
    public Signal clockLevel() { return clockLevel; }

    /** Advances a clock by one cycle and returns the level it now drives. */
    public Signal stepClock() {
        int half = ((DeviceConfig.ClockPeriod) config).halfPeriod();
        clockCounter++;
        if (clockCounter >= half) {
            clockCounter = 0;
            clockLevel = clockLevel.invert();
        }
        return clockLevel;
    }

    /**
     * Emits the pattern bit under the cursor and moves the cursor on. Once the
     * pattern is exhausted the generator outputs BLANK for one cycle, then
     * starts the pattern again.
     */
    public Signal stepSignalGenerator() {
        DeviceConfig.SignalPattern pattern = (DeviceConfig.SignalPattern) config;
        Signal bit = cursor < pattern.length() ? pattern.bitAt(cursor) : Signal.BLANK;
        cursor = (cursor + 1) % (pattern.length() + 1);
        return bit;
    }

    /** Bit stored by a D-type flip-flop. */
    public Signal memory() { return memory; }
    public void setMemory(Signal m) { memory = m.level(); }

    /** Restores the configured initial condition and blanks every output. */
    void coldStart() {
        clockCounter = 0;
        clockLevel = Signal.LOW;
        memory = Signal.LOW;
        cursor = 0;
        outputs.replaceAll((k, v) -> Signal.BLANK);
    }

    /** Captures the sequential state so that an aborted cycle can be undone. */
    public SequentialState saveState() {
        return new SequentialState(clockCounter, clockLevel, memory, cursor, outputValues());
    }

    public void restoreState(SequentialState s) {
        clockCounter = s.clockCounter();
        clockLevel = s.clockLevel();
        memory = s.memory();
        cursor = s.cursor();
        outputs.putAll(s.outputs());
    }

    public record SequentialState(int clockCounter, Signal clockLevel, Signal memory, int cursor,
                                  Map<Integer, Signal> outputs) { }

    @Override public String toString() {
        return "Device{" + id + ", " + kind + ", inputs=" + inputs.size() + ", outputs=" + outputs.size() + "}";
    }
}
