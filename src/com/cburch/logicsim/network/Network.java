package com.cburch.logicsim.network;

import com.cburch.logicsim.devices.Device;
import com.cburch.logicsim.devices.DeviceKind;
import com.cburch.logicsim.devices.Devices;
import com.cburch.logicsim.devices.PinDirection;
import com.cburch.logicsim.devices.PinRef;
import com.cburch.logicsim.devices.Signal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Wiring between devices and the per-cycle evaluator.
 * <p>
 * Each input pin has at most one driving output. A cycle first steps the
 * sources (switches, clocks, signal generators), then re-evaluates gates and
 * flip-flops in declaration order until a whole pass changes nothing. A cycle
 * that needs more passes than the budget allows is undone and reported as an
 * {@link Oscillation}.
 */
public final class Network {
    private static final Logger LOG = LogManager.getLogger(Network.class);

    public static final int DEFAULT_MIN_PASSES = 20;
    public static final int DEFAULT_PASSES_PER_DEVICE = 2;

    private final Devices devices;
    // input -> output que la alimenta
    private final Map<PinRef, PinRef> connections = new LinkedHashMap<>();

    private int minPasses = DEFAULT_MIN_PASSES;
    private int passesPerDevice = DEFAULT_PASSES_PER_DEVICE;

    public Network(Devices devices) {
        this.devices = Objects.requireNonNull(devices);
    }

    public Devices devices() { return devices; }

    /** Sets the oscillation budget: max(minPasses, passesPerDevice * device count). */
    public void setPassBudget(int minPasses, int passesPerDevice) {
        if (minPasses < 1 || passesPerDevice < 1) {
            throw new IllegalArgumentException("Pass budget must be positive");
        }
        this.minPasses = minPasses;
        this.passesPerDevice = passesPerDevice;
    }

    public int passBudget() {
        return Math.max(minPasses, passesPerDevice * devices.size());
    }

    /**
     * Connects an output to an input.
     * @return the reason the connection was refused, empty on success
     */
    public Optional<ConnectionError> makeConnection(int inDeviceId, Integer inPinId,
                                                    int outDeviceId, Integer outPinId) {
        Device in = devices.getDevice(inDeviceId);
        Device out = devices.getDevice(outDeviceId);
        if (in == null || out == null) return Optional.of(ConnectionError.DEVICE_ABSENT);

        PinDirection inDir = in.direction(inPinId);
        PinDirection outDir = out.direction(outPinId);
        if (inDir == PinDirection.NONE || outDir == PinDirection.NONE) {
            return Optional.of(ConnectionError.PORT_ABSENT);
        }
        if (inDir.isInput() && outDir.isInput()) return Optional.of(ConnectionError.INPUT_TO_INPUT);
        if (inDir.isOutput() && outDir.isOutput()) return Optional.of(ConnectionError.OUTPUT_TO_OUTPUT);
        if (inDir.isOutput()) return Optional.of(ConnectionError.REVERSED);

        PinRef inRef = PinRef.of(inDeviceId, inPinId);
        if (connections.containsKey(inRef)) return Optional.of(ConnectionError.INPUT_CONNECTED);

        connections.put(inRef, PinRef.of(outDeviceId, outPinId));
        return Optional.empty();
    }

    /** The output driving an input, if it is connected. */
    public Optional<PinRef> getConnectedOutput(int deviceId, Integer inPinId) {
        return Optional.ofNullable(connections.get(PinRef.of(deviceId, inPinId)));
    }

    /** Every input pin with no driver, in declaration order. */
    public List<PinRef> unconnectedInputs() {
        List<PinRef> missing = new ArrayList<>();
        for (Device d : devices.all()) {
            for (Integer pin : d.inputs()) {
                PinRef ref = PinRef.of(d.id(), pin);
                if (!connections.containsKey(ref)) missing.add(ref);
            }
        }
        return missing;
    }

    /** True iff every input of every device is connected. */
    public boolean checkNetwork() {
        return unconnectedInputs().isEmpty();
    }

    /**
     * Runs one simulation cycle.
     * @return empty if the network settled, otherwise the oscillation; in
     *         that case every pin and internal state is as it was before the call
     */
    public Optional<Oscillation> executeNetwork() {
        List<Device> all = devices.all();

        // 1) estado estable anterior
        Map<Integer, Device.SequentialState> saved = new HashMap<>();
        Map<PinRef, Signal> previous = new HashMap<>();
        for (Device d : all) {
            saved.put(d.id(), d.saveState());
            for (Map.Entry<Integer, Signal> e : d.outputValues().entrySet()) {
                previous.put(PinRef.of(d.id(), e.getKey()), e.getValue());
                d.setOutput(e.getKey(), e.getValue().level());
            }
        }

        // 2) fuentes
        for (Device d : all) {
            switch (d.kind()) {
                case SWITCH -> d.setOutput(null, d.switchState());
                case CLOCK -> d.setOutput(null, d.stepClock());
                case SIGGEN -> d.setOutput(null, d.stepSignalGenerator());
                default -> { }
            }
        }

        // 3) propagar hasta un punto fijo
        int budget = passBudget();
        List<Integer> changing = new ArrayList<>();
        for (int pass = 1; pass <= budget; pass++) {
            changing = new ArrayList<>();
            for (Device d : all) {
                boolean changed = switch (d.kind().category()) {
                    case GATE -> executeGate(d);
                    case FLIP_FLOP -> executeDType(d, previous);
                    case SOURCE -> false;
                };
                if (changed) changing.add(d.id());
            }
            if (changing.isEmpty()) {
                LOG.trace("Settled after {} pass(es)", pass);
                commit(all, previous);
                return Optional.empty();
            }
        }

        for (Device d : all) d.restoreState(saved.get(d.id()));
        List<String> unstable = new ArrayList<>();
        for (Integer id : changing) unstable.add(devices.getSignalName(id, null));
        LOG.warn("Network oscillating after {} passes; still changing: {}", budget, unstable);
        return Optional.of(new Oscillation(budget, changing));
    }

    private void commit(List<Device> all, Map<PinRef, Signal> previous) {
        for (Device d : all) {
            if (d.kind() == DeviceKind.D_TYPE) d.setMemory(d.getOutput(devices.qId));
            for (Map.Entry<Integer, Signal> e : d.outputValues().entrySet()) {
                Signal before = previous.get(PinRef.of(d.id(), e.getKey()));
                d.setOutput(e.getKey(), Signal.transition(before, e.getValue()));
            }
        }
    }

    private boolean executeGate(Device d) {
        int high = 0;
        for (Integer pin : d.inputs()) {
            if (inputLevel(d, pin) == Signal.HIGH) high++;
        }
        int n = d.inputs().size();
        boolean result = switch (d.kind()) {
            case AND -> high == n;
            case NAND -> high != n;
            case OR -> high > 0;
            case NOR -> high == 0;
            case XOR -> (high & 1) == 1;
            default -> throw new IllegalStateException("Not a gate: " + d.kind());
        };
        return update(d, null, Signal.of(result));
    }

    /*
     * SET forces 1 and CLEAR forces 0, CLEAR winning when both are high.
     * Otherwise a rising clock edge (LOW in the previous stable state, HIGH
     * now) latches DATA as it was in the previous stable state.
     */
    private boolean executeDType(Device d, Map<PinRef, Signal> previous) {
        Signal q = d.memory();
        Signal clkBefore = previousLevel(d, devices.clkId, previous);
        if (clkBefore == Signal.LOW && inputLevel(d, devices.clkId) == Signal.HIGH) {
            Signal data = previousLevel(d, devices.dataId, previous);
            q = data == Signal.BLANK ? Signal.LOW : data;
        }
        if (inputLevel(d, devices.setId) == Signal.HIGH) q = Signal.HIGH;
        if (inputLevel(d, devices.clearId) == Signal.HIGH) q = Signal.LOW;

        boolean changed = update(d, devices.qId, q);
        changed |= update(d, devices.qBarId, q.invert());
        return changed;
    }

    private boolean update(Device d, Integer pin, Signal value) {
        if (d.getOutput(pin) == value) return false;
        d.setOutput(pin, value);
        return true;
    }

    /* Level currently seen on an input; undriven and blank inputs read LOW. */
    private Signal inputLevel(Device d, Integer pin) {
        PinRef src = connections.get(PinRef.of(d.id(), pin));
        if (src == null) return Signal.LOW;
        Signal v = devices.getDevice(src.deviceId()).getOutput(src.pinId()).level();
        return v == Signal.BLANK ? Signal.LOW : v;
    }

    /* Level the input saw at the end of the previous cycle, BLANK included. */
    private Signal previousLevel(Device d, Integer pin, Map<PinRef, Signal> previous) {
        PinRef src = connections.get(PinRef.of(d.id(), pin));
        if (src == null) return Signal.BLANK;
        return previous.getOrDefault(src, Signal.BLANK).level();
    }
}
