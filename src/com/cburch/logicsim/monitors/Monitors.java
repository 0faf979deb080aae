package com.cburch.logicsim.monitors;

import com.cburch.logicsim.devices.Device;
import com.cburch.logicsim.devices.Devices;
import com.cburch.logicsim.devices.PinRef;
import com.cburch.logicsim.devices.Signal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Records the value of selected outputs once per completed cycle.
 * Monitor points keep their registration order.
 */
public final class Monitors {
    private static final Logger LOG = LogManager.getLogger(Monitors.class);

    private final Devices devices;
    private final Map<PinRef, List<Signal>> traces = new LinkedHashMap<>();

    public Monitors(Devices devices) {
        this.devices = Objects.requireNonNull(devices);
    }

    /**
     * Starts monitoring an output with an empty trace.
     * @return the reason the point was refused, empty on success
     */
    public Optional<MonitorError> makeMonitor(int deviceId, Integer outputId) {
        return makeMonitor(deviceId, outputId, 0);
    }

    /**
     * Starts monitoring an output. The new trace is padded with
     * {@code cyclesCompleted} BLANK values so that it lines up with the
     * traces already being recorded.
     */
    public Optional<MonitorError> makeMonitor(int deviceId, Integer outputId, int cyclesCompleted) {
        Device d = devices.getDevice(deviceId);
        if (d == null || !d.hasOutput(outputId)) return Optional.of(MonitorError.NOT_OUTPUT);

        PinRef ref = PinRef.of(deviceId, outputId);
        if (traces.containsKey(ref)) return Optional.of(MonitorError.MONITOR_PRESENT);

        traces.put(ref, new ArrayList<>(Collections.nCopies(Math.max(0, cyclesCompleted), Signal.BLANK)));
        LOG.debug("Monitoring {}", devices.getSignalName(deviceId, outputId));
        return Optional.empty();
    }

    /** Stops monitoring a point and drops its trace; false if it was not monitored. */
    public boolean removeMonitor(int deviceId, Integer outputId) {
        return traces.remove(PinRef.of(deviceId, outputId)) != null;
    }

    public boolean isMonitored(int deviceId, Integer outputId) {
        return traces.containsKey(PinRef.of(deviceId, outputId));
    }

    public boolean isEmpty() { return traces.isEmpty(); }

    /** Monitored points in registration order. */
    public List<PinRef> points() { return new ArrayList<>(traces.keySet()); }

    /** Appends the current value of every monitored output to its trace. */
    public void recordSignals() {
        for (Map.Entry<PinRef, List<Signal>> e : traces.entrySet()) {
            PinRef p = e.getKey();
            e.getValue().add(devices.getDevice(p.deviceId()).getOutput(p.pinId()));
        }
    }

    /** Clears every trace; the monitor points stay registered. */
    public void resetMonitors() {
        for (List<Signal> t : traces.values()) t.clear();
    }

    /** Recorded trace of a point, or null if it is not monitored. */
    public List<Signal> getMonitorSignalList(int deviceId, Integer outputId) {
        List<Signal> t = traces.get(PinRef.of(deviceId, outputId));
        return t == null ? null : Collections.unmodifiableList(t);
    }

    /** Traces keyed by signal name ("sw1", "d1.Q"), in registration order. */
    public Map<String, List<Signal>> namedTraces() {
        Map<String, List<Signal>> out = new LinkedHashMap<>();
        for (Map.Entry<PinRef, List<Signal>> e : traces.entrySet()) {
            PinRef p = e.getKey();
            out.put(devices.getSignalName(p.deviceId(), p.pinId()), Collections.unmodifiableList(e.getValue()));
        }
        return out;
    }

    /**
     * Names of every output in the network, split into the monitored ones
     * and the rest.
     */
    public SignalNames getSignalNames() {
        List<String> monitored = new ArrayList<>();
        List<String> other = new ArrayList<>();
        for (Device d : devices.all()) {
            for (Integer out : d.outputIds()) {
                String name = devices.getSignalName(d.id(), out);
                if (isMonitored(d.id(), out)) monitored.add(name);
                else other.add(name);
            }
        }
        return new SignalNames(monitored, other);
    }

    public record SignalNames(List<String> monitored, List<String> notMonitored) {
        public SignalNames {
            monitored = List.copyOf(monitored);
            notMonitored = List.copyOf(notMonitored);
        }
    }
}
