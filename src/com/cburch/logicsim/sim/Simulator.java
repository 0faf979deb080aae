package com.cburch.logicsim.sim;

import com.cburch.logicsim.devices.Device;
import com.cburch.logicsim.devices.DeviceKind;
import com.cburch.logicsim.devices.Devices;
import com.cburch.logicsim.devices.PinRef;
import com.cburch.logicsim.devices.Signal;
import com.cburch.logicsim.monitors.MonitorError;
import com.cburch.logicsim.monitors.Monitors;
import com.cburch.logicsim.monitors.TraceFormatter;
import com.cburch.logicsim.names.Names;
import com.cburch.logicsim.network.Network;
import com.cburch.logicsim.network.Oscillation;
import com.cburch.logicsim.parser.ErrorReport;
import com.cburch.logicsim.parser.ParseError;
import com.cburch.logicsim.parser.ParseResult;
import com.cburch.logicsim.parser.Parser;
import com.cburch.logicsim.parser.Strings;
import com.cburch.logicsim.scanner.Scanner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Loads a definition file and drives the simulation of the network it
 * describes. A file with errors is kept only for its error report; running
 * it is refused.
 */
public final class Simulator {
    private static final Logger LOG = LogManager.getLogger(Simulator.class);

    private final SimulationConfig config;
    private final Scanner scanner;
    private final Devices devices;
    private final Network network;
    private final Monitors monitors;
    private final List<ParseError> errors;
    private final boolean valid;

    private int cyclesCompleted = 0;

    private Simulator(Scanner scanner, SimulationConfig config) {
        Names names = scanner.names();
        this.config = config;
        this.scanner = scanner;
        this.devices = new Devices(names);
        this.network = new Network(devices);
        this.monitors = new Monitors(devices);
        network.setPassBudget(config.minPasses(), config.passesPerDevice());

        ParseResult result = new Parser(names, devices, network, monitors, scanner).parseNetwork();
        this.valid = result.valid();
        this.errors = result.errors();
    }

    public static Simulator load(Path file, SimulationConfig config) throws IOException {
        LOG.info("Loading {}", file);
        return new Simulator(Scanner.fromFile(file, new Names()), config);
    }

    public static Simulator fromString(String definition, SimulationConfig config) {
        return new Simulator(new Scanner(definition, new Names()), config);
    }

    /** True iff the definition parsed without errors. */
    public boolean isValid() { return valid; }

    public List<ParseError> errors() { return errors; }

    public String errorReport() { return ErrorReport.render(scanner, errors); }

    public SimulationConfig config() { return config; }
    public Devices devices() { return devices; }
    public Network network() { return network; }
    public Monitors monitors() { return monitors; }

    public int cyclesCompleted() { return cyclesCompleted; }

    /** Clears the traces, cold-starts the network and runs it. */
    public RunResult run(int cycles) {
        requireValid();
        monitors.resetMonitors();
        devices.coldStartup();
        cyclesCompleted = 0;
        return continueRun(cycles);
    }

    /**
     * Runs more cycles from the current state. Stops at the first cycle that
     * oscillates; that cycle is not recorded.
     */
    public RunResult continueRun(int cycles) {
        requireValid();
        if (cycles < 0) throw new IllegalArgumentException("Negative cycle count: " + cycles);

        for (int i = 0; i < cycles; i++) {
            Optional<Oscillation> osc = network.executeNetwork();
            if (osc.isPresent()) {
                LOG.warn(oscillationMessage(osc.get()));
                return new RunResult(i, osc.get());
            }
            monitors.recordSignals();
            cyclesCompleted++;
        }
        LOG.debug("Ran {} cycle(s), {} in total", cycles, cyclesCompleted);
        return new RunResult(cycles, null);
    }

    public String oscillationMessage(Oscillation osc) {
        List<String> unstable = new ArrayList<>();
        for (Integer id : osc.unstableDevices()) unstable.add(devices.getSignalName(id, null));
        return Strings.get("sim.oscillation", String.valueOf(cyclesCompleted + 1),
                String.valueOf(osc.passes()), String.join(", ", unstable));
    }

    /** Sets a switch by name, from the next cycle on. */
    public void setSwitch(String name, boolean on) {
        Device d = devices.resolve(name).orElse(null);
        if (d == null || d.kind() != DeviceKind.SWITCH) {
            throw new IllegalArgumentException(Strings.get("sim.unknownSwitch", name));
        }
        devices.setSwitch(d.id(), Signal.of(on));
    }

    /** Starts monitoring an output such as "g1" or "d1.QBAR", aligned with the existing traces. */
    public Optional<MonitorError> monitor(String signalName) {
        PinRef p = signal(signalName);
        return monitors.makeMonitor(p.deviceId(), p.pinId(), cyclesCompleted);
    }

    /** Stops monitoring an output; false if it was not monitored. */
    public boolean zap(String signalName) {
        PinRef p = signal(signalName);
        return monitors.removeMonitor(p.deviceId(), p.pinId());
    }

    public Map<String, List<Signal>> traces() { return monitors.namedTraces(); }

    public String formatTraces() { return new TraceFormatter(config.nameWidth()).format(traces()); }

    private PinRef signal(String signalName) {
        return devices.getSignalIds(signalName)
                .orElseThrow(() -> new IllegalArgumentException(Strings.get("sim.unknownSignal", signalName)));
    }

    private void requireValid() {
        if (!valid) throw new IllegalStateException("Definition has " + errors.size() + " error(s); cannot simulate");
    }

    /**
     * Outcome of a run.
     * @param cyclesRun cycles completed and recorded by this call
     * @param oscillation the cycle that failed to settle, or null
     */
    public record RunResult(int cyclesRun, Oscillation oscillation) {
        public boolean oscillated() { return oscillation != null; }
    }
}
