package com.cburch.logicsim.sim;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command line entry point:
 * <pre>
 * logicsim &lt;file&gt; [-n cycles] [-s switch=0|1]... [--config file.json] [--json out.json]
 * </pre>
 * Exits with 0 on success, 1 when the file has errors or the network
 * oscillates, 2 on bad usage.
 */
public final class Main {
    private static final Logger LOG = LogManager.getLogger(Main.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private static final String USAGE =
            "usage: logicsim <file> [-n cycles] [-s switch=0|1]... [--config file.json] [--json out.json]";

    private Main() { }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Path file = null;
        Path configFile = null;
        Path jsonOut = null;
        Integer cycles = null;
        Map<String, Boolean> switches = new LinkedHashMap<>();

        try {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "-n" -> cycles = parseCycles(value(args, ++i, arg));
                    case "-s" -> {
                        String[] kv = value(args, ++i, arg).split("=", 2);
                        if (kv.length != 2 || !(kv[1].equals("0") || kv[1].equals("1"))) {
                            throw new IllegalArgumentException("Expected switch=0|1 after -s");
                        }
                        switches.put(kv[0], kv[1].equals("1"));
                    }
                    case "--config" -> configFile = Paths.get(value(args, ++i, arg));
                    case "--json" -> jsonOut = Paths.get(value(args, ++i, arg));
                    default -> {
                        if (arg.startsWith("-") || file != null) {
                            throw new IllegalArgumentException("Unexpected argument: " + arg);
                        }
                        file = Paths.get(arg);
                    }
                }
            }
            if (file == null) throw new IllegalArgumentException("No definition file given");
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        SimulationConfig config;
        Simulator sim;
        try {
            config = configFile == null ? SimulationConfig.defaults() : SimulationConfig.load(configFile);
            if (cycles != null) config = config.withCycles(cycles);
            sim = Simulator.load(file, config);
        } catch (IOException | IllegalArgumentException e) {
            LOG.error("Cannot start simulation", e);
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        if (!sim.isValid()) {
            out.print(sim.errorReport());
            return EXIT_FAILED;
        }

        try {
            for (Map.Entry<String, Boolean> e : switches.entrySet()) sim.setSwitch(e.getKey(), e.getValue());
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        Simulator.RunResult result = sim.run(config.cycles());
        out.print(sim.formatTraces());

        if (jsonOut != null) {
            try {
                new TraceJsonWriter().write(jsonOut, sim.cyclesCompleted(), sim.traces());
            } catch (IOException e) {
                LOG.error("Cannot write {}", jsonOut, e);
                err.println("Cannot write " + jsonOut + ": " + e.getMessage());
                return EXIT_FAILED;
            }
        }

        if (result.oscillated()) {
            err.println(sim.oscillationMessage(result.oscillation()));
            return EXIT_FAILED;
        }
        return EXIT_OK;
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length) throw new IllegalArgumentException("Missing value after " + option);
        return args[i];
    }

    private static int parseCycles(String s) {
        try {
            int n = Integer.parseInt(s);
            if (n < 0) throw new IllegalArgumentException("Cycle count must not be negative: " + s);
            return n;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a cycle count: " + s, e);
        }
    }
}
