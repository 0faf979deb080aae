package com.cburch.logicsim.sim;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Run settings. The bundled {@code logicsim/defaults.json} supplies every
 * field; a user file may override any subset of them:
 * <pre>
 * { "cycles": 10,
 *   "oscillation": { "minPasses": 20, "passesPerDevice": 2 },
 *   "trace": { "nameWidth": 8 } }
 * </pre>
 */
public record SimulationConfig(int cycles, int minPasses, int passesPerDevice, int nameWidth) {
    private static final String DEFAULTS = "/logicsim/defaults.json";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public SimulationConfig {
        if (cycles < 0) throw new IllegalArgumentException("cycles must not be negative: " + cycles);
        if (minPasses < 1) throw new IllegalArgumentException("minPasses must be positive: " + minPasses);
        if (passesPerDevice < 1) throw new IllegalArgumentException("passesPerDevice must be positive: " + passesPerDevice);
        if (nameWidth < 0) throw new IllegalArgumentException("nameWidth must not be negative: " + nameWidth);
    }

    /** Settings from the bundled defaults file. */
    public static SimulationConfig defaults() {
        try (InputStream in = SimulationConfig.class.getResourceAsStream(DEFAULTS)) {
            if (in == null) throw new IllegalStateException("Missing resource " + DEFAULTS);
            return fromJson(MAPPER.readTree(in), null);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + DEFAULTS, e);
        }
    }

    /** Defaults overridden by the fields present in a user file. */
    public static SimulationConfig load(Path file) throws IOException {
        JsonNode root = MAPPER.readTree(Files.readString(file));
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Config file must hold a JSON object: " + file);
        }
        return fromJson(root, defaults());
    }

    /**
     * Reads the fields present in {@code root}; missing ones come from
     * {@code base}, which may only be null when every field is present.
     */
    static SimulationConfig fromJson(JsonNode root, SimulationConfig base) {
        JsonNode osc = root.path("oscillation");
        JsonNode trace = root.path("trace");
        return new SimulationConfig(
                intField(root.path("cycles"), base == null ? null : base.cycles(), "cycles"),
                intField(osc.path("minPasses"), base == null ? null : base.minPasses(), "oscillation.minPasses"),
                intField(osc.path("passesPerDevice"), base == null ? null : base.passesPerDevice(), "oscillation.passesPerDevice"),
                intField(trace.path("nameWidth"), base == null ? null : base.nameWidth(), "trace.nameWidth"));
    }

    private static int intField(JsonNode n, Integer fallback, String name) {
        if (n.isMissingNode() || n.isNull()) {
            if (fallback == null) throw new IllegalArgumentException("Missing config field " + name);
            return fallback;
        }
        if (!n.canConvertToInt() || !n.isIntegralNumber()) {
            throw new IllegalArgumentException("Config field " + name + " must be an integer: " + n);
        }
        return n.asInt();
    }

    public SimulationConfig withCycles(int n) {
        return new SimulationConfig(n, minPasses, passesPerDevice, nameWidth);
    }
}
