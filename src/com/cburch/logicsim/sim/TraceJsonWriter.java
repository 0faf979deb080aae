package com.cburch.logicsim.sim;

import com.cburch.logicsim.devices.Signal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** Exports traces as {@code {"cycles": n, "signals": {"g1": ["LOW", "RISING", ...]}}}. */
public final class TraceJsonWriter {
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public ObjectNode toJson(int cycles, Map<String, List<Signal>> traces) {
        ObjectNode root = mapper.createObjectNode();
        root.put("cycles", cycles);
        ObjectNode signals = root.putObject("signals");
        for (Map.Entry<String, List<Signal>> e : traces.entrySet()) {
            ArrayNode arr = signals.putArray(e.getKey());
            for (Signal s : e.getValue()) arr.add(s.name());
        }
        return root;
    }

    public String writeString(int cycles, Map<String, List<Signal>> traces) throws JsonProcessingException {
        return mapper.writeValueAsString(toJson(cycles, traces));
    }

    public void write(Path out, int cycles, Map<String, List<Signal>> traces) throws IOException {
        mapper.writeValue(out.toFile(), toJson(cycles, traces));
    }
}
