package com.cburch.logicsim.sim;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestSimulationConfig {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path write(String json) throws IOException {
        Path p = tmp.newFile("config.json").toPath();
        Files.writeString(p, json);
        return p;
    }

    @Test
    public void bundledDefaults() {
        Assert.assertEquals(new SimulationConfig(10, 20, 2, 8), SimulationConfig.defaults());
    }

    @Test
    public void userFileOverridesSomeFields() throws IOException {
        SimulationConfig c = SimulationConfig.load(write("{\"cycles\": 25, \"oscillation\": {\"minPasses\": 50}}"));
        Assert.assertEquals(new SimulationConfig(25, 50, 2, 8), c);
    }

    @Test(expected = IllegalArgumentException.class)
    public void wrongFieldType() throws IOException {
        SimulationConfig.load(write("{\"cycles\": \"many\"}"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void outOfRangeValue() throws IOException {
        SimulationConfig.load(write("{\"oscillation\": {\"passesPerDevice\": 0}}"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void topLevelMustBeAnObject() throws IOException {
        SimulationConfig.load(write("[1, 2]"));
    }

    @Test
    public void withCycles() {
        Assert.assertEquals(3, SimulationConfig.defaults().withCycles(3).cycles());
    }
}
