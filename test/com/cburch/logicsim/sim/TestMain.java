package com.cburch.logicsim.sim;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestMain {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @Before
    public void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return Main.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private static String fixture(String name) throws Exception {
        return Paths.get(TestMain.class.getResource("/definitions/" + name).toURI()).toString();
    }

    private String stdout() { return out.toString(StandardCharsets.UTF_8); }

    @Test
    public void simulatesAndPrintsTraces() throws Exception {
        Assert.assertEquals(Main.EXIT_OK, run(fixture("no_errors.txt"), "-n", "4", "-s", "a=1"));
        String[] rows = stdout().split("\n");
        Assert.assertEquals(3, rows.length);
        Assert.assertTrue(rows[0], rows[0].startsWith("sum"));
        // a=1, b=1: suma 0, acarreo 1
        Assert.assertTrue(rows[0], rows[0].endsWith(": ____"));
        Assert.assertTrue(rows[1], rows[1].endsWith(": ----"));
    }

    @Test
    public void writesJson() throws Exception {
        Path json = tmp.getRoot().toPath().resolve("out.json");
        Assert.assertEquals(Main.EXIT_OK, run(fixture("no_errors.txt"), "-n", "3", "--json", json.toString()));
        Assert.assertTrue(Files.readString(json).contains("\"cycles\" : 3"));
    }

    @Test
    public void reportsParseErrors() throws Exception {
        Assert.assertEquals(Main.EXIT_FAILED, run(fixture("errors.txt")));
        Assert.assertTrue(stdout().contains("6 error(s) found"));
    }

    @Test
    public void usageErrors() throws Exception {
        Assert.assertEquals(Main.EXIT_USAGE, run());
        Assert.assertEquals(Main.EXIT_USAGE, run(fixture("no_errors.txt"), "-n"));
        Assert.assertEquals(Main.EXIT_USAGE, run(fixture("no_errors.txt"), "-n", "x"));
        Assert.assertEquals(Main.EXIT_USAGE, run(fixture("no_errors.txt"), "-s", "a=2"));
        Assert.assertEquals(Main.EXIT_USAGE, run(fixture("no_errors.txt"), "-s", "sum=1"));
        Assert.assertEquals(Main.EXIT_USAGE, run(fixture("no_errors.txt"), "--bogus"));
        Assert.assertEquals(Main.EXIT_USAGE, run(tmp.getRoot().toPath().resolve("missing.txt").toString()));
    }

    @Test
    public void oscillationFails() throws Exception {
        Path def = tmp.newFile("ring.txt").toPath();
        Files.writeString(def, "DEVICE_LIST: NOR a 1; END\n"
                + "CONNECTION_LIST: a -> a.1; END\n"
                + "MONITOR_LIST: a; END\n");
        Assert.assertEquals(Main.EXIT_FAILED, run(def.toString(), "-n", "2"));
        Assert.assertTrue(err.toString(StandardCharsets.UTF_8).contains("oscillating"));
    }
}
