package com.cburch.logicsim.devices;

import com.cburch.logicsim.names.Names;

import java.util.List;
import java.util.Optional;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class TestDevices {
    private Names names;
    private Devices devices;

    @Before
    public void setUp() {
        names = new Names();
        devices = new Devices(names);
    }

    private Optional<DeviceError> make(String name, DeviceKind kind, RawProperty p) {
        return devices.makeDevice(names.lookup(name), kind, p);
    }

    @Test
    public void gatesGetNumberedInputs() {
        Assert.assertFalse(make("g1", DeviceKind.NAND, RawProperty.number("3")).isPresent());
        Device g = devices.resolve("g1").orElseThrow();
        Assert.assertEquals(DeviceKind.NAND, g.kind());
        Assert.assertEquals(names.lookup(List.of("I1", "I2", "I3")), g.inputs());
        Assert.assertTrue(g.hasOutput(null));
        Assert.assertEquals(Signal.BLANK, g.getOutput(null));
    }

    @Test
    public void gateInputCountIsChecked() {
        Assert.assertEquals(Optional.of(DeviceError.INVALID_PROPERTY), make("a", DeviceKind.AND, RawProperty.number("0")));
        Assert.assertEquals(Optional.of(DeviceError.INVALID_PROPERTY), make("b", DeviceKind.OR, RawProperty.number("17")));
        Assert.assertEquals(Optional.of(DeviceError.INVALID_PROPERTY), make("c", DeviceKind.OR, RawProperty.number("99999999999")));
        Assert.assertEquals(Optional.of(DeviceError.INVALID_PROPERTY), make("d", DeviceKind.NOR, RawProperty.state("ON")));
        Assert.assertEquals(Optional.of(DeviceError.NO_PROPERTY), make("e", DeviceKind.AND, null));
        Assert.assertFalse(make("f", DeviceKind.AND, RawProperty.number("16")).isPresent());
        Assert.assertEquals(1, devices.size());
    }

    @Test
    public void xorAndDtypeTakeNoProperty() {
        Assert.assertEquals(Optional.of(DeviceError.PROPERTY_PRESENT), make("x", DeviceKind.XOR, RawProperty.number("2")));
        Assert.assertEquals(Optional.of(DeviceError.PROPERTY_PRESENT), make("d", DeviceKind.D_TYPE, RawProperty.number("1")));
        Assert.assertFalse(make("x", DeviceKind.XOR, null).isPresent());
        Assert.assertFalse(make("d", DeviceKind.D_TYPE, null).isPresent());

        Assert.assertEquals(2, devices.resolve("x").orElseThrow().inputs().size());
        Device d = devices.resolve("d").orElseThrow();
        Assert.assertEquals(List.of(devices.dataId, devices.clkId, devices.setId, devices.clearId), d.inputs());
        Assert.assertEquals(List.of(devices.qId, devices.qBarId), d.outputIds());
        Assert.assertFalse(d.hasOutput(null));
    }

    @Test
    public void sourceProperties() {
        Assert.assertFalse(make("sw1", DeviceKind.SWITCH, RawProperty.state("ON")).isPresent());
        Assert.assertFalse(make("sw2", DeviceKind.SWITCH, RawProperty.number("0")).isPresent());
        Assert.assertEquals(Optional.of(DeviceError.INVALID_PROPERTY), make("sw3", DeviceKind.SWITCH, RawProperty.number("2")));
        Assert.assertEquals(Optional.of(DeviceError.NO_PROPERTY), make("sw4", DeviceKind.SWITCH, null));

        Assert.assertFalse(make("clk", DeviceKind.CLOCK, RawProperty.number("5")).isPresent());
        Assert.assertEquals(Optional.of(DeviceError.INVALID_PROPERTY), make("clk0", DeviceKind.CLOCK, RawProperty.number("0")));

        Assert.assertFalse(make("sg", DeviceKind.SIGGEN, RawProperty.number("0110")).isPresent());
        Assert.assertEquals(Optional.of(DeviceError.INVALID_PROPERTY), make("sg2", DeviceKind.SIGGEN, RawProperty.number("012")));
        Assert.assertEquals(Optional.of(DeviceError.INVALID_PROPERTY), make("sg3", DeviceKind.SIGGEN, RawProperty.state("ON")));

        Assert.assertEquals(Signal.HIGH, devices.resolve("sw1").orElseThrow().switchState());
        Assert.assertEquals(Signal.LOW, devices.resolve("sw2").orElseThrow().switchState());
        Assert.assertEquals(new DeviceConfig.SignalPattern("0110"), devices.resolve("sg").orElseThrow().config());
        Assert.assertTrue(devices.resolve("clk").orElseThrow().inputs().isEmpty());
    }

    @Test
    public void duplicateNamesAreRejected() {
        Assert.assertFalse(make("g", DeviceKind.AND, RawProperty.number("2")).isPresent());
        Assert.assertEquals(Optional.of(DeviceError.DEVICE_PRESENT), make("g", DeviceKind.OR, RawProperty.number("2")));
        Assert.assertEquals(DeviceKind.AND, devices.resolve("g").orElseThrow().kind());
    }

    @Test
    public void findDevicesKeepsDeclarationOrder() {
        make("s1", DeviceKind.SWITCH, RawProperty.state("OFF"));
        make("g1", DeviceKind.AND, RawProperty.number("1"));
        make("s2", DeviceKind.SWITCH, RawProperty.state("OFF"));

        Assert.assertEquals(names.lookup(List.of("s1", "s2")), devices.findDevices(DeviceKind.SWITCH));
        Assert.assertEquals(names.lookup(List.of("s1", "g1", "s2")), devices.findDevices());
    }

    @Test
    public void setSwitchOnlyAffectsSwitches() {
        make("sw", DeviceKind.SWITCH, RawProperty.state("OFF"));
        make("g", DeviceKind.AND, RawProperty.number("1"));
        Assert.assertTrue(devices.setSwitch(names.lookup("sw"), Signal.HIGH));
        Assert.assertEquals(Signal.HIGH, devices.resolve("sw").orElseThrow().switchState());
        Assert.assertFalse(devices.setSwitch(names.lookup("g"), Signal.HIGH));
        Assert.assertFalse(devices.setSwitch(names.lookup("nothing"), Signal.HIGH));
    }

    @Test
    public void signalNames() {
        make("d1", DeviceKind.D_TYPE, null);
        make("g1", DeviceKind.OR, RawProperty.number("2"));
        int d1 = names.lookup("d1");

        Assert.assertEquals("d1.QBAR", devices.getSignalName(d1, devices.qBarId));
        Assert.assertEquals("g1", devices.getSignalName(names.lookup("g1"), null));
        Assert.assertNull(devices.getSignalName(names.lookup("ghost"), null));

        Assert.assertEquals(Optional.of(PinRef.of(d1, devices.qId)), devices.getSignalIds("d1.Q"));
        Assert.assertEquals(Optional.of(PinRef.of(names.lookup("g1"), null)), devices.getSignalIds("g1"));
        Assert.assertEquals(Optional.empty(), devices.getSignalIds("d1.NOPE"));
        Assert.assertEquals(Optional.empty(), devices.getSignalIds("ghost"));
    }

    @Test
    public void coldStartupBlanksOutputsAndKeepsSwitches() {
        make("sw", DeviceKind.SWITCH, RawProperty.state("OFF"));
        make("clk", DeviceKind.CLOCK, RawProperty.number("1"));
        Device sw = devices.resolve("sw").orElseThrow();
        Device clk = devices.resolve("clk").orElseThrow();

        devices.setSwitch(sw.id(), Signal.HIGH);
        sw.setOutput(null, Signal.HIGH);
        clk.setOutput(null, clk.stepClock());
        Assert.assertEquals(Signal.HIGH, clk.clockLevel());

        devices.coldStartup();
        Assert.assertEquals(Signal.BLANK, sw.getOutput(null));
        Assert.assertEquals(Signal.BLANK, clk.getOutput(null));
        Assert.assertEquals(Signal.LOW, clk.clockLevel());
        Assert.assertEquals(0, clk.clockCounter());
        Assert.assertEquals(Signal.HIGH, sw.switchState());
    }

    @Test
    public void signalTransitions() {
        Assert.assertEquals(Signal.RISING, Signal.transition(Signal.LOW, Signal.HIGH));
        Assert.assertEquals(Signal.FALLING, Signal.transition(Signal.RISING, Signal.LOW));
        Assert.assertEquals(Signal.HIGH, Signal.transition(Signal.BLANK, Signal.HIGH));
        Assert.assertEquals(Signal.LOW, Signal.transition(Signal.FALLING, Signal.LOW));
        Assert.assertEquals(Signal.LOW, Signal.HIGH.invert());
        Assert.assertEquals(Signal.BLANK, Signal.BLANK.invert());
    }
}
