package com.cburch.logicsim.devices;

/**
 * Validated configuration of a device. Each device kind accepts exactly one
 * of these shapes; {@link Devices#makeDevice} decides which.
 */
public sealed interface DeviceConfig
        permits DeviceConfig.GateInputs, DeviceConfig.ClockPeriod,
                DeviceConfig.SwitchState, DeviceConfig.SignalPattern, DeviceConfig.None {

    int MAX_GATE_INPUTS = 16;

    /** Number of inputs of an AND, NAND, OR, NOR or XOR gate. */
    record GateInputs(int count) implements DeviceConfig {
        public GateInputs {
            if (count < 1 || count > MAX_GATE_INPUTS) {
                throw new IllegalArgumentException("Gate input count out of range: " + count);
            }
        }
    }

    /** Number of cycles between two toggles of a clock. */
    record ClockPeriod(int halfPeriod) implements DeviceConfig {
        public ClockPeriod {
            if (halfPeriod <= 0) throw new IllegalArgumentException("Half period must be positive: " + halfPeriod);
        }
    }

    /** Position of a switch when the network is built. */
    record SwitchState(Signal initial) implements DeviceConfig {
        public SwitchState {
            if (initial != Signal.LOW && initial != Signal.HIGH) {
                throw new IllegalArgumentException("Switch state must be LOW or HIGH: " + initial);
            }
        }
    }

    /** Bits a signal generator emits, one per cycle, as a string of 0s and 1s. */
    record SignalPattern(String bits) implements DeviceConfig {
        public SignalPattern {
            if (bits == null || bits.isEmpty() || !bits.chars().allMatch(c -> c == '0' || c == '1')) {
                throw new IllegalArgumentException("Pattern must be a non-empty string of 0s and 1s: " + bits);
            }
        }

        public Signal bitAt(int i) { return Signal.of(bits.charAt(i) == '1'); }

        public int length() { return bits.length(); }
    }

    /** For devices that take no property. */
    record None() implements DeviceConfig { }
}
