package com.cburch.logicsim.devices;

/**
 * Value of a pin. RISING and FALLING report a level change against the
 * previous completed cycle; BLANK means the pin has not been simulated yet.
 */
public enum Signal {
    LOW('_'),
    HIGH('-'),
    RISING('/'),
    FALLING('\\'),
    BLANK(' ');

    private final char traceChar;

    Signal(char traceChar) {
        this.traceChar = traceChar;
    }

    /** Character used when a trace is rendered as text. */
    public char traceChar() { return traceChar; }

    /** Steady level of this value: RISING is HIGH, FALLING is LOW, BLANK stays BLANK. */
    public Signal level() {
        return switch (this) {
            case HIGH, RISING -> HIGH;
            case LOW, FALLING -> LOW;
            case BLANK -> BLANK;
        };
    }

    public Signal invert() {
        return switch (level()) {
            case HIGH -> LOW;
            case LOW -> HIGH;
            default -> BLANK;
        };
    }

    public static Signal of(boolean high) { return high ? HIGH : LOW; }

    /**
     * Reports the transition from a previous stable value to a new level.
     * @param previous value at the end of the last completed cycle
     * @param now level reached in the current cycle
     */
    public static Signal transition(Signal previous, Signal now) {
        Signal before = previous.level();
        Signal after = now.level();
        if (before == BLANK || after == BLANK || before == after) return after;
        return after == HIGH ? RISING : FALLING;
    }
}
