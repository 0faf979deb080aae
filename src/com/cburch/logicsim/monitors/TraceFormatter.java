package com.cburch.logicsim.monitors;

import com.cburch.logicsim.devices.Signal;
import com.cburch.logicsim.util.StringUtil;

import java.util.List;
import java.util.Map;

/**
 * Text rendering of signal traces, one row per monitored output:
 * <pre>
 *   sw1   : ___----
 *   d1.Q  : ____/--
 * </pre>
 */
public final class TraceFormatter {
    private final int nameWidth;

    /** @param nameWidth minimum width of the name column */
    public TraceFormatter(int nameWidth) {
        if (nameWidth < 0) throw new IllegalArgumentException("Negative name width: " + nameWidth);
        this.nameWidth = nameWidth;
    }

    public String format(Map<String, List<Signal>> traces) {
        int width = nameWidth;
        for (String name : traces.keySet()) width = Math.max(width, name.length());

        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, List<Signal>> e : traces.entrySet()) {
            sb.append(StringUtil.padRight(e.getKey(), width)).append(" : ");
            sb.append(row(e.getValue())).append('\n');
        }
        return sb.toString();
    }

    /** The trace characters of one signal. */
    public static String row(List<Signal> trace) {
        StringBuilder sb = new StringBuilder(trace.size());
        for (Signal s : trace) sb.append(s.traceChar());
        return sb.toString();
    }
}
