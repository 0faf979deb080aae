package com.cburch.logicsim.util;

public final class StringUtil {
    private StringUtil() { }

    /**
     * Substitutes arguments into a message template. {@code %s} takes the
     * next argument in order, {@code %$1} to {@code %$3} name an argument by
     * position and {@code %%} is a literal percent sign. Anything else after
     * a {@code %} is copied unchanged.
     */
    public static String format(String fmt, String... args) {
        if (fmt == null) return "";

        StringBuilder ret = new StringBuilder();
        int pos = 0;
        int next = fmt.indexOf('%');
        int argSeq = 0;

        while (next >= 0) {
            ret.append(fmt, pos, next);
            if (next + 1 >= fmt.length()) {
                // '%' al final: se deja literal
                ret.append('%');
                pos = next + 1;
                break;
            }

            char c = fmt.charAt(next + 1);
            switch (c) {
                case 's' -> {
                    ret.append(argAt(args, argSeq++));
                    pos = next + 2;
                }
                case '$' -> {
                    int idx = next + 2 < fmt.length() ? fmt.charAt(next + 2) - '1' : -1;
                    if (idx >= 0 && idx < 3) {
                        ret.append(argAt(args, idx));
                        pos = next + 3;
                    } else {
                        ret.append("%$");
                        pos = next + 2;
                    }
                }
                case '%' -> {
                    ret.append('%');
                    pos = next + 2;
                }
                default -> {
                    ret.append('%').append(c);
                    pos = next + 2;
                }
            }
            next = fmt.indexOf('%', pos);
        }
        if (pos < fmt.length()) ret.append(fmt, pos, fmt.length());
        return ret.toString();
    }

    /** Right-pads {@code s} with spaces to at least {@code width} characters. */
    public static String padRight(String s, int width) {
        StringBuilder sb = new StringBuilder(s);
        while (sb.length() < width) sb.append(' ');
        return sb.toString();
    }

    private static String argAt(String[] args, int i) {
        if (args == null || i >= args.length || args[i] == null) return "(null)";
        return args[i];
    }
}
