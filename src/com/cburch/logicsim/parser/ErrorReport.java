package com.cburch.logicsim.parser;

import com.cburch.logicsim.scanner.Scanner;

import java.util.List;

/** Renders parse errors with the offending source line and a caret under the column. */
public final class ErrorReport {
    private static final String RULE = "---------";

    private ErrorReport() { }

    public static String render(Scanner scanner, List<ParseError> errors) {
        StringBuilder sb = new StringBuilder();
        String header = Strings.get("report.header", errors.size());
        String dashes = "-".repeat(header.length());
        sb.append(dashes).append('\n').append(header).append('\n').append(dashes).append('\n');

        for (ParseError e : errors) {
            sb.append(RULE).append('\n');
            sb.append(Strings.get("report.inLine", e.line())).append('\n');
            sb.append(scanner.printLine(e.line(), e.column())).append('\n');
            sb.append(Strings.get("report.error", e.message())).append('\n');
            sb.append(RULE).append('\n');
        }
        return sb.toString();
    }
}
