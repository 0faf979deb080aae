package com.cburch.logicsim.scanner;

import com.cburch.logicsim.names.Names;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns the characters of a definition file into {@link Symbol}s.
 * Whitespace, line comments and block comments are skipped; every symbol
 * records the line and column of its first character.
 */
public final class Scanner {
    private static final Logger LOG = LogManager.getLogger(Scanner.class);

    public static final List<String> DEVICE_TYPES =
            List.of("AND", "NAND", "OR", "NOR", "XOR", "DTYPE", "CLOCK", "SWITCH", "SIGGEN");
    public static final List<String> INITIAL_STATES = List.of("OFF", "ON");

    // Ventana usada por printLine para líneas largas
    private static final int LINE_WINDOW = 73;
    private static final int HALF_WINDOW = 36;

    private final Names names;
    private final String text;
    private final String[] lines;

    private final Map<Keyword, Integer> keywordIds = new EnumMap<>(Keyword.class);
    private final Set<Integer> deviceTypeIds = new HashSet<>();
    private final Set<Integer> initialStateIds = new HashSet<>();
    private final int eofId;
    private final int colonId;
    private final int semicolonId;
    private final int arrowId;
    private final int periodId;

    private int pos = 0;
    private int line = 1;
    private int column = 1;

    /**
     * Creates a scanner over in-memory source text.
     * @param text definition file contents
     * @param names symbol table shared with the rest of the simulator
     */
    public Scanner(String text, Names names) {
        this.text = Objects.requireNonNull(text, "text");
        this.names = Objects.requireNonNull(names, "names");
        this.lines = text.split("\r?\n", -1);

        this.eofId = names.lookup("");
        this.colonId = names.lookup(":");
        this.semicolonId = names.lookup(";");
        this.arrowId = names.lookup("->");
        this.periodId = names.lookup(".");
        for (Keyword k : Keyword.values()) keywordIds.put(k, names.lookup(k.text()));
        deviceTypeIds.addAll(names.lookup(DEVICE_TYPES));
        initialStateIds.addAll(names.lookup(INITIAL_STATES));
    }

    /** Reads a definition file from disk. */
    public static Scanner fromFile(Path path, Names names) throws IOException {
        return new Scanner(Files.readString(path, StandardCharsets.UTF_8), names);
    }

    public Names names() { return names; }

    public int keywordId(Keyword k) { return keywordIds.get(k); }

    public boolean isKeyword(Symbol s, Keyword k) {
        return s.type() == SymbolType.KEYWORD && s.id() == keywordIds.get(k);
    }

    public int eofId() { return eofId; }

    /** Id of the text a punctuation symbol type stands for, used in "Expected a ';'" messages. */
    public int punctuationId(SymbolType type) {
        return switch (type) {
            case COLON -> colonId;
            case SEMICOLON -> semicolonId;
            case ARROW -> arrowId;
            case PERIOD -> periodId;
            default -> throw new IllegalArgumentException("Not a punctuation symbol: " + type);
        };
    }

    /**
     * Returns the next symbol. Once the input is exhausted every call returns
     * an EOF symbol positioned just after the last character.
     */
    public Symbol getSymbol() {
        skipWhitespaceAndComments();

        if (atEnd()) {
            return new Symbol(SymbolType.EOF, eofId, line, column);
        }

        int symLine = line;
        int symColumn = column;
        char ch = current();

        if (isDigit(ch)) {
            int start = pos;
            while (!atEnd() && isDigit(current())) advance();
            return new Symbol(SymbolType.NUMBER, names.lookup(text.substring(start, pos)), symLine, symColumn);
        }

        if (isLetter(ch)) {
            int start = pos;
            while (!atEnd() && (isLetter(current()) || isDigit(current()) || current() == '_')) advance();
            int id = names.lookup(text.substring(start, pos));
            return new Symbol(classifyWord(id), id, symLine, symColumn);
        }

        advance();
        switch (ch) {
            case ':':
                return new Symbol(SymbolType.COLON, colonId, symLine, symColumn);
            case ';':
                return new Symbol(SymbolType.SEMICOLON, semicolonId, symLine, symColumn);
            case '.':
                return new Symbol(SymbolType.PERIOD, periodId, symLine, symColumn);
            case '-':
                if (!atEnd() && current() == '>') {
                    advance();
                    return new Symbol(SymbolType.ARROW, arrowId, symLine, symColumn);
                }
                LOG.debug("Stray '-' at {}:{}", symLine, symColumn);
                return new Symbol(SymbolType.UNKNOWN, names.lookup("-"), symLine, symColumn);
            default:
                return new Symbol(SymbolType.UNKNOWN, names.lookup(String.valueOf(ch)), symLine, symColumn);
        }
    }

    private SymbolType classifyWord(int id) {
        if (keywordIds.containsValue(id)) return SymbolType.KEYWORD;
        if (deviceTypeIds.contains(id)) return SymbolType.DEVICE_TYPE;
        if (initialStateIds.contains(id)) return SymbolType.PROPERTY;
        return SymbolType.NAME;
    }

    /*
     * Skips whitespace and comments until a significant character or the end
     * of input. Comments may follow each other directly.
     */
    private void skipWhitespaceAndComments() {
        while (!atEnd()) {
            char ch = current();
            if (Character.isWhitespace(ch)) {
                advance();
            } else if (ch == '/' && peek() == '/') {
                while (!atEnd() && current() != '\n') advance();
            } else if (ch == '/' && peek() == '*') {
                int startLine = line;
                advance();
                advance();
                while (!atEnd() && !(current() == '*' && peek() == '/')) advance();
                if (atEnd()) {
                    LOG.debug("Block comment opened on line {} is not closed", startLine);
                } else {
                    advance();
                    advance();
                }
            } else {
                return;
            }
        }
    }

    private boolean atEnd() { return pos >= text.length(); }

    private char current() { return text.charAt(pos); }

    private char peek() { return pos + 1 < text.length() ? text.charAt(pos + 1) : '\0'; }

    private void advance() {
        if (text.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private static boolean isDigit(char c) { return c >= '0' && c <= '9'; }

    private static boolean isLetter(char c) { return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'); }

    /**
     * Returns the requested source line followed by a caret under the given
     * column. Lines longer than the display window are cut around the column
     * and marked with "...".
     */
    public String printLine(int lineNum, int colNum) {
        if (lineNum < 1 || lineNum > lines.length) return "\n^";

        String ln = lines[lineNum - 1];
        int n = ln.length();
        String shown;
        int blanks;
        if (colNum <= HALF_WINDOW || n < LINE_WINDOW) {
            shown = ln;
            blanks = colNum - 1;
        } else if (colNum + HALF_WINDOW > n) {
            shown = "..." + ln.substring(n - (LINE_WINDOW - 1));
            blanks = colNum + LINE_WINDOW + 1 - n;
        } else {
            shown = "..." + ln.substring(colNum - 1 - HALF_WINDOW, colNum + HALF_WINDOW) + "...";
            blanks = 3 + HALF_WINDOW;
        }
        return shown + "\n" + " ".repeat(Math.max(0, blanks)) + "^";
    }
}
