package com.cburch.logicsim.parser;

import com.cburch.logicsim.devices.Device;
import com.cburch.logicsim.devices.DeviceError;
import com.cburch.logicsim.devices.DeviceKind;
import com.cburch.logicsim.devices.Devices;
import com.cburch.logicsim.devices.PinRef;
import com.cburch.logicsim.devices.RawProperty;
import com.cburch.logicsim.monitors.MonitorError;
import com.cburch.logicsim.monitors.Monitors;
import com.cburch.logicsim.names.Names;
import com.cburch.logicsim.network.ConnectionError;
import com.cburch.logicsim.network.Network;
import com.cburch.logicsim.scanner.Keyword;
import com.cburch.logicsim.scanner.Scanner;
import com.cburch.logicsim.scanner.Symbol;
import com.cburch.logicsim.scanner.SymbolType;
import com.cburch.logicsim.util.ErrorKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Recursive-descent parser for definition files. Builds the devices,
 * connections and monitor points as it goes and collects every error it
 * finds instead of stopping at the first one.
 * <p>
 * The three lists are parsed in order. Once a list fails, the model is no
 * longer trusted: the lists after it are still read, but only to report
 * their syntax errors, and nothing more is added to the network.
 * <p>
 * A parser reads its scanner once; call {@link #parseNetwork()} a single time.
 * The state of a parse lives in a {@link ParseState} handed from method to
 * method, never on the parser itself.
 */
public final class Parser {
    private static final Logger LOG = LogManager.getLogger(Parser.class);

    private enum Io { INPUT, OUTPUT }

    private final Names names;
    private final Devices devices;
    private final Network network;
    private final Monitors monitors;
    private final Scanner scanner;

    public Parser(Names names, Devices devices, Network network, Monitors monitors, Scanner scanner) {
        this.names = Objects.requireNonNull(names);
        this.devices = Objects.requireNonNull(devices);
        this.network = Objects.requireNonNull(network);
        this.monitors = Objects.requireNonNull(monitors);
        this.scanner = Objects.requireNonNull(scanner);
    }

    /** Parses the whole file, building the network when it has no errors. */
    public ParseResult parseNetwork() {
        ParseState st = new ParseState(scanner.getSymbol());

        if (!deviceList(st)) {
            LOG.warn("Errors encountered in device list. Will now check for syntax errors in rest of file.");
            connectionList(st, false);
            monitorList(st, false);
        } else if (!connectionList(st, true)) {
            LOG.warn("Errors encountered in connection list. Will now check for syntax errors in monitor list.");
            monitorList(st, false);
        } else {
            monitorList(st, true);
        }

        if (st.current().isEof() && st.errorCount() == 0) {
            LOG.info("Parsing complete.");
            return new ParseResult(true, st.errors());
        }
        LOG.info("Parsing complete. Unable to build network. {} error(s) found.", st.errorCount());
        return new ParseResult(false, st.errors());
    }

    public Scanner scanner() { return scanner; }

    /* ===== listas ===== */

    private boolean deviceList(ParseState st) {
        if (st.reachedEof()) return false;
        LOG.info("Parsing device list...");

        if (!checkKeyword(st, Keyword.DEVICE_LIST)) return false;
        if (!parseItems(st, SymbolType.DEVICE_TYPE, this::device)) {
            closeFailedList(st);
            return false;
        }
        return checkEnd(st, true);
    }

    private boolean connectionList(ParseState st, boolean build) {
        if (st.reachedEof()) return false;
        LOG.info("Parsing connection list...");

        if (!checkKeyword(st, Keyword.CONNECTION_LIST)) return false;

        if (!build) {
            parseItems(st, SymbolType.NAME, this::connectSyntax);
            closeFailedList(st);
            return false;
        }

        if (!parseItems(st, SymbolType.NAME, this::connect)) {
            closeFailedList(st);
            return false;
        }
        List<PinRef> missing = network.unconnectedInputs();
        if (!missing.isEmpty()) {
            List<String> pins = new ArrayList<>();
            for (PinRef p : missing) pins.add(devices.getSignalName(p.deviceId(), p.pinId()));
            error(st, SyntaxError.UNCONNECTED_INPUTS, String.join(", ", pins));
            checkEnd(st, true);
            return false;
        }
        return checkEnd(st, true);
    }

    private void monitorList(ParseState st, boolean build) {
        if (st.reachedEof()) return;
        LOG.info("Parsing monitor list...");

        if (!checkKeyword(st, Keyword.MONITOR_LIST)) return;

        parseItems(st, SymbolType.NAME, build ? this::monitor : this::monitorSyntax);
        if (st.reachedEof()) return;
        if (build && monitors.isEmpty()) error(st, SyntaxError.NO_MONITOR);

        // END ausente ya notificado por parseItems
        if (st.missingEnd()) st.setMissingEnd(false);
        else checkEnd(st, false);

        if (!st.current().isEof()) error(st, SyntaxError.NO_EOF);
    }

    /*
     * Parses items until END or end of file. A keyword or ':' in item
     * position means END is missing: it is reported once and the list is
     * abandoned, leaving the keyword for the next list.
     */
    private boolean parseItems(ParseState st, SymbolType expected, Predicate<ParseState> item) {
        boolean ok = true;
        while (!scanner.isKeyword(st.current(), Keyword.END) && !st.current().isEof()) {
            Symbol s = st.current();
            if (s.is(expected)) {
                if (!item.test(st)) ok = false;
            } else if (s.is(SymbolType.KEYWORD) || s.is(SymbolType.COLON)) {
                error(st, SyntaxError.END_ERROR, Recovery.NONE, s);
                st.setMissingEnd(true);
                return false;
            } else {
                error(st, SyntaxError.SYMBOL_TYPE_ERROR, expected.displayName());
                ok = false;
            }
        }
        return ok;
    }

    private void closeFailedList(ParseState st) {
        if (st.missingEnd()) st.setMissingEnd(false);
        else checkEnd(st, true);
    }

    private boolean checkKeyword(ParseState st, Keyword keyword) {
        if (scanner.isKeyword(st.current(), keyword)) {
            advance(st);
            if (st.current().is(SymbolType.COLON)) {
                advance(st);
                return true;
            }
            error(st, SyntaxError.SYNTAX_COLON);
        } else {
            error(st, SyntaxError.KEYWORD_ERROR, keyword.text());
        }
        return false;
    }

    private boolean checkEnd(ParseState st, boolean recover) {
        if (st.reachedEof()) return false;
        if (scanner.isKeyword(st.current(), Keyword.END)) {
            advance(st);
            return true;
        }
        error(st, SyntaxError.END_ERROR, recover ? Recovery.SECTION : Recovery.NONE, st.current());
        return false;
    }

    /* ===== elementos ===== */

    private boolean device(ParseState st) {
        Symbol typeSym = st.current();
        Optional<DeviceKind> kind = DeviceKind.fromKeyword(names.getNameString(typeSym.id()));
        if (kind.isEmpty()) {
            error(st, SyntaxError.UNKNOWN_DEVICE);
            return false;
        }
        advance(st);

        Symbol nameSym = st.current();
        if (!nameSym.is(SymbolType.NAME)) {
            error(st, SyntaxError.BAD_NAME);
            return false;
        }
        advance(st);

        RawProperty property = null;
        Symbol propSym = st.current();
        if (propSym.is(SymbolType.NUMBER) || propSym.is(SymbolType.PROPERTY)) {
            String text = names.getNameString(propSym.id());
            property = propSym.is(SymbolType.NUMBER) ? RawProperty.number(text) : RawProperty.state(text);
            advance(st);
        }

        Optional<DeviceError> err = devices.makeDevice(nameSym.id(), kind.get(), property);
        if (err.isPresent()) {
            DeviceError e = err.get();
            String msg = Strings.get(e.messageKey());
            if (e == DeviceError.INVALID_PROPERTY) msg += " " + Strings.get(propertyHintKey(kind.get()));
            report(st, e, Recovery.ITEM, st.current(), msg);
            return false;
        }
        return expect(st, SymbolType.SEMICOLON);
    }

    private static String propertyHintKey(DeviceKind kind) {
        String group = kind.isGate() ? "gate" : kind.keyword().toLowerCase();
        return "error.device.invalidProperty." + group;
    }

    private boolean connect(ParseState st) {
        Optional<PinRef> out = getIo(st, Io.OUTPUT);
        if (out.isEmpty()) return false;

        if (!st.current().is(SymbolType.ARROW)) return expect(st, SymbolType.ARROW);
        advance(st);

        if (!st.current().is(SymbolType.NAME)) {
            error(st, SyntaxError.SYMBOL_TYPE_ERROR, SymbolType.NAME.displayName());
            return false;
        }
        Optional<PinRef> in = getIo(st, Io.INPUT);
        if (in.isEmpty()) return false;

        Optional<ConnectionError> err = network.makeConnection(
                in.get().deviceId(), in.get().pinId(), out.get().deviceId(), out.get().pinId());
        if (err.isPresent()) {
            report(st, err.get(), Recovery.ITEM, st.current(), Strings.get(err.get().messageKey()));
            return false;
        }
        return expect(st, SymbolType.SEMICOLON);
    }

    private boolean connectSyntax(ParseState st) {
        if (!checkIo(st)) return false;

        if (!st.current().is(SymbolType.ARROW)) return expect(st, SymbolType.ARROW);
        advance(st);

        if (!st.current().is(SymbolType.NAME)) {
            error(st, SyntaxError.SYMBOL_TYPE_ERROR, SymbolType.NAME.displayName());
            return false;
        }
        if (!checkIo(st)) return false;
        return expect(st, SymbolType.SEMICOLON);
    }

    private boolean monitor(ParseState st) {
        Optional<PinRef> out = getIo(st, Io.OUTPUT);
        if (out.isEmpty()) return false;

        Optional<MonitorError> err = monitors.makeMonitor(out.get().deviceId(), out.get().pinId());
        if (err.isPresent()) {
            report(st, err.get(), Recovery.ITEM, st.current(), Strings.get(err.get().messageKey()));
            return false;
        }
        return expect(st, SymbolType.SEMICOLON);
    }

    private boolean monitorSyntax(ParseState st) {
        if (!checkIo(st)) return false;
        return expect(st, SymbolType.SEMICOLON);
    }

    /*
     * Reads "name" or "name.pin". Inputs need a pin unless the device has
     * none; outputs need one only on a DTYPE. A gate input may be given by
     * its ordinal ("g1.2").
     */
    private Optional<PinRef> getIo(ParseState st, Io io) {
        Device d = devices.getDevice(st.current().id());
        if (d == null) {
            error(st, SyntaxError.UNKNOWN_DEVICE);
            return Optional.empty();
        }
        boolean needsPin = io == Io.INPUT ? !d.inputs().isEmpty() : d.kind() == DeviceKind.D_TYPE;
        advance(st);

        Integer pin = null;
        if (st.current().is(SymbolType.PERIOD)) {
            if (!needsPin) {
                error(st, SyntaxError.IDENTIFIER_PRESENT);
                return Optional.empty();
            }
            advance(st);
            Symbol p = st.current();
            if (p.is(SymbolType.NAME)) {
                pin = p.id();
            } else if (p.is(SymbolType.NUMBER)) {
                pin = names.lookup(Devices.gateInputName(names.getNameString(p.id())));
            } else {
                error(st, SyntaxError.NO_IDENTIFIER);
                return Optional.empty();
            }
            advance(st);
        } else if (needsPin) {
            expect(st, SymbolType.PERIOD);
            return Optional.empty();
        }
        return Optional.of(PinRef.of(d.id(), pin));
    }

    /* Syntax-only form of getIo. */
    private boolean checkIo(ParseState st) {
        advance(st);
        if (st.current().is(SymbolType.PERIOD)) {
            advance(st);
            if (!st.current().is(SymbolType.NAME) && !st.current().is(SymbolType.NUMBER)) {
                error(st, SyntaxError.NO_IDENTIFIER);
                return false;
            }
            advance(st);
        }
        return true;
    }

    /* Consumes a punctuation symbol or reports that it is missing. */
    private boolean expect(ParseState st, SymbolType punctuation) {
        if (st.current().is(punctuation)) {
            advance(st);
            return true;
        }
        error(st, SyntaxError.EXPECTED_SYMBOL, names.getNameString(scanner.punctuationId(punctuation)));
        return false;
    }

    /* ===== errores ===== */

    private void advance(ParseState st) {
        st.setCurrent(scanner.getSymbol());
    }

    private void error(ParseState st, SyntaxError kind, String... args) {
        error(st, kind, kind.recovery(), st.current(), args);
    }

    private void error(ParseState st, SyntaxError kind, Recovery recovery, Symbol at, String... args) {
        report(st, kind, recovery, at, Strings.get(kind.messageKey(), args));
    }

    /*
     * Records an error at the given symbol, then skips ahead as the recovery
     * asks. The stop symbol is consumed unless it is the end of file.
     */
    private void report(ParseState st, ErrorKind kind, Recovery recovery, Symbol at, String message) {
        if (recovery != Recovery.NONE) {
            while (!stopsRecovery(st.current(), recovery)) advance(st);
            if (st.current().isEof()) {
                st.setReachedEof(true);
            } else {
                advance(st);
                message += " " + Strings.get("parser.resumed", st.current().line());
            }
        }
        LOG.debug("Error at {}:{}: {}", at.line(), at.column(), message);
        st.addError(new ParseError(kind, message, at.line(), at.column()));
    }

    private boolean stopsRecovery(Symbol s, Recovery recovery) {
        if (s.isEof()) return true;
        boolean end = scanner.isKeyword(s, Keyword.END);
        return switch (recovery) {
            case NONE -> true;
            case ITEM -> end || s.is(SymbolType.SEMICOLON);
            case LIST -> end;
            case SECTION -> s.is(SymbolType.KEYWORD);
        };
    }
}
