package org.logsim.compiler.frontend.semantics;

import org.logsim.compiler.api.DeviceInfo;
import org.logsim.compiler.api.IDevices;
import org.logsim.compiler.api.IMonitors;
import org.logsim.compiler.api.INetwork;
import org.logsim.compiler.api.SemanticErrorKind;
import org.logsim.compiler.diagnostics.CompilerLogger;
import org.logsim.compiler.diagnostics.DiagnosticsEngine;
import org.logsim.compiler.frontend.lexer.Scanner;
import org.logsim.compiler.frontend.lexer.Symbol;
import org.logsim.compiler.frontend.lexer.SymbolType;
import org.logsim.compiler.frontend.names.NameTable;
import org.logsim.compiler.frontend.parser.ItemDescriptor;
import org.logsim.compiler.internal.i18n.Messages;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Translates the result codes of the device, network and monitor collaborators into
 * positioned diagnostics.
 * <p>
 * The code table is assembled from the {@code semanticErrorCodes()} of all three
 * collaborators; codes it does not contain mean success. Each failure is reported at the
 * symbol of the item that best identifies the culprit, and every kind is either fatal
 * (the build stops) or a warning (the build goes on).
 */
public class SemanticErrorHandler {

    /** The kinds that are warnings unless configured otherwise. */
    public static final Set<SemanticErrorKind> DEFAULT_WARNINGS = Arrays.stream(SemanticErrorKind.values())
            .filter(kind -> !kind.isFatalByDefault())
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(SemanticErrorKind.class)));

    /** Pins by name, with numbered pins in numeric order: I2 before I10. */
    private static final Comparator<String> PIN_ORDER = Comparator
            .comparing(SemanticErrorHandler::pinStem)
            .thenComparingInt(SemanticErrorHandler::pinNumber);

    private final NameTable names;
    private final IDevices devices;
    private final INetwork network;
    private final Scanner scanner;
    private final DiagnosticsEngine diagnostics;
    private final Set<SemanticErrorKind> warningKinds;
    private final Map<Integer, SemanticErrorKind> codeTable = new HashMap<>();

    private int errorCount = 0;
    private int warningCount = 0;

    /**
     * Creates a handler with the default warning kinds.
     */
    public SemanticErrorHandler(NameTable names, IDevices devices, INetwork network, IMonitors monitors,
                                Scanner scanner, DiagnosticsEngine diagnostics) {
        this(names, devices, network, monitors, scanner, diagnostics, DEFAULT_WARNINGS);
    }

    /**
     * Creates a handler.
     * @param names The name table of the scanned file.
     * @param devices The device store.
     * @param network The connection graph.
     * @param monitors The monitors.
     * @param scanner The scanner that renders the diagnostics.
     * @param diagnostics Where diagnostics are recorded.
     * @param warningKinds The kinds that are reported as warnings and do not stop the build.
     * @throws IllegalStateException if two collaborators use the same code for different kinds.
     */
    public SemanticErrorHandler(NameTable names, IDevices devices, INetwork network, IMonitors monitors,
                                Scanner scanner, DiagnosticsEngine diagnostics, Set<SemanticErrorKind> warningKinds) {
        this.names = names;
        this.devices = devices;
        this.network = network;
        this.scanner = scanner;
        this.diagnostics = diagnostics;
        this.warningKinds = warningKinds.isEmpty()
                ? EnumSet.noneOf(SemanticErrorKind.class)
                : EnumSet.copyOf(warningKinds);
        registerCodes(devices.semanticErrorCodes());
        registerCodes(network.semanticErrorCodes());
        registerCodes(monitors.semanticErrorCodes());
    }

    private void registerCodes(Map<SemanticErrorKind, Integer> codes) {
        codes.forEach((kind, code) -> {
            SemanticErrorKind existing = codeTable.putIfAbsent(code, kind);
            if (existing != null && existing != kind) {
                throw new IllegalStateException(
                        "Result code " + code + " is used for both " + existing + " and " + kind);
            }
        });
    }

    /**
     * @param code A collaborator result code.
     * @return The kind of failure, or empty if the code means success.
     */
    public Optional<SemanticErrorKind> classify(int code) {
        return Optional.ofNullable(codeTable.get(code));
    }

    /**
     * @param kind A failure kind.
     * @return true if the kind stops the build.
     */
    public boolean isFatal(SemanticErrorKind kind) {
        return !warningKinds.contains(kind);
    }

    /**
     * Reports the failure a result code stands for, if any.
     * @param code The code returned by a collaborator.
     * @param item The item whose build step returned the code.
     * @return true if the code is a fatal failure and the build must stop.
     */
    public boolean handle(int code, ItemDescriptor item) {
        Optional<SemanticErrorKind> classified = classify(code);
        if (classified.isEmpty()) {
            return false;
        }
        SemanticErrorKind kind = classified.get();
        CompilerLogger.debug("Result code {} classified as {}", code, kind);
        switch (kind) {
            case DEVICE_PRESENT:
                report(kind, item.get(1), Messages.get("semantic.device.present", text(item.get(1))));
                break;
            case INPUT_TO_INPUT: {
                ConnectionRoles roles = ConnectionRoles.from(item);
                report(kind, roles.firstDevice(), Messages.get("semantic.input.to.input",
                        dotted(roles.firstDevice(), roles.firstPort()), dotted(roles.secondDevice(), roles.secondPort())));
                break;
            }
            case OUTPUT_TO_OUTPUT: {
                ConnectionRoles roles = ConnectionRoles.from(item);
                report(kind, portOrDevice(roles.secondPort(), roles.secondDevice()), Messages.get("semantic.output.to.output",
                        dotted(roles.firstDevice(), roles.firstPort()), dotted(roles.secondDevice(), roles.secondPort())));
                break;
            }
            case INPUT_CONNECTED: {
                ConnectionRoles roles = ConnectionRoles.from(item);
                report(kind, portOrDevice(roles.secondPort(), roles.secondDevice()), Messages.get("semantic.input.connected",
                        dotted(roles.firstDevice(), roles.firstPort()), dotted(roles.secondDevice(), roles.secondPort())));
                break;
            }
            case PORT_ABSENT:
                reportAbsentPorts(kind, ConnectionRoles.from(item));
                break;
            case DEVICE_ABSENT:
                reportAbsentDevices(kind, item);
                break;
            case NOT_OUTPUT:
                report(kind, item.get(0), Messages.get("semantic.not.output"));
                break;
            case MONITOR_PRESENT:
                report(kind, item.get(0), Messages.get("semantic.monitor.present"));
                break;
            default:
                Symbol device = item.size() > 1 ? item.get(1) : item.get(0);
                report(kind, device, Messages.get("semantic.unexpected", text(device), kind));
                break;
        }
        return isFatal(kind);
    }

    /**
     * Reports every input left undriven after all connections were made.
     * Inputs are listed per device in creation order, pins sorted by name with numbered pins in numeric order.
     * @param at The symbol the diagnostic is anchored to; may be null.
     */
    public void reportUnconnectedInputs(Symbol at) {
        List<String> unconnected = new ArrayList<>();
        for (int deviceId : devices.findDevices()) {
            Optional<DeviceInfo> device = devices.getDevice(deviceId);
            if (device.isEmpty()) {
                continue;
            }
            device.get().inputs().stream()
                    .filter(inputId -> network.getConnectedOutput(deviceId, inputId).isEmpty())
                    .map(this::name)
                    .sorted(PIN_ORDER)
                    .map(pin -> name(deviceId) + "." + pin)
                    .forEach(unconnected::add);
        }
        String message = Messages.get("semantic.inputs.unconnected", String.join(", ", unconnected));
        errorCount++;
        record(true, "INPUTS_UNCONNECTED", at, message);
    }

    public int getErrorCount() {
        return errorCount;
    }

    public int getWarningCount() {
        return warningCount;
    }

    private void reportAbsentPorts(SemanticErrorKind kind, ConnectionRoles roles) {
        boolean reported = false;
        Optional<DeviceInfo> first = devices.getDevice(roles.firstDevice().id());
        if (first.isPresent() && !first.get().outputs().contains(roles.firstPortId())) {
            Symbol at = portOrDevice(roles.firstPort(), roles.firstDevice());
            String port = roles.firstPort() == null ? "" : text(roles.firstPort());
            report(kind, at, roles.firstPort() == null
                    ? Messages.get("semantic.port.missing.output", text(roles.firstDevice()))
                    : Messages.get("semantic.port.absent", port, text(roles.firstDevice())));
            reported = true;
        }
        if (roles.secondDevice() != null) {
            Optional<DeviceInfo> second = devices.getDevice(roles.secondDevice().id());
            if (second.isPresent() && !second.get().inputs().contains(roles.secondPortId())) {
                Symbol at = portOrDevice(roles.secondPort(), roles.secondDevice());
                report(kind, at, Messages.get("semantic.port.absent",
                        roles.secondPort() == null ? "" : text(roles.secondPort()), text(roles.secondDevice())));
                reported = true;
            }
        }
        if (!reported) {
            // The devices disagree with the network about the ports; blame the connection as a whole.
            report(kind, roles.firstDevice(), Messages.get("semantic.port.absent",
                    dotted(roles.secondDevice(), roles.secondPort()), text(roles.firstDevice())));
        }
    }

    private void reportAbsentDevices(SemanticErrorKind kind, ItemDescriptor item) {
        boolean monitorShaped = item.size() == 1
                || (item.size() == 3 && item.get(1).type() == SymbolType.DOT);
        if (monitorShaped) {
            report(kind, item.get(0), Messages.get("semantic.device.absent", text(item.get(0))));
            return;
        }
        ConnectionRoles roles = ConnectionRoles.from(item);
        boolean reported = false;
        for (Symbol device : new Symbol[]{roles.firstDevice(), roles.secondDevice()}) {
            if (device != null && devices.getDevice(device.id()).isEmpty()) {
                report(kind, device, Messages.get("semantic.device.absent", text(device)));
                reported = true;
            }
        }
        if (!reported) {
            report(kind, roles.firstDevice(), Messages.get("semantic.device.absent", text(roles.firstDevice())));
        }
    }

    private void report(SemanticErrorKind kind, Symbol at, String message) {
        boolean fatal = isFatal(kind);
        if (fatal) {
            errorCount++;
        } else {
            warningCount++;
        }
        record(fatal, kind.name(), at, message);
    }

    private void record(boolean error, String code, Symbol at, String message) {
        int line = at == null ? 0 : at.line();
        int column = at == null ? 0 : at.column();
        if (error) {
            diagnostics.reportError(code, message, scanner.getFileName(), line, column);
        } else {
            diagnostics.reportWarning(code, message, scanner.getFileName(), line, column);
        }
        if (!scanner.printError(at, 0, message)) {
            scanner.printMessage(message);
        }
    }

    private static String pinStem(String pin) {
        return pin.substring(0, pin.length() - digitSuffixLength(pin));
    }

    private static int pinNumber(String pin) {
        int digits = digitSuffixLength(pin);
        return digits == 0 ? 0 : Integer.parseInt(pin.substring(pin.length() - digits));
    }

    private static int digitSuffixLength(String pin) {
        int length = 0;
        while (length < pin.length() && Character.isDigit(pin.charAt(pin.length() - 1 - length))) {
            length++;
        }
        return length;
    }

    private static Symbol portOrDevice(Symbol port, Symbol device) {
        return port != null ? port : device;
    }

    private String dotted(Symbol device, Symbol port) {
        return port == null ? text(device) : text(device) + "." + text(port);
    }

    private String text(Symbol symbol) {
        return name(symbol.id());
    }

    private String name(int id) {
        return names.resolve(id).orElse("?");
    }
}
