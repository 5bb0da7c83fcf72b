package org.logsim.compiler.frontend.semantics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.logsim.compiler.api.DeviceInfo;
import org.logsim.compiler.api.IDevices;
import org.logsim.compiler.api.IMonitors;
import org.logsim.compiler.api.INetwork;
import org.logsim.compiler.api.OutputRef;
import org.logsim.compiler.api.SemanticErrorKind;
import org.logsim.compiler.diagnostics.BufferedDiagnosticSink;
import org.logsim.compiler.diagnostics.Diagnostic;
import org.logsim.compiler.diagnostics.DiagnosticsEngine;
import org.logsim.compiler.frontend.lexer.Scanner;
import org.logsim.compiler.frontend.names.NameTable;
import org.logsim.compiler.frontend.parser.ItemDescriptor;
import org.logsim.compiler.internal.i18n.Messages;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Contains unit tests for the {@link SemanticErrorHandler}: the code table, the fatal/warning split
 * and where each kind of failure is reported. Collaborators are Mockito mocks.
 */
public class SemanticErrorHandlerTest {

    private static final int DEVICE_PRESENT = 1;
    private static final int BAD_DEVICE = 2;
    private static final int INPUT_TO_INPUT = 10;
    private static final int OUTPUT_TO_OUTPUT = 11;
    private static final int PORT_ABSENT = 12;
    private static final int DEVICE_ABSENT = 13;
    private static final int INPUT_CONNECTED = 14;
    private static final int NOT_OUTPUT = 20;
    private static final int MONITOR_PRESENT = 21;
    private static final int SUCCESS = 99;

    private final NameTable names = new NameTable();
    private final BufferedDiagnosticSink sink = new BufferedDiagnosticSink();
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private IDevices devices;
    private INetwork network;
    private IMonitors monitors;
    private Scanner scanner;

    @BeforeEach
    void setUp() {
        devices = mock(IDevices.class);
        network = mock(INetwork.class);
        monitors = mock(IMonitors.class);
        when(devices.semanticErrorCodes()).thenReturn(Map.of(
                SemanticErrorKind.DEVICE_PRESENT, DEVICE_PRESENT,
                SemanticErrorKind.BAD_DEVICE, BAD_DEVICE));
        when(network.semanticErrorCodes()).thenReturn(Map.of(
                SemanticErrorKind.INPUT_TO_INPUT, INPUT_TO_INPUT,
                SemanticErrorKind.OUTPUT_TO_OUTPUT, OUTPUT_TO_OUTPUT,
                SemanticErrorKind.PORT_ABSENT, PORT_ABSENT,
                SemanticErrorKind.DEVICE_ABSENT, DEVICE_ABSENT,
                SemanticErrorKind.INPUT_CONNECTED, INPUT_CONNECTED));
        // The same code for the same kind from two collaborators is fine.
        when(monitors.semanticErrorCodes()).thenReturn(Map.of(
                SemanticErrorKind.NOT_OUTPUT, NOT_OUTPUT,
                SemanticErrorKind.MONITOR_PRESENT, MONITOR_PRESENT,
                SemanticErrorKind.DEVICE_ABSENT, DEVICE_ABSENT));
    }

    private SemanticErrorHandler handler(String source) {
        return handler(source, SemanticErrorHandler.DEFAULT_WARNINGS);
    }

    private SemanticErrorHandler handler(String source, Set<SemanticErrorKind> warnings) {
        scanner = new Scanner(source, "test.def", names, sink, true);
        return new SemanticErrorHandler(names, devices, network, monitors, scanner, diagnostics, warnings);
    }

    private ItemDescriptor item() {
        return ItemDescriptor.of(scanner.getAllSymbols());
    }

    private int id(String name) {
        return names.query(name).orElseThrow();
    }

    @Test
    @Tag("unit")
    void testClassifiesCodesFromAllCollaborators() {
        SemanticErrorHandler handler = handler("a");

        assertThat(handler.classify(DEVICE_PRESENT)).contains(SemanticErrorKind.DEVICE_PRESENT);
        assertThat(handler.classify(INPUT_CONNECTED)).contains(SemanticErrorKind.INPUT_CONNECTED);
        assertThat(handler.classify(MONITOR_PRESENT)).contains(SemanticErrorKind.MONITOR_PRESENT);
        assertThat(handler.classify(SUCCESS)).isEmpty();
        assertThat(handler.isFatal(SemanticErrorKind.DEVICE_PRESENT)).isTrue();
        assertThat(handler.isFatal(SemanticErrorKind.MONITOR_PRESENT)).isFalse();
    }

    @Test
    @Tag("unit")
    void testUnknownCodeMeansSuccess() {
        SemanticErrorHandler handler = handler("a");

        boolean fatal = handler.handle(SUCCESS, item());

        assertThat(fatal).isFalse();
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(sink.contents()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testConflictingCodesAreRejected() {
        when(network.semanticErrorCodes()).thenReturn(Map.of(SemanticErrorKind.INPUT_TO_INPUT, DEVICE_PRESENT));

        assertThatThrownBy(() -> handler("a"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(String.valueOf(DEVICE_PRESENT));
    }

    @Test
    @Tag("unit")
    void testInputToInputIsReportedAtFirstDevice() {
        SemanticErrorHandler handler = handler("a.Q > b.I1");

        boolean fatal = handler.handle(INPUT_TO_INPUT, item());

        assertThat(fatal).isTrue();
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::code, Diagnostic::message, Diagnostic::columnNumber)
                .containsExactly("INPUT_TO_INPUT", Messages.get("semantic.input.to.input", "a.Q", "b.I1"), 1);
    }

    @Test
    @Tag("unit")
    void testOutputToOutputIsReportedAtSecondPort() {
        SemanticErrorHandler handler = handler("a.Q > b.I1");

        handler.handle(OUTPUT_TO_OUTPUT, item());

        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::columnNumber).isEqualTo(9);
        assertThat(sink.contents()).isEqualTo(Messages.get("semantic.output.to.output", "a.Q", "b.I1") + "\n"
                + "Line 1: a.Q > b.I1\n"
                + " ".repeat(16) + "^\n");
    }

    /**
     * Both ends of a connection are checked on their own, so two missing ports give two diagnostics.
     */
    @Test
    @Tag("unit")
    void testPortAbsentReportsEachMissingSide() {
        // Arrange
        SemanticErrorHandler handler = handler("a.Q > b.I1");
        when(devices.getDevice(id("a"))).thenReturn(Optional.of(
                new DeviceInfo(id("a"), 0, Set.of(), Set.of(names.intern("QBAR")))));
        when(devices.getDevice(id("b"))).thenReturn(Optional.of(
                new DeviceInfo(id("b"), 0, Set.of(names.intern("I2")), Set.of())));

        // Act
        boolean fatal = handler.handle(PORT_ABSENT, item());

        // Assert
        assertThat(fatal).isTrue();
        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::message, Diagnostic::columnNumber)
                .containsExactly(
                        tuple(Messages.get("semantic.port.absent", "Q", "a"), 3),
                        tuple(Messages.get("semantic.port.absent", "I1", "b"), 9));
        assertThat(handler.getErrorCount()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void testDeviceAbsentInConnectionReportsMissingSide() {
        SemanticErrorHandler handler = handler("a > b.I1");
        when(devices.getDevice(id("a"))).thenReturn(Optional.of(new DeviceInfo(id("a"), 0, Set.of(), Set.of())));

        handler.handle(DEVICE_ABSENT, item());

        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::message, Diagnostic::columnNumber)
                .containsExactly(Messages.get("semantic.device.absent", "b"), 5);
    }

    @Test
    @Tag("unit")
    void testDeviceAbsentInMonitorReportsDevice() {
        SemanticErrorHandler handler = handler("ghost.Q");

        handler.handle(DEVICE_ABSENT, item());

        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::message, Diagnostic::columnNumber)
                .containsExactly(Messages.get("semantic.device.absent", "ghost"), 1);
    }

    @Test
    @Tag("unit")
    void testNotOutputIsReportedAtTarget() {
        SemanticErrorHandler handler = handler("  d1");

        boolean fatal = handler.handle(NOT_OUTPUT, item());

        assertThat(fatal).isTrue();
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::code, Diagnostic::columnNumber).containsExactly("NOT_OUTPUT", 3);
    }

    @Test
    @Tag("unit")
    void testDeviceFactoryFailureIsReportedAtDeviceName() {
        SemanticErrorHandler handler = handler("NAND g1 2");

        handler.handle(BAD_DEVICE, item());

        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::message, Diagnostic::columnNumber)
                .containsExactly(Messages.get("semantic.unexpected", "g1", SemanticErrorKind.BAD_DEVICE), 6);
    }

    @Test
    @Tag("unit")
    void testWarningKindsAreConfigurable() {
        SemanticErrorHandler handler = handler("SWITCH abc 0", EnumSet.of(SemanticErrorKind.DEVICE_PRESENT));

        boolean devicePresentFatal = handler.handle(DEVICE_PRESENT, item());
        boolean monitorPresentFatal = handler.handle(MONITOR_PRESENT, item());

        assertThat(devicePresentFatal).isFalse();
        assertThat(monitorPresentFatal).isTrue();
        assertThat(diagnostics.getDiagnostics()).extracting(Diagnostic::type)
                .containsExactly(Diagnostic.Type.WARNING, Diagnostic.Type.ERROR);
        assertThat(handler.getWarningCount()).isEqualTo(1);
        assertThat(handler.getErrorCount()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void testUnconnectedInputsWithoutLocationArePrintedPlain() {
        // Arrange
        SemanticErrorHandler handler = handler("a");
        int a = id("a");
        int i1 = names.intern("I1");
        int i2 = names.intern("I2");
        when(devices.findDevices()).thenReturn(List.of(a));
        when(devices.getDevice(a)).thenReturn(Optional.of(new DeviceInfo(a, 0, Set.of(i2, i1), Set.of())));
        when(network.getConnectedOutput(a, i1)).thenReturn(Optional.of(new OutputRef(a, null)));

        // Act
        handler.reportUnconnectedInputs(null);

        // Assert
        String expected = Messages.get("semantic.inputs.unconnected", "a.I2");
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::code, Diagnostic::message, Diagnostic::lineNumber)
                .containsExactly("INPUTS_UNCONNECTED", expected, 0);
        assertThat(sink.contents()).isEqualTo(expected + "\n");
    }

    @Test
    @Tag("unit")
    void testUnconnectedPinsAreListedInNumericOrder() {
        // Arrange
        SemanticErrorHandler handler = handler("g");
        int g = id("g");
        Set<Integer> inputs = Set.of(names.intern("I10"), names.intern("I2"), names.intern("I1"));
        when(devices.findDevices()).thenReturn(List.of(g));
        when(devices.getDevice(g)).thenReturn(Optional.of(new DeviceInfo(g, 0, inputs, Set.of())));

        // Act
        handler.reportUnconnectedInputs(null);

        // Assert
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo(Messages.get("semantic.inputs.unconnected", "g.I1, g.I2, g.I10"));
    }
}
