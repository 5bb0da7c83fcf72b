package org.logsim.compiler.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link DiagnosticsEngine} and the sinks.
 */
public class DiagnosticsEngineTest {

    @Test
    @Tag("unit")
    void testCountsErrorsAndWarnings() {
        // Arrange
        DiagnosticsEngine engine = new DiagnosticsEngine();

        // Act
        engine.reportWarning("MONITOR_PRESENT", "Monitor exists", "a.def", 3, 7);
        engine.reportError("SYNTAX_22", "Premature end of file", "a.def", 4, 1);

        // Assert
        assertThat(engine.hasErrors()).isTrue();
        assertThat(engine.errorCount()).isEqualTo(1);
        assertThat(engine.warningCount()).isEqualTo(1);
        assertThat(engine.summary()).isEqualTo(
                "[WARNING] a.def:3:7: Monitor exists\n[ERROR] a.def:4:1: Premature end of file");
    }

    @Test
    @Tag("unit")
    void testWarningsAloneAreNotErrors() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportWarning("MONITOR_PRESENT", "Monitor exists", "a.def", 3, 7);

        assertThat(engine.hasErrors()).isFalse();
    }

    @Test
    @Tag("unit")
    void testDiagnosticListIsReadOnly() {
        DiagnosticsEngine engine = new DiagnosticsEngine();
        engine.reportError("SYNTAX_1", "x", "a.def", 1, 1);

        assertThatThrownBy(() -> engine.getDiagnostics().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @Tag("unit")
    void testBufferedSinkClears() {
        BufferedDiagnosticSink sink = new BufferedDiagnosticSink();
        sink.write("one\n");
        sink.write("two\n");
        assertThat(sink.contents()).isEqualTo("one\ntwo\n");

        sink.clear();

        assertThat(sink.contents()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testLoggerLevelIsClamped() {
        int before = CompilerLogger.getLevel();
        try {
            CompilerLogger.setLevel(9);
            assertThat(CompilerLogger.getLevel()).isEqualTo(CompilerLogger.TRACE);
            CompilerLogger.setLevel(-1);
            assertThat(CompilerLogger.getLevel()).isEqualTo(CompilerLogger.ERROR);
        } finally {
            CompilerLogger.setLevel(before);
        }
    }
}
