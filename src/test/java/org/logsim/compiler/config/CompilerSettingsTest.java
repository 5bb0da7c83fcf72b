package org.logsim.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.logsim.compiler.api.SemanticErrorKind;
import org.logsim.compiler.diagnostics.BufferedDiagnosticSink;
import org.logsim.compiler.diagnostics.ConsoleDiagnosticSink;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for reading {@link CompilerSettings} from HOCON on top of the bundled defaults.
 */
public class CompilerSettingsTest {

    private static CompilerSettings settings(String hocon) {
        Config config = ConfigFactory.parseString(hocon)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
        return CompilerSettings.from(config);
    }

    @Test
    @Tag("unit")
    void testDefaults() {
        CompilerSettings settings = settings("");

        assertThat(settings.sink()).isEqualTo(CompilerSettings.SinkMode.CONSOLE);
        assertThat(settings.lineNumberPrefix()).isTrue();
        assertThat(settings.warningKinds()).containsExactly(SemanticErrorKind.MONITOR_PRESENT);
        assertThat(settings.logLevel()).isEqualTo(2);
        assertThat(settings.locale()).isEqualTo(Locale.ROOT);
        assertThat(settings.createSink()).isInstanceOf(ConsoleDiagnosticSink.class);
    }

    @Test
    @Tag("unit")
    void testOverrides() {
        // Arrange
        String hocon = """
                logsim.compiler {
                  diagnostics { sink = buffer, line-prefix = false, locale = de }
                  semantics.warnings = [monitor_present, DEVICE_PRESENT]
                  log-level = 3
                }
                """;

        // Act
        CompilerSettings settings = settings(hocon);

        // Assert
        assertThat(settings.sink()).isEqualTo(CompilerSettings.SinkMode.BUFFER);
        assertThat(settings.lineNumberPrefix()).isFalse();
        assertThat(settings.warningKinds())
                .containsExactlyInAnyOrder(SemanticErrorKind.MONITOR_PRESENT, SemanticErrorKind.DEVICE_PRESENT);
        assertThat(settings.logLevel()).isEqualTo(3);
        assertThat(settings.locale()).isEqualTo(Locale.GERMAN);
        assertThat(settings.createSink()).isInstanceOf(BufferedDiagnosticSink.class);
    }

    @Test
    @Tag("unit")
    void testEmptyWarningListMakesEveryKindFatal() {
        CompilerSettings settings = settings("logsim.compiler.semantics.warnings = []");

        assertThat(settings.warningKinds()).isEmpty();
    }

    @Test
    @Tag("unit")
    void testUnknownSinkIsRejected() {
        assertThatThrownBy(() -> settings("logsim.compiler.diagnostics.sink = file"))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("diagnostics.sink");
    }

    @Test
    @Tag("unit")
    void testUnknownWarningKindIsRejected() {
        assertThatThrownBy(() -> settings("logsim.compiler.semantics.warnings = [NO_SUCH_KIND]"))
                .isInstanceOf(ConfigException.BadValue.class)
                .hasMessageContaining("NO_SUCH_KIND");
    }
}
