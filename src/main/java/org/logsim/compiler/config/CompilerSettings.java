package org.logsim.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.logsim.compiler.api.SemanticErrorKind;
import org.logsim.compiler.diagnostics.BufferedDiagnosticSink;
import org.logsim.compiler.diagnostics.ConsoleDiagnosticSink;
import org.logsim.compiler.diagnostics.DiagnosticSink;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Typed view of the {@code logsim.compiler} configuration block.
 *
 * @param sink Where rendered diagnostics go.
 * @param lineNumberPrefix Whether echoed source lines start with {@code "Line N: "}.
 * @param warningKinds The semantic failure kinds that are warnings instead of errors.
 * @param logLevel The {@link org.logsim.compiler.diagnostics.CompilerLogger} verbosity, 0 to 4.
 * @param locale The locale of the diagnostic texts; {@link Locale#ROOT} for the base texts.
 */
public record CompilerSettings(SinkMode sink, boolean lineNumberPrefix, Set<SemanticErrorKind> warningKinds, int logLevel,
                               Locale locale) {

    /** Configuration path of the whole block. */
    public static final String ROOT = "logsim.compiler";

    /**
     * The diagnostic sinks selectable by configuration.
     */
    public enum SinkMode {
        /** Write to standard output as diagnostics occur. */
        CONSOLE,
        /** Keep everything in memory for {@code Scanner#getErrorMessages()}. */
        BUFFER
    }

    public CompilerSettings {
        warningKinds = warningKinds.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(warningKinds));
    }

    /**
     * Reads the settings from a resolved configuration.
     * @param config A configuration containing the {@value #ROOT} block.
     * @return The settings.
     * @throws ConfigException.BadValue if the sink or a warning kind is unknown.
     */
    public static CompilerSettings from(Config config) {
        Config block = config.getConfig(ROOT);
        String sinkName = block.getString("diagnostics.sink");
        SinkMode sink;
        try {
            sink = SinkMode.valueOf(sinkName.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(ROOT + ".diagnostics.sink", "unknown sink '" + sinkName + "'", e);
        }
        Set<SemanticErrorKind> warnings = EnumSet.noneOf(SemanticErrorKind.class);
        for (String kind : block.getStringList("semantics.warnings")) {
            try {
                warnings.add(SemanticErrorKind.valueOf(kind.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(ROOT + ".semantics.warnings", "unknown kind '" + kind + "'", e);
            }
        }
        Locale locale = Locale.forLanguageTag(block.getString("diagnostics.locale"));
        return new CompilerSettings(sink, block.getBoolean("diagnostics.line-prefix"), warnings, block.getInt("log-level"),
                locale);
    }

    /**
     * @return The settings from the usual configuration sources.
     */
    public static CompilerSettings load() {
        return from(ConfigLoader.load());
    }

    /**
     * @return A new sink of the configured kind.
     */
    public DiagnosticSink createSink() {
        return sink == SinkMode.BUFFER ? new BufferedDiagnosticSink() : new ConsoleDiagnosticSink();
    }
}
