package org.logsim.compiler;

import org.logsim.compiler.api.CompilationException;
import org.logsim.compiler.api.CompilationResult;
import org.logsim.compiler.api.IDefinitionCompiler;
import org.logsim.compiler.api.IDevices;
import org.logsim.compiler.api.IMonitors;
import org.logsim.compiler.api.INetwork;
import org.logsim.compiler.config.CompilerSettings;
import org.logsim.compiler.diagnostics.CompilerLogger;
import org.logsim.compiler.diagnostics.DiagnosticsEngine;
import org.logsim.compiler.frontend.lexer.Scanner;
import org.logsim.compiler.frontend.names.NameTable;
import org.logsim.compiler.frontend.parser.Parser;
import org.logsim.compiler.internal.i18n.Messages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * The main compiler implementation. This class runs scanner, parser and network builder
 * over one definition file. It is not thread-safe; each call uses a fresh scanner and parser.
 */
public class DefinitionCompiler implements IDefinitionCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(DefinitionCompiler.class);

    private final CompilerSettings settings;

    /**
     * Creates a compiler configured from the usual configuration sources.
     */
    public DefinitionCompiler() {
        this(CompilerSettings.load());
    }

    /**
     * @param settings The compiler settings.
     */
    public DefinitionCompiler(CompilerSettings settings) {
        this.settings = settings;
    }

    @Override
    public CompilationResult compile(Path file, NameTable names, IDevices devices, INetwork network, IMonitors monitors)
            throws CompilationException {
        CompilerLogger.setLevel(settings.logLevel());
        Messages.setLocale(settings.locale());
        LOG.debug("Compiling {}", file);

        Scanner scanner;
        try {
            scanner = new Scanner(file, names, settings.createSink(), settings.lineNumberPrefix());
        } catch (UncheckedIOException e) {
            throw new CompilationException("Cannot read definition file " + file, e.getCause());
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Parser parser = new Parser(names, devices, network, monitors, scanner, diagnostics, settings.warningKinds());
        if (!parser.parseNetwork()) {
            LOG.debug("Rejected {} with {} diagnostics", file, diagnostics.getDiagnostics().size());
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }
        return new CompilationResult(diagnostics.getDiagnostics(), scanner.getErrorMessages());
    }
}
