package org.logsim.compiler.api;

import org.logsim.compiler.frontend.names.NameTable;

import java.nio.file.Path;

/**
 * The public interface for the circuit definition compiler.
 * It defines the contract for turning a definition file into a built network.
 */
public interface IDefinitionCompiler {

    /**
     * Compiles a definition file into the given collaborators.
     *
     * @param file     The definition file.
     * @param names    The name table shared with the collaborators.
     * @param devices  The device store to build into.
     * @param network  The connection graph to build into.
     * @param monitors The monitors to build into.
     * @return The warnings and rendered messages of an accepted file.
     * @throws CompilationException if the file cannot be read, has syntax errors or a fatal semantic error.
     */
    CompilationResult compile(Path file, NameTable names, IDevices devices, INetwork network, IMonitors monitors)
            throws CompilationException;
}
