package org.logsim.compiler.frontend.parser;

/**
 * Unwinds the parser when the symbol stream runs out. The error itself is reported before it is thrown.
 */
class PrematureEndOfFileException extends RuntimeException {

    PrematureEndOfFileException(String fileName) {
        super("Unexpected end of file " + fileName, null, false, false);
    }
}
