package org.logsim.compiler.api;

/**
 * The closed set of semantic failures a collaborator can signal while the network is built.
 * <p>
 * Collaborators mint their own integer result codes (see
 * {@link org.logsim.compiler.frontend.names.NameTable#allocate(int)}) and publish which code
 * means which kind through {@code semanticErrorCodes()}.
 */
public enum SemanticErrorKind {
    /** A device property of the wrong shape reached the device factory. */
    INVALID_QUALIFIER(true),
    /** A device that needs a property was created without one. */
    NO_QUALIFIER(true),
    /** The device type is unknown to the device factory. */
    BAD_DEVICE(true),
    /** A property was given to a device type that takes none. */
    QUALIFIER_PRESENT(true),
    /** The device name is already taken. */
    DEVICE_PRESENT(true),
    /** Both ends of a connection are inputs. */
    INPUT_TO_INPUT(true),
    /** Both ends of a connection are outputs. */
    OUTPUT_TO_OUTPUT(true),
    /** The target input is already driven by another output. */
    INPUT_CONNECTED(true),
    /** A named port does not exist on its device. */
    PORT_ABSENT(true),
    /** A referenced device does not exist. */
    DEVICE_ABSENT(true),
    /** A monitor was placed on something that is not an output. */
    NOT_OUTPUT(true),
    /** The output is already monitored. */
    MONITOR_PRESENT(false);

    private final boolean fatalByDefault;

    SemanticErrorKind(boolean fatalByDefault) {
        this.fatalByDefault = fatalByDefault;
    }

    /**
     * @return true if this kind stops the build phase it occurs in unless configured otherwise.
     */
    public boolean isFatalByDefault() {
        return fatalByDefault;
    }
}
