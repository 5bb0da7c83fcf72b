package org.logsim.compiler.api;

import java.util.Map;
import java.util.Optional;

/**
 * The connection graph of the simulator, as consumed by the parser's build phase.
 */
public interface INetwork {

    /**
     * Connects two ports. Either side may name an output or an input; the network works out the direction.
     * @param firstDeviceId The name id of the first device.
     * @param firstPortId The name id of the first port, or null for the unnamed output.
     * @param secondDeviceId The name id of the second device.
     * @param secondPortId The name id of the second port, or null.
     * @return A result code; codes absent from {@link #semanticErrorCodes()} mean success.
     */
    int makeConnection(int firstDeviceId, Integer firstPortId, int secondDeviceId, Integer secondPortId);

    /**
     * @return true if every input of every device is driven.
     */
    boolean checkNetwork();

    /**
     * @param deviceId The name id of the device.
     * @param inputId The name id of the input pin.
     * @return The output driving the input, or empty if it is undriven.
     */
    Optional<OutputRef> getConnectedOutput(int deviceId, int inputId);

    /**
     * Runs one simulation cycle.
     * @return false if the network oscillates.
     */
    boolean executeNetwork();

    /**
     * @return The codes this network returns for each failure it can report.
     */
    Map<SemanticErrorKind, Integer> semanticErrorCodes();
}
