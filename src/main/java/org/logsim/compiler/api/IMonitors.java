package org.logsim.compiler.api;

import java.util.List;
import java.util.Map;

/**
 * The signal monitors of the simulator, as consumed by the parser's build phase.
 */
public interface IMonitors {

    /**
     * Starts monitoring an output.
     * @param deviceId The name id of the device.
     * @param portId The name id of the output pin, or null for the unnamed output.
     * @return A result code; codes absent from {@link #semanticErrorCodes()} mean success.
     */
    int makeMonitor(int deviceId, Integer portId);

    /**
     * @param deviceId The name id of the device.
     * @param portId The name id of the output pin, or null.
     * @return true if a monitor was removed.
     */
    boolean removeMonitor(int deviceId, Integer portId);

    /**
     * Clears the recorded signal history of every monitor.
     */
    void resetMonitors();

    /**
     * Appends the current value of every monitored output to its history.
     */
    void recordSignals();

    /**
     * @return The recorded signal history per monitored output.
     */
    Map<OutputRef, List<Integer>> getMonitorsDictionary();

    /**
     * @return The codes the monitors return for each failure they can report.
     */
    Map<SemanticErrorKind, Integer> semanticErrorCodes();
}
