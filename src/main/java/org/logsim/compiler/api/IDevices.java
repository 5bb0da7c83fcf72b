package org.logsim.compiler.api;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The device store of the simulator, as consumed by the parser's build phase.
 */
public interface IDevices {

    /**
     * Creates a device.
     * @param nameId The name id of the device.
     * @param typeId The name id of the device keyword.
     * @param property The property text (clock period, switch state, fan-in, waveform), or null.
     * @return A result code; codes absent from {@link #semanticErrorCodes()} mean success.
     */
    int makeDevice(int nameId, int typeId, String property);

    /**
     * @return The ids of all devices, in creation order.
     */
    List<Integer> findDevices();

    /**
     * @param typeId The name id of a device keyword.
     * @return The ids of all devices of that type, in creation order.
     */
    List<Integer> findDevices(int typeId);

    /**
     * @param deviceId The name id of the device.
     * @return The device, or empty if there is no such device.
     */
    Optional<DeviceInfo> getDevice(int deviceId);

    /**
     * Puts every device into a random-but-valid initial state.
     */
    void coldStartup();

    /**
     * @return The codes this store returns for each failure it can report.
     */
    Map<SemanticErrorKind, Integer> semanticErrorCodes();
}
