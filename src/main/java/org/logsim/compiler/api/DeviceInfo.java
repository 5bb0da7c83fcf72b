package org.logsim.compiler.api;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Read-only view of a device as exposed by {@link IDevices#getDevice(int)}.
 *
 * @param deviceId The name id of the device.
 * @param typeId The name id of the device keyword, e.g. the id of "NAND".
 * @param inputs The name ids of the device's input pins.
 * @param outputs The name ids of the device's output pins; {@code null} stands for the
 *                single unnamed output of gates, switches, clocks and generators.
 */
public record DeviceInfo(int deviceId, int typeId, Set<Integer> inputs, Set<Integer> outputs) {

    public DeviceInfo {
        // HashSet rather than Set.copyOf: the unnamed output is a null element.
        inputs = Collections.unmodifiableSet(new HashSet<>(inputs));
        outputs = Collections.unmodifiableSet(new HashSet<>(outputs));
    }
}
