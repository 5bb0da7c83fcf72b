package org.logsim.compiler.api;

/**
 * Identifies a device output.
 *
 * @param deviceId The name id of the device.
 * @param portId The name id of the output pin, or null for the unnamed output.
 */
public record OutputRef(int deviceId, Integer portId) {
}
