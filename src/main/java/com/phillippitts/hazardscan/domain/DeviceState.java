package com.phillippitts.hazardscan.domain;

import java.util.Objects;

/**
 * Snapshot of device resources taken at the start of one orchestration call.
 *
 * <p>Never cached across calls: thermal and battery conditions drift during a session.
 *
 * @param availableMemoryMb memory the inference runtime may still use, in megabytes
 * @param thermalLevel current thermal pressure
 * @param batteryPercent battery charge 0-100
 * @param network network reachability
 * @param acceleratorAvailable whether a GPU/NPU execution context is present
 */
public record DeviceState(
        long availableMemoryMb,
        ThermalLevel thermalLevel,
        int batteryPercent,
        NetworkReachability network,
        boolean acceleratorAvailable
) {
    public DeviceState {
        if (availableMemoryMb < 0) {
            throw new IllegalArgumentException("availableMemoryMb must be >= 0, got: " + availableMemoryMb);
        }
        Objects.requireNonNull(thermalLevel, "thermalLevel");
        if (batteryPercent < 0 || batteryPercent > 100) {
            throw new IllegalArgumentException("batteryPercent must be between 0 and 100, got: " + batteryPercent);
        }
        Objects.requireNonNull(network, "network");
    }
}
