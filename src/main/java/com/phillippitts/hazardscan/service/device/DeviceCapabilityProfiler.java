package com.phillippitts.hazardscan.service.device;

import com.phillippitts.hazardscan.domain.DeviceState;

/**
 * Samples the device's current capabilities. Implementations must not cache across calls:
 * every orchestration decides on a fresh sample.
 */
@FunctionalInterface
public interface DeviceCapabilityProfiler {

    DeviceState currentState();
}
