package com.phillippitts.hazardscan.service.device;

import com.phillippitts.hazardscan.domain.NetworkReachability;
import com.phillippitts.hazardscan.domain.ThermalLevel;

/**
 * Platform-provided device signals the JVM cannot observe itself.
 */
public interface DeviceSignalSource {

    ThermalLevel thermalLevel();

    int batteryPercent();

    NetworkReachability network();

    boolean acceleratorAvailable();
}
