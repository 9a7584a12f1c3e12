package com.phillippitts.hazardscan.service.device;

import com.phillippitts.hazardscan.config.properties.DeviceProperties;
import com.phillippitts.hazardscan.domain.NetworkReachability;
import com.phillippitts.hazardscan.domain.ThermalLevel;

import java.util.Objects;

/**
 * Reports the static values from {@code hazardscan.device.*}. Installed when the host platform
 * provides no live signal source.
 */
public class ConfiguredDeviceSignalSource implements DeviceSignalSource {

    private final DeviceProperties props;

    public ConfiguredDeviceSignalSource(DeviceProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public ThermalLevel thermalLevel() {
        return props.getThermalLevel();
    }

    @Override
    public int batteryPercent() {
        return props.getBatteryPercent();
    }

    @Override
    public NetworkReachability network() {
        return props.getNetwork();
    }

    @Override
    public boolean acceleratorAvailable() {
        return props.isAcceleratorAvailable();
    }
}
