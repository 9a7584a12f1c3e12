package com.phillippitts.hazardscan.config.properties;

import com.phillippitts.hazardscan.domain.NetworkReachability;
import com.phillippitts.hazardscan.domain.ThermalLevel;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Static device signals reported when no platform signal source is installed.
 */
@ConfigurationProperties(prefix = "hazardscan.device")
@Validated
public class DeviceProperties {

    @NotNull
    private ThermalLevel thermalLevel = ThermalLevel.NOMINAL;

    @Min(0)
    @Max(100)
    private int batteryPercent = 100;

    @NotNull
    private NetworkReachability network = NetworkReachability.UNMETERED;

    private boolean acceleratorAvailable = false;

    /** Memory reserved for the host application, subtracted from the JVM's free heap. */
    @Min(0)
    private long reservedMemoryMb = 0;

    public ThermalLevel getThermalLevel() {
        return thermalLevel;
    }

    public void setThermalLevel(ThermalLevel thermalLevel) {
        this.thermalLevel = thermalLevel;
    }

    public int getBatteryPercent() {
        return batteryPercent;
    }

    public void setBatteryPercent(int batteryPercent) {
        this.batteryPercent = batteryPercent;
    }

    public NetworkReachability getNetwork() {
        return network;
    }

    public void setNetwork(NetworkReachability network) {
        this.network = network;
    }

    public boolean isAcceleratorAvailable() {
        return acceleratorAvailable;
    }

    public void setAcceleratorAvailable(boolean acceleratorAvailable) {
        this.acceleratorAvailable = acceleratorAvailable;
    }

    public long getReservedMemoryMb() {
        return reservedMemoryMb;
    }

    public void setReservedMemoryMb(long reservedMemoryMb) {
        this.reservedMemoryMb = reservedMemoryMb;
    }
}
