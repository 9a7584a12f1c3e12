package com.phillippitts.hazardscan.service.device;

import com.phillippitts.hazardscan.domain.DeviceState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Default profiler: available memory comes from the JVM {@link Runtime} (free heap plus heap not
 * yet committed, minus a reserved share for the host), everything else from a
 * {@link DeviceSignalSource}.
 */
public class RuntimeDeviceCapabilityProfiler implements DeviceCapabilityProfiler {
    private static final Logger LOG = LogManager.getLogger(RuntimeDeviceCapabilityProfiler.class);

    private static final long MB = 1024L * 1024L;

    private final DeviceSignalSource signals;
    private final LongSupplier availableBytes;
    private final long reservedMemoryMb;

    public RuntimeDeviceCapabilityProfiler(DeviceSignalSource signals, long reservedMemoryMb) {
        this(signals, RuntimeDeviceCapabilityProfiler::availableHeapBytes, reservedMemoryMb);
    }

    RuntimeDeviceCapabilityProfiler(DeviceSignalSource signals, LongSupplier availableBytes, long reservedMemoryMb) {
        this.signals = Objects.requireNonNull(signals, "signals");
        this.availableBytes = Objects.requireNonNull(availableBytes, "availableBytes");
        this.reservedMemoryMb = Math.max(0, reservedMemoryMb);
    }

    @Override
    public DeviceState currentState() {
        long availableMb = Math.max(0, availableBytes.getAsLong() / MB - reservedMemoryMb);
        DeviceState state = new DeviceState(
                availableMb,
                signals.thermalLevel(),
                signals.batteryPercent(),
                signals.network(),
                signals.acceleratorAvailable());
        LOG.debug("Device state: {}", state);
        return state;
    }

    static long availableHeapBytes() {
        Runtime rt = Runtime.getRuntime();
        long used = rt.totalMemory() - rt.freeMemory();
        return rt.maxMemory() - used;
    }
}
