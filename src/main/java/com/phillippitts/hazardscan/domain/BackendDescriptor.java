package com.phillippitts.hazardscan.domain;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

/**
 * Declared contract of an inference backend.
 *
 * @param tier backend tier
 * @param accuracyClass declared accuracy, used to break ordering ties
 * @param costPerCall maximum monetary cost of one call (zero for on-device tiers)
 * @param maxLatency declared worst-case latency; also the per-attempt timeout
 * @param minMemoryMb memory the backend needs to run
 * @param needsNetwork whether the backend requires network reachability
 * @param needsAccelerator whether the backend requires a GPU/NPU context
 */
public record BackendDescriptor(
        BackendTier tier,
        AccuracyClass accuracyClass,
        BigDecimal costPerCall,
        Duration maxLatency,
        long minMemoryMb,
        boolean needsNetwork,
        boolean needsAccelerator
) {
    public BackendDescriptor {
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(accuracyClass, "accuracyClass");
        Objects.requireNonNull(costPerCall, "costPerCall");
        if (costPerCall.signum() < 0) {
            throw new IllegalArgumentException("costPerCall must be >= 0, got: " + costPerCall);
        }
        Objects.requireNonNull(maxLatency, "maxLatency");
        if (maxLatency.isNegative() || maxLatency.isZero()) {
            throw new IllegalArgumentException("maxLatency must be positive, got: " + maxLatency);
        }
        if (minMemoryMb < 0) {
            throw new IllegalArgumentException("minMemoryMb must be >= 0, got: " + minMemoryMb);
        }
    }

    public boolean isBillable() {
        return costPerCall.signum() > 0;
    }
}
