package com.phillippitts.hazardscan.exception;

import com.phillippitts.hazardscan.domain.BackendTier;

/**
 * Thrown when a single backend attempt fails. Absorbed by the fallback coordinator.
 */
public class BackendException extends HazardScanException {

    private final BackendTier tier;

    public BackendException(String message, BackendTier tier) {
        super(message + " (tier: " + tier.label() + ")");
        this.tier = tier;
    }

    public BackendException(String message, BackendTier tier, Throwable cause) {
        super(message + " (tier: " + tier.label() + ")", cause);
        this.tier = tier;
    }

    public BackendTier getTier() {
        return tier;
    }
}
