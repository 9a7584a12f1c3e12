package com.phillippitts.hazardscan.exception;

import com.phillippitts.hazardscan.domain.BackendTier;

/**
 * Thrown when an on-device model artifact does not match its pinned digest.
 * The affected tier is disabled for the rest of the process lifetime.
 */
public class ModelIntegrityViolationException extends HazardScanException {

    private final BackendTier tier;
    private final String modelPath;

    public ModelIntegrityViolationException(BackendTier tier, String modelPath, String detail) {
        super("Model integrity violation for " + tier.label() + " at " + modelPath + ": " + detail);
        this.tier = tier;
        this.modelPath = modelPath;
    }

    public ModelIntegrityViolationException(BackendTier tier, String modelPath, String detail, Throwable cause) {
        super("Model integrity violation for " + tier.label() + " at " + modelPath + ": " + detail, cause);
        this.tier = tier;
        this.modelPath = modelPath;
    }

    public BackendTier getTier() {
        return tier;
    }

    public String getModelPath() {
        return modelPath;
    }
}
