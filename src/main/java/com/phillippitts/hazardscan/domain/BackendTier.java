package com.phillippitts.hazardscan.domain;

/**
 * Place of a backend in the accuracy/cost/resource spectrum.
 *
 * <p>Declaration order is the tier rank (cloud highest, emergency lowest).
 */
public enum BackendTier {
    CLOUD("cloud"),
    LOCAL_LARGE("local-large"),
    LOCAL_SMALL("local-small"),
    EMERGENCY("emergency");

    private final String label;

    BackendTier(String label) {
        this.label = label;
    }

    /** Lower-case name used in logs, metric tags and configuration keys. */
    public String label() {
        return label;
    }

    public boolean isLocal() {
        return this == LOCAL_LARGE || this == LOCAL_SMALL;
    }
}
