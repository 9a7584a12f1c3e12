package com.phillippitts.hazardscan.domain;

/** Device thermal pressure, ordered from coolest to hottest. */
public enum ThermalLevel {
    NOMINAL,
    FAIR,
    SERIOUS,
    CRITICAL;

    /**
     * @param other level to compare against
     * @return true if this level is the same as or hotter than {@code other}
     */
    public boolean isAtLeast(ThermalLevel other) {
        return compareTo(other) >= 0;
    }
}
