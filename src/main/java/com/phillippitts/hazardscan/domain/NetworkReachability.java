package com.phillippitts.hazardscan.domain;

/** Network reachability as reported by the platform. */
public enum NetworkReachability {
    NONE,
    METERED,
    UNMETERED;

    public boolean isReachable() {
        return this != NONE;
    }
}
