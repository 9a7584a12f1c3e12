package com.phillippitts.hazardscan.domain;

/** Hazard categories reported by detectors. */
public enum HazardType {
    FALL_PROTECTION,
    PPE_VIOLATION,
    ELECTRICAL,
    MECHANICAL,
    CHEMICAL,
    FIRE,
    CRANE_LIFT,
    HOUSEKEEPING,
    STRUCK_BY,
    CAUGHT_IN,
    EXCAVATION,
    POOR_VISIBILITY,
    UNKNOWN
}
