package com.phillippitts.hazardscan.domain;

/**
 * Kind of construction work shown in a captured photo.
 *
 * <p>Drives the per-work-type confidence threshold and whether a request is treated as
 * critical (cloud-first) by the strategy selector.
 */
public enum WorkType {
    GENERAL_CONSTRUCTION,
    ELECTRICAL,
    PLUMBING,
    ROOFING,
    SCAFFOLDING,
    EXCAVATION,
    CONCRETE,
    WELDING,
    PAINTING,
    DEMOLITION,
    FALL_PROTECTION,
    CRANE_OPERATIONS,
    STEEL_ERECTION,
    MAINTENANCE,
    LANDSCAPING
}
