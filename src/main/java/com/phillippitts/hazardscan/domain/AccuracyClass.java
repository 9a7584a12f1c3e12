package com.phillippitts.hazardscan.domain;

/** Declared accuracy of a backend, ordered from lowest to highest. */
public enum AccuracyClass {
    BASIC,
    STANDARD,
    HIGH,
    PREMIUM
}
