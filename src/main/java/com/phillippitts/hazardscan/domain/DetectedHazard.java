package com.phillippitts.hazardscan.domain;

import java.util.Objects;

/**
 * A single hazard found in an image.
 *
 * @param type hazard category
 * @param region where the hazard appears
 * @param confidence detector confidence 0.0 - 1.0
 * @param severity severity class
 */
public record DetectedHazard(
        HazardType type,
        BoundingBox region,
        double confidence,
        Severity severity
) {
    public DetectedHazard {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(region, "region");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        Objects.requireNonNull(severity, "severity");
    }
}
