package com.phillippitts.hazardscan.service.backend;

import com.phillippitts.hazardscan.domain.DetectedHazard;

import java.math.BigDecimal;
import java.util.List;

/**
 * Raw answer from one backend call, before acceptance is decided.
 *
 * @param hazards detected hazards (may be empty)
 * @param confidence overall confidence in [0.0, 1.0]
 * @param meteredCost cost reported by the backend, or {@code null} to charge the declared cost
 * @param notices advisory notices to surface with the result
 */
public record BackendResponse(List<DetectedHazard> hazards,
                              double confidence,
                              BigDecimal meteredCost,
                              List<String> notices) {

    public BackendResponse {
        hazards = hazards == null ? List.of() : List.copyOf(hazards);
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        if (meteredCost != null && meteredCost.signum() < 0) {
            throw new IllegalArgumentException("meteredCost must be >= 0, got: " + meteredCost);
        }
        notices = notices == null ? List.of() : List.copyOf(notices);
    }

    public static BackendResponse of(List<DetectedHazard> hazards, double confidence) {
        return new BackendResponse(hazards, confidence, null, List.of());
    }
}
