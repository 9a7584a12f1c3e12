package com.phillippitts.hazardscan.domain;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable outcome of a successful analysis, including the full provenance chain.
 *
 * @param hazards detected hazards
 * @param overallConfidence confidence of the accepted backend response
 * @param sourceTier tier that produced the returned response
 * @param totalCost sum of all committed attempt costs
 * @param totalLatency wall time of the whole fallback chain
 * @param provenance every attempt in invocation order
 * @param degraded true when no backend reached the confidence threshold and the best
 *                 low-confidence candidate was returned instead
 * @param notices advisory messages for the caller (e.g. manual review recommended)
 */
public record AnalysisResult(
        List<DetectedHazard> hazards,
        double overallConfidence,
        BackendTier sourceTier,
        BigDecimal totalCost,
        Duration totalLatency,
        List<AttemptRecord> provenance,
        boolean degraded,
        List<String> notices
) {
    public AnalysisResult {
        hazards = hazards == null ? List.of() : List.copyOf(hazards);
        if (overallConfidence < 0.0 || overallConfidence > 1.0) {
            throw new IllegalArgumentException("overallConfidence must be between 0.0 and 1.0, got: "
                    + overallConfidence);
        }
        Objects.requireNonNull(sourceTier, "sourceTier");
        Objects.requireNonNull(totalCost, "totalCost");
        Objects.requireNonNull(totalLatency, "totalLatency");
        provenance = provenance == null ? List.of() : List.copyOf(provenance);
        notices = notices == null ? List.of() : List.copyOf(notices);
    }

    /** Number of attempts made for the given tier. */
    public long attemptsFor(BackendTier tier) {
        return provenance.stream().filter(a -> a.tier() == tier).count();
    }
}
