package com.phillippitts.hazardscan.domain;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

/**
 * One entry of a provenance chain.
 *
 * @param index zero-based invocation order within the request
 * @param tier backend tier attempted
 * @param outcome terminal state of the attempt
 * @param latency wall time from start to terminal state
 * @param confidence confidence reported by the backend (0 when it produced nothing)
 * @param cost amount committed to the budget for this attempt
 * @param errorDetail failure description, or null
 */
public record AttemptRecord(
        int index,
        BackendTier tier,
        AttemptOutcome outcome,
        Duration latency,
        double confidence,
        BigDecimal cost,
        String errorDetail
) {
    public AttemptRecord {
        Objects.requireNonNull(tier, "tier");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(latency, "latency");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        cost = cost == null ? BigDecimal.ZERO : cost;
    }
}
