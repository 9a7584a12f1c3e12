package com.phillippitts.hazardscan.service.orchestration.event;

import com.phillippitts.hazardscan.domain.BudgetState;

import java.time.Instant;

/**
 * Published after every budget mutation (reserve, commit, release, rollover).
 */
public record BudgetStateChangedEvent(BudgetState state, String change, Instant at) {
    public BudgetStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
