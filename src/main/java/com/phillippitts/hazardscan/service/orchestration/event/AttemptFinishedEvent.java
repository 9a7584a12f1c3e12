package com.phillippitts.hazardscan.service.orchestration.event;

import com.phillippitts.hazardscan.domain.AttemptRecord;

import java.time.Instant;

/**
 * Published when a backend attempt reaches a terminal state.
 */
public record AttemptFinishedEvent(long requestId, AttemptRecord attempt, Instant at) {
    public AttemptFinishedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
