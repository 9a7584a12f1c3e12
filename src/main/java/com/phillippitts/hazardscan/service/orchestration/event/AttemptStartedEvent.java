package com.phillippitts.hazardscan.service.orchestration.event;

import com.phillippitts.hazardscan.domain.BackendTier;

import java.time.Instant;

/**
 * Published when the fallback coordinator hands a request to a backend.
 */
public record AttemptStartedEvent(long requestId, int index, BackendTier tier, Instant at) {
    public AttemptStartedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
