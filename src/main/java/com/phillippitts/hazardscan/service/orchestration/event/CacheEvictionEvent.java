package com.phillippitts.hazardscan.service.orchestration.event;

import com.phillippitts.hazardscan.domain.CacheKey;

import java.time.Instant;

/**
 * Published when an entry leaves the result cache.
 */
public record CacheEvictionEvent(CacheKey key, Reason reason, Instant at) {

    public enum Reason { CAPACITY, EXPIRED, INVALIDATED }

    public CacheEvictionEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
