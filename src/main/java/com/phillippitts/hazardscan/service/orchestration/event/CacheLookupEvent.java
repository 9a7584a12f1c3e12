package com.phillippitts.hazardscan.service.orchestration.event;

import com.phillippitts.hazardscan.domain.CacheKey;
import com.phillippitts.hazardscan.service.cache.CacheOutcome;

import java.time.Instant;

/**
 * Published for every result cache lookup.
 */
public record CacheLookupEvent(CacheKey key, CacheOutcome outcome, Instant at) {
    public CacheLookupEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
