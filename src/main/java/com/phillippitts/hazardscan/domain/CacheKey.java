package com.phillippitts.hazardscan.domain;

import java.util.Objects;

/** Result cache key: same pixels + same resize policy + same work type. */
public record CacheKey(String fingerprint, WorkType workType) {
    public CacheKey {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(workType, "workType");
    }

    @Override
    public String toString() {
        return fingerprint.substring(0, Math.min(12, fingerprint.length())) + "/" + workType;
    }
}
