package com.phillippitts.hazardscan.domain;

/**
 * Terminal state of one backend attempt.
 *
 * <p>{@link #TIMED_OUT} drives control flow exactly like {@link #FAILED} but is kept distinct in
 * provenance. {@link #CANCELLED} is only recorded when the caller abandons the request mid-attempt.
 */
public enum AttemptOutcome {
    ACCEPTED,
    LOW_CONFIDENCE,
    FAILED,
    TIMED_OUT,
    CANCELLED;

    /** True for outcomes where the backend produced a usable response. */
    public boolean producedResult() {
        return this == ACCEPTED || this == LOW_CONFIDENCE;
    }
}
