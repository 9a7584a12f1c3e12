package com.phillippitts.hazardscan.service.cache;

/**
 * How a cache lookup was resolved.
 */
public enum CacheOutcome {
    /** A live entry was returned; no computation ran. */
    HIT,
    /** No entry; this caller started the computation. */
    MISS,
    /** An entry existed but its TTL had elapsed; treated as a miss. */
    EXPIRED,
    /** Another caller's computation for the same key was joined. */
    COALESCED
}
