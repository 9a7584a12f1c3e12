package com.phillippitts.hazardscan.service.cache;

/**
 * Point-in-time cache counters.
 */
public record CacheStats(long hits, long misses, long evictions, long coalescedWaits, int size) {}
