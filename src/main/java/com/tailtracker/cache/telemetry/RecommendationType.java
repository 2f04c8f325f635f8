package com.tailtracker.cache.telemetry;

public enum RecommendationType {
    CACHE_SIZE,
    EVICTION_POLICY,
    PREFETCH_STRATEGY,
    COMPRESSION,
    TTL_ADJUSTMENT
}
