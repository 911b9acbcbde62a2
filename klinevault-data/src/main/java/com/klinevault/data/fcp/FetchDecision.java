package com.klinevault.data.fcp;

/**
 * What to do for one partition.
 */
public enum FetchDecision {
    /** Serve the cached entry, no network call. */
    USE_CACHE,
    /** Cached entry exists but is too old (or a refresh was asked for); refetch, keep it as a fallback. */
    CACHE_STALE,
    /** Nothing usable cached; fetch from the preferred backend. */
    FETCH_FRESH,
    /** The preferred backend's circuit is open; go straight to the other one. */
    FAILOVER
}
