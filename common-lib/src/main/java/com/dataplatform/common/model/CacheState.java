package com.dataplatform.common.model;

/**
 * How the returned value relates to the cache.
 */
public enum CacheState {
    /** Served from cache within its TTL. */
    FRESH,
    /** Served from cache past its TTL because no live provider could answer. */
    STALE,
    /** Fetched from a provider during this call and written back to the cache. */
    REFRESHED
}
