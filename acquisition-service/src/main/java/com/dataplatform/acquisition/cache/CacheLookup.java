package com.dataplatform.acquisition.cache;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of a cache read.
 *
 * <p>{@code found && !fresh} only comes back from {@link CacheStore#getStale}; the regular
 * {@link CacheStore#get} reports expired entries as misses.
 */
public record CacheLookup(
    CacheEntry entry,
    JsonNode   value,
    boolean    found,
    boolean    fresh,
    boolean    needsRefresh
) {

    private static final CacheLookup MISS = new CacheLookup(null, null, false, false, false);

    public static CacheLookup miss() {
        return MISS;
    }

    public static CacheLookup hit(CacheEntry entry, JsonNode value, boolean fresh, boolean needsRefresh) {
        return new CacheLookup(entry, value, true, fresh, needsRefresh);
    }
}
