package com.dataplatform.acquisition.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * JSON shape of a {@link CacheEntry} in Redis. Jackson writes {@code payload} as base64.
 */
record DurableRecord(
    String  key,
    byte[]  payload,
    boolean compressed,
    String  sourceId,
    Instant fetchedAt,
    long    ttlSeconds,
    double  qualityScore,
    double  refreshThreshold
) {

    static DurableRecord from(CacheEntry e) {
        return new DurableRecord(e.key(), e.payload(), e.compressed(), e.sourceId(), e.fetchedAt(),
                                 e.ttl().toSeconds(), e.qualityScore(), e.refreshThreshold());
    }

    CacheEntry toEntry() {
        return new CacheEntry(key, payload, compressed, sourceId, fetchedAt,
                              Duration.ofSeconds(ttlSeconds), qualityScore, refreshThreshold);
    }
}
