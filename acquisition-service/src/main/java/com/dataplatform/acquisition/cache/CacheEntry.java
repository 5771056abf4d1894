package com.dataplatform.acquisition.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * One cached value as stored in both tiers. The payload is the JSON encoding of the
 * value, gzip-compressed when it crossed the compression threshold at write time.
 *
 * @param refreshThreshold fraction of the TTL after which a read schedules a background refresh
 */
public record CacheEntry(
    String   key,
    byte[]   payload,
    boolean  compressed,
    String   sourceId,
    Instant  fetchedAt,
    Duration ttl,
    double   qualityScore,
    double   refreshThreshold
) {

    public Instant expiresAt() {
        return fetchedAt.plus(ttl);
    }

    public Duration age(Instant now) {
        Duration age = Duration.between(fetchedAt, now);
        return age.isNegative() ? Duration.ZERO : age;
    }

    public boolean isFresh(Instant now) {
        return age(now).compareTo(ttl) < 0;
    }

    /** Fresh, but past {@code refreshThreshold × ttl}. */
    public boolean needsBackgroundRefresh(Instant now) {
        if (!isFresh(now)) {
            return false;
        }
        long thresholdNanos = (long) (ttl.toNanos() * refreshThreshold);
        return age(now).toNanos() > thresholdNanos;
    }

    /** Same entry, also fresh with respect to a caller's maximum acceptable staleness. */
    public boolean satisfies(Instant now, Duration maxStaleness) {
        return isFresh(now) && (maxStaleness == null || age(now).compareTo(maxStaleness) <= 0);
    }

    @Override
    public String toString() {
        return "CacheEntry[key=" + key + ", source=" + sourceId + ", fetchedAt=" + fetchedAt
            + ", ttl=" + ttl + ", quality=" + qualityScore + ", bytes=" + payload.length
            + ", compressed=" + compressed + "]";
    }
}
