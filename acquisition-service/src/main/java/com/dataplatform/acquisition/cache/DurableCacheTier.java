package com.dataplatform.acquisition.cache;

import java.time.Instant;
import java.util.Optional;

/**
 * Second cache tier. Keeps entries until the staleness ceiling so that a degraded read can
 * still answer after the fast tier has let go of a value.
 *
 * <p>Implementations may throw on I/O failure; {@link CacheStore} logs and treats that as a miss.
 */
public interface DurableCacheTier {

    Optional<CacheEntry> read(String key);

    void write(CacheEntry entry);

    void delete(String key);

    /**
     * Removes entries whose {@code fetchedAt} is older than the staleness ceiling.
     *
     * @return number of entries removed
     */
    int sweepExpired(Instant now);

    /** Number of retained entries, or {@code -1} when the backend does not track it cheaply. */
    long size();
}
