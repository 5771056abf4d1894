package com.dataplatform.acquisition.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-node durable tier. Lost on restart, which is acceptable for a cache.
 */
public final class InMemoryDurableTier implements DurableCacheTier {

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Duration stalenessCeiling;

    public InMemoryDurableTier(Duration stalenessCeiling) {
        this.stalenessCeiling = stalenessCeiling;
    }

    @Override
    public Optional<CacheEntry> read(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void write(CacheEntry entry) {
        entries.put(entry.key(), entry);
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public int sweepExpired(Instant now) {
        Instant cutoff = now.minus(stalenessCeiling);
        int before = entries.size();
        entries.values().removeIf(e -> e.fetchedAt().isBefore(cutoff));
        return Math.max(0, before - entries.size());
    }

    @Override
    public long size() {
        return entries.size();
    }
}
