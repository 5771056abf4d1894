package com.dataplatform.acquisition.cache;

import com.dataplatform.acquisition.config.AcquisitionProperties;
import com.dataplatform.common.model.DataType;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * Two-tier cache of acquired values.
 *
 * <p><strong>Fast tier:</strong> bounded Caffeine cache whose per-entry expiry follows the
 * entry's own TTL, measured on the injected {@link Clock}. Writes go through
 * {@code asMap().compute} so concurrent writers of one key are serialised.
 *
 * <p><strong>Durable tier:</strong> keeps every entry until the staleness ceiling, which is
 * what {@link #getStale} answers from once the fast tier has expired a value. Durable tier
 * failures are logged and read as misses; a cache problem never fails an acquisition.
 *
 * <p>Expected conditions (miss, expiry, full refresh queue) are reported through return
 * values, never exceptions.
 */
public class CacheStore {

    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    private final AcquisitionProperties.Cache settings;
    private final Clock clock;
    private final DurableCacheTier durable;
    private final PayloadCodec codec;
    private final AnomalyDetector anomalyDetector;
    private final BackgroundRefresher refresher;
    private final Cache<String, CacheEntry> fast;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder staleServes = new LongAdder();

    public CacheStore(AcquisitionProperties.Cache settings,
                      Clock clock,
                      DurableCacheTier durable,
                      PayloadCodec codec,
                      AnomalyDetector anomalyDetector,
                      BackgroundRefresher refresher) {
        this.settings = settings;
        this.clock = clock;
        this.durable = durable;
        this.codec = codec;
        this.anomalyDetector = anomalyDetector;
        this.refresher = refresher;
        this.fast = Caffeine.newBuilder()
            .maximumSize(settings.getFastTierMaxSize())
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .expireAfter(new TtlExpiry())
            .recordStats()
            .build();
    }

    // ── reads ────────────────────────────────────────────────────────────────

    /** Fresh lookup. Expired entries read as a miss. */
    public CacheLookup get(String key) {
        Instant now = clock.instant();
        CacheEntry entry = fast.getIfPresent(key);
        if (entry == null) {
            entry = readDurable(key).orElse(null);
            if (entry != null && entry.isFresh(now)) {
                promote(entry);
            }
        }
        if (entry == null || !entry.isFresh(now)) {
            misses.increment();
            log.debug("CACHE_MISS key={}", key);
            return CacheLookup.miss();
        }
        JsonNode value = decode(entry);
        if (value == null) {
            misses.increment();
            return CacheLookup.miss();
        }
        hits.increment();
        boolean needsRefresh = entry.needsBackgroundRefresh(now);
        log.debug("CACHE_HIT key={} source={} ageMs={} needsRefresh={}",
                  key, entry.sourceId(), entry.age(now).toMillis(), needsRefresh);
        return CacheLookup.hit(entry, value, true, needsRefresh);
    }

    /**
     * Degraded read: returns whatever is retained for the key, fresh or not, up to the
     * staleness ceiling.
     */
    public CacheLookup getStale(String key) {
        Optional<CacheLookup> lookup = peek(key);
        if (lookup.isEmpty()) {
            log.info("CACHE_STALE_MISS key={}", key);
            return CacheLookup.miss();
        }
        if (!lookup.get().fresh()) {
            staleServes.increment();
            log.warn("CACHE_STALE_SERVE key={} source={} ageSeconds={}", key,
                     lookup.get().entry().sourceId(),
                     lookup.get().entry().age(clock.instant()).toSeconds());
        }
        return lookup.get();
    }

    /** Looks at the retained entry without touching hit/miss statistics. */
    public Optional<CacheLookup> peek(String key) {
        Instant now = clock.instant();
        CacheEntry entry = fast.getIfPresent(key);
        if (entry == null) {
            entry = readDurable(key).orElse(null);
        }
        if (entry == null || entry.age(now).compareTo(settings.getStalenessCeiling()) > 0) {
            return Optional.empty();
        }
        JsonNode value = decode(entry);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(CacheLookup.hit(entry, value, entry.isFresh(now), false));
    }

    // ── writes ───────────────────────────────────────────────────────────────

    /**
     * Stores a value fetched now. The stored quality may be lower than the one supplied
     * when the value looks anomalous against the key's recent history.
     */
    public CacheEntry set(String key, JsonNode value, String sourceId, Duration ttl, double qualityScore) {
        PayloadCodec.Encoded encoded = codec.encode(value);
        Instant fetchedAt = clock.instant();
        CacheEntry stored = fast.asMap().compute(key, (k, previous) -> {
            double quality = clamp(anomalyDetector.assess(k, value, clamp(qualityScore)));
            return new CacheEntry(k, encoded.bytes(), encoded.compressed(), sourceId, fetchedAt,
                                  ttl, quality, settings.getRefreshThreshold());
        });
        try {
            durable.write(stored);
        } catch (RuntimeException e) {
            log.warn("CACHE_DURABLE_WRITE_FAILED key={} error={}", key, e.getMessage());
        }
        log.info("CACHE_SET key={} source={} ttlSeconds={} quality={} bytes={} compressed={}",
                 key, sourceId, ttl.toSeconds(), stored.qualityScore(),
                 stored.payload().length, stored.compressed());
        return stored;
    }

    public void invalidate(String key) {
        fast.invalidate(key);
        try {
            durable.delete(key);
        } catch (RuntimeException e) {
            log.warn("CACHE_DURABLE_DELETE_FAILED key={} error={}", key, e.getMessage());
        }
        log.info("CACHE_INVALIDATED key={}", key);
    }

    // ── refresh-ahead and maintenance ────────────────────────────────────────

    /**
     * @return {@code true} if a refresh task was enqueued, {@code false} if one is already
     *         pending for the key or the refresh queue is full
     */
    public boolean scheduleBackgroundRefresh(String key, Supplier<? extends Mono<?>> refreshFn) {
        return refresher.schedule(key, refreshFn);
    }

    /** Drops durable entries past the staleness ceiling. */
    public int sweep() {
        fast.cleanUp();
        int removed;
        try {
            removed = durable.sweepExpired(clock.instant());
        } catch (RuntimeException e) {
            log.warn("CACHE_SWEEP_FAILED error={}", e.getMessage());
            return 0;
        }
        log.info("CACHE_SWEEP removed={} fastTierSize={}", removed, fast.estimatedSize());
        return removed;
    }

    public Duration ttlFor(DataType dataType) {
        return settings.ttlFor(dataType);
    }

    public CacheHealth health() {
        long h = hits.sum();
        long m = misses.sum();
        double hitRate = h + m == 0 ? 0.0 : (double) h / (h + m);
        long durableSize;
        try {
            durableSize = durable.size();
        } catch (RuntimeException e) {
            log.warn("CACHE_DURABLE_SIZE_FAILED error={}", e.getMessage());
            durableSize = -1;
        }
        return new CacheHealth(h, m, hitRate, staleServes.sum(), fast.estimatedSize(),
                               durableSize, refresher.pendingCount());
    }

    @PreDestroy
    public void shutdown() {
        log.info("CACHE_SHUTDOWN pendingRefreshes={}", refresher.pendingCount());
        refresher.shutdown();
    }

    // ── internals ────────────────────────────────────────────────────────────

    private Optional<CacheEntry> readDurable(String key) {
        try {
            return durable.read(key);
        } catch (RuntimeException e) {
            log.warn("CACHE_DURABLE_READ_FAILED key={} error={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void promote(CacheEntry entry) {
        fast.asMap().merge(entry.key(), entry,
            (current, candidate) -> current.fetchedAt().isAfter(candidate.fetchedAt()) ? current : candidate);
    }

    private JsonNode decode(CacheEntry entry) {
        try {
            return codec.decode(entry.payload(), entry.compressed());
        } catch (RuntimeException e) {
            log.warn("CACHE_CORRUPT_ENTRY key={} error={}", entry.key(), e.getMessage());
            invalidate(entry.key());
            return null;
        }
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    /** Fast-tier expiry equals the time left on the entry's TTL. */
    private final class TtlExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(CacheEntry entry) {
            long remaining = Duration.between(clock.instant(), entry.expiresAt()).toNanos();
            return Math.max(0L, remaining);
        }
    }
}
