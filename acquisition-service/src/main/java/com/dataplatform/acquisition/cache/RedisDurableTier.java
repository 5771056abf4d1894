package com.dataplatform.acquisition.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Shared durable tier on Redis. Records live under {@code <prefix><key>} and expire after
 * the staleness ceiling, so Redis does the sweeping.
 */
public final class RedisDurableTier implements DurableCacheTier {

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final String prefix;
    private final Duration stalenessCeiling;

    public RedisDurableTier(StringRedisTemplate redis, ObjectMapper objectMapper,
                            String prefix, Duration stalenessCeiling) {
        if (redis == null) {
            throw new IllegalArgumentException("redis must not be null");
        }
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.prefix = prefix == null ? "" : prefix;
        this.stalenessCeiling = stalenessCeiling;
    }

    private String k(String key) {
        return prefix + key;
    }

    @Override
    public Optional<CacheEntry> read(String key) {
        String json = redis.opsForValue().get(k(key));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, DurableRecord.class).toEntry());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable durable record for key " + key, e);
        }
    }

    @Override
    public void write(CacheEntry entry) {
        String json;
        try {
            json = objectMapper.writeValueAsString(DurableRecord.from(entry));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise durable record for key " + entry.key(), e);
        }
        redis.opsForValue().set(k(entry.key()), json, stalenessCeiling.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void delete(String key) {
        redis.delete(k(key));
    }

    @Override
    public int sweepExpired(Instant now) {
        return 0;
    }

    @Override
    public long size() {
        return -1;
    }
}
