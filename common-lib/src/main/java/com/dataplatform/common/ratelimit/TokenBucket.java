package com.dataplatform.common.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Continuously refilling token bucket. Needs no timer: each check refills by
 * {@code elapsed * refillRate}, capped at capacity. A clock that steps backwards
 * refills nothing and leaves {@code lastRefill} untouched.
 */
final class TokenBucket implements AdmissionBucket {

    private final String name;
    private final int capacity;
    private final double refillPerNano;

    private double tokens;
    private Instant lastRefill;

    TokenBucket(String name, int capacity, Duration window, Instant start) {
        this.name          = name;
        this.capacity      = capacity;
        this.refillPerNano = capacity / (double) window.toNanos();
        this.tokens        = capacity;
        this.lastRefill    = start;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public long shortfallNanos(Instant now) {
        refill(now);
        if (tokens >= 1.0) {
            return 0L;
        }
        return Math.max(1L, (long) Math.ceil((1.0 - tokens) / refillPerNano));
    }

    @Override
    public void consume(Instant now) {
        tokens -= 1.0;
    }

    @Override
    public double available() {
        return tokens;
    }

    @Override
    public int capacity() {
        return capacity;
    }

    private void refill(Instant now) {
        long elapsed = Duration.between(lastRefill, now).toNanos();
        if (elapsed <= 0) {
            return;
        }
        tokens     = Math.min(capacity, tokens + elapsed * refillPerNano);
        lastRefill = now;
    }
}
