package com.dataplatform.common.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Finite daily budget that resets at a fixed wall-clock instant (e.g. 00:00 US/Eastern).
 *
 * <p>Counter based, no continuous refill: a provider with 500 calls per day that spent
 * them all at 23:59 gets all 500 back at the reset instant, not a trickle.
 */
final class DailyCapBucket implements AdmissionBucket {

    private final String name;
    private final int cap;
    private final LocalTime resetTime;
    private final ZoneId zone;

    private int used;
    private Instant nextReset;

    DailyCapBucket(String name, int cap, LocalTime resetTime, ZoneId zone, Instant start) {
        this.name      = name;
        this.cap       = cap;
        this.resetTime = resetTime;
        this.zone      = zone;
        this.nextReset = nextResetAfter(start);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public long shortfallNanos(Instant now) {
        rollOver(now);
        if (used < cap) {
            return 0L;
        }
        return Math.max(1L, Duration.between(now, nextReset).toNanos());
    }

    @Override
    public void consume(Instant now) {
        used++;
    }

    @Override
    public double available() {
        return cap - used;
    }

    @Override
    public int capacity() {
        return cap;
    }

    private void rollOver(Instant now) {
        if (!now.isBefore(nextReset)) {
            used      = 0;
            nextReset = nextResetAfter(now);
        }
    }

    private Instant nextResetAfter(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        ZonedDateTime candidate = local.toLocalDate().atTime(resetTime).atZone(zone);
        if (!candidate.isAfter(local)) {
            candidate = local.toLocalDate().plusDays(1).atTime(resetTime).atZone(zone);
        }
        return candidate.toInstant();
    }
}
