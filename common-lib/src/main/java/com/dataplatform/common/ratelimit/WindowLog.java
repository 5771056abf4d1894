package com.dataplatform.common.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Exact sliding-window log: at most {@code capacity} admissions in any half-open window
 * of length {@code window}. Runs in series with the matching {@link TokenBucket}, which on
 * its own may admit a full bucket plus a window's worth of refill inside one window.
 */
final class WindowLog implements AdmissionBucket {

    private final String name;
    private final int capacity;
    private final long windowNanos;
    private final Deque<Instant> admitted = new ArrayDeque<>();

    WindowLog(String name, int capacity, Duration window) {
        this.name        = name;
        this.capacity    = capacity;
        this.windowNanos = window.toNanos();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public long shortfallNanos(Instant now) {
        prune(now);
        if (admitted.size() < capacity) {
            return 0L;
        }
        Instant oldest = admitted.peekFirst();
        long leavesWindowIn = windowNanos - Duration.between(oldest, now).toNanos();
        return Math.max(1L, leavesWindowIn);
    }

    @Override
    public void consume(Instant now) {
        admitted.addLast(now);
    }

    @Override
    public double available() {
        return Math.max(0, capacity - admitted.size());
    }

    @Override
    public int capacity() {
        return capacity;
    }

    private void prune(Instant now) {
        while (!admitted.isEmpty()
                && Duration.between(admitted.peekFirst(), now).toNanos() >= windowNanos) {
            admitted.pollFirst();
        }
    }
}
