package com.dataplatform.common.ratelimit;

import java.time.Instant;

/**
 * One admission rule in a provider's chain. All buckets of a provider are evaluated
 * under that provider's lock: every bucket is asked for its {@link #shortfall} first and
 * only when all of them admit is {@link #consume} called on each, so a denial from one
 * bucket never spends permits in another.
 *
 * <p>Implementations are not thread-safe on their own.
 */
interface AdmissionBucket {

    String name();

    /**
     * Brings the bucket up to {@code now} and reports how long until one permit is available.
     *
     * @return zero nanos when a permit is available now, otherwise a positive wait
     */
    long shortfallNanos(Instant now);

    /** Spends one permit. Only called right after {@link #shortfallNanos} returned zero. */
    void consume(Instant now);

    /** Permits currently available, for health snapshots. */
    double available();

    int capacity();
}
