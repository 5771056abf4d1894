package com.dataplatform.common.ratelimit;

import com.dataplatform.common.model.ProviderDescriptor;
import com.dataplatform.common.model.RateLimitSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-provider admission control.
 *
 * <p>Each provider owns an ordered chain of buckets evaluated in series:
 * <ol>
 *   <li>{@code primary}: token bucket, {@code requests} per {@code window}</li>
 *   <li>{@code primary-window}: exact log enforcing the same budget over any window</li>
 *   <li>{@code burst} / {@code burst-window}: shorter-window protection, when configured</li>
 *   <li>{@code daily-cap}: fixed daily budget resetting at a wall-clock instant, when configured</li>
 * </ol>
 * A request is admitted only if every bucket admits it.
 *
 * <p>Each chain is guarded by its own {@link ReentrantLock}; unrelated providers never
 * contend. {@link #tryAcquire} never throws and never blocks beyond that lock. Unknown
 * provider ids are admitted: no configured budget means no limit.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final Clock clock;
    private final ConcurrentHashMap<String, ProviderChain> chains = new ConcurrentHashMap<>();

    public RateLimiter(Clock clock) {
        this.clock = clock;
    }

    public RateLimiter(Clock clock, Collection<ProviderDescriptor> providers) {
        this(clock);
        providers.forEach(p -> register(p.id(), p.rateLimit()));
    }

    /** Installs (or replaces) the budget for a provider. Replacing resets its buckets. */
    public void register(String providerId, RateLimitSpec spec) {
        chains.put(providerId, new ProviderChain(providerId, spec, clock.instant()));
        log.info("RATE_LIMIT_REGISTERED provider={} requests={} windowSeconds={} burst={} dailyCap={}",
                 providerId, spec.requests(), spec.window().toSeconds(),
                 spec.hasBurstBucket() ? spec.burst() : "off",
                 spec.hasDailyCap() ? spec.dailyCap() : "off");
    }

    public AdmissionResult tryAcquire(String providerId) {
        ProviderChain chain = chains.get(providerId);
        if (chain == null) {
            log.warn("RATE_LIMIT_UNKNOWN_PROVIDER provider={} (admitting, no budget configured)", providerId);
            return AdmissionResult.grant();
        }
        AdmissionResult result = chain.tryAcquire(clock.instant());
        if (!result.granted()) {
            log.info("RATE_LIMIT_DENIED provider={} bucket={} retryAfterMs={}",
                     providerId, result.deniedBy(), result.retryAfter().toMillis());
        }
        return result;
    }

    /** Current bucket levels per provider, keyed and ordered by provider id. */
    public Map<String, List<BucketSnapshot>> snapshot() {
        Instant now = clock.instant();
        Map<String, List<BucketSnapshot>> out = new TreeMap<>();
        chains.forEach((id, chain) -> out.put(id, chain.snapshot(now)));
        return out;
    }

    // ── per-provider chain ───────────────────────────────────────────────────

    private static final class ProviderChain {

        private final String providerId;
        private final List<AdmissionBucket> buckets = new ArrayList<>();
        private final ReentrantLock lock = new ReentrantLock();

        ProviderChain(String providerId, RateLimitSpec spec, Instant start) {
            this.providerId = providerId;
            buckets.add(new TokenBucket("primary", spec.requests(), spec.window(), start));
            buckets.add(new WindowLog("primary-window", spec.requests(), spec.window()));
            if (spec.hasBurstBucket()) {
                buckets.add(new TokenBucket("burst", spec.burst(), spec.burstWindow(), start));
                buckets.add(new WindowLog("burst-window", spec.burst(), spec.burstWindow()));
            }
            if (spec.hasDailyCap()) {
                buckets.add(new DailyCapBucket("daily-cap", spec.dailyCap(),
                                               spec.dailyResetTime(), spec.zone(), start));
            }
        }

        AdmissionResult tryAcquire(Instant now) {
            lock.lock();
            try {
                long worstWait = 0L;
                String deniedBy = null;
                for (AdmissionBucket bucket : buckets) {
                    long wait = bucket.shortfallNanos(now);
                    if (wait > worstWait) {
                        worstWait = wait;
                        deniedBy  = bucket.name();
                    }
                }
                if (worstWait > 0L) {
                    return AdmissionResult.deny(Duration.ofNanos(worstWait), deniedBy);
                }
                for (AdmissionBucket bucket : buckets) {
                    bucket.consume(now);
                }
                return AdmissionResult.grant();
            } finally {
                lock.unlock();
            }
        }

        List<BucketSnapshot> snapshot(Instant now) {
            lock.lock();
            try {
                List<BucketSnapshot> out = new ArrayList<>(buckets.size());
                for (AdmissionBucket bucket : buckets) {
                    bucket.shortfallNanos(now);
                    out.add(new BucketSnapshot(bucket.name(), bucket.available(), bucket.capacity()));
                }
                return out;
            } finally {
                lock.unlock();
            }
        }

        @Override
        public String toString() {
            return "ProviderChain[" + providerId + ", buckets=" + buckets.size() + "]";
        }
    }
}
