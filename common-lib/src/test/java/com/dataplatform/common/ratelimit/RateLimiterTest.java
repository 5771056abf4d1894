package com.dataplatform.common.ratelimit;

import com.dataplatform.common.model.RateLimitSpec;
import com.dataplatform.common.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    private static final Instant T0 = Instant.parse("2024-03-04T15:00:00Z");

    private MutableClock clock;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        limiter = new RateLimiter(clock);
    }

    private int grantedOf(int calls, String provider) {
        int granted = 0;
        for (int i = 0; i < calls; i++) {
            if (limiter.tryAcquire(provider).granted()) granted++;
        }
        return granted;
    }

    @Nested
    @DisplayName("rapid bursts")
    class RapidCalls {

        @Test
        @DisplayName("requests=5/10s burst=2: burst bucket caps rapid admission, denials carry retryAfter")
        void burstBucketCapsRapidCalls() {
            limiter.register("p", RateLimitSpec.of(5, Duration.ofSeconds(10), 2));

            List<AdmissionResult> results = new ArrayList<>();
            for (int i = 0; i < 7; i++) {
                results.add(limiter.tryAcquire("p"));
            }

            long granted = results.stream().filter(AdmissionResult::granted).count();
            assertEquals(2, granted);
            assertTrue(results.get(0).granted());
            assertTrue(results.get(1).granted());
            results.stream().filter(r -> !r.granted()).forEach(r -> {
                assertTrue(r.retryAfter().compareTo(Duration.ZERO) > 0);
                assertNotNull(r.deniedBy());
            });
        }

        @Test
        @DisplayName("requests=5/10s without burst: first 5 granted, remaining 2 denied")
        void primaryBudgetOnly() {
            limiter.register("p", RateLimitSpec.of(5, Duration.ofSeconds(10), 0));

            List<AdmissionResult> results = new ArrayList<>();
            for (int i = 0; i < 7; i++) {
                results.add(limiter.tryAcquire("p"));
            }

            for (int i = 0; i < 5; i++) assertTrue(results.get(i).granted(), "call " + i);
            for (int i = 5; i < 7; i++) {
                assertFalse(results.get(i).granted(), "call " + i);
                assertTrue(results.get(i).retryAfter().toMillis() > 0);
            }
        }

        @Test
        @DisplayName("burst >= requests disables the burst bucket")
        void burstNotBelowRequestsIsIgnored() {
            limiter.register("p", RateLimitSpec.of(3, Duration.ofSeconds(10), 3));
            assertEquals(3, grantedOf(10, "p"));
            assertEquals(2, limiter.snapshot().get("p").size());
        }
    }

    @Nested
    @DisplayName("window bound")
    class WindowBound {

        @Test
        @DisplayName("never more than `requests` grants in any window, for a randomised call pattern")
        void slidingWindowNeverExceeded() {
            limiter.register("p", RateLimitSpec.of(5, Duration.ofSeconds(10), 0));
            Random random = new Random(42);
            List<Instant> grants = new ArrayList<>();

            for (int i = 0; i < 2_000; i++) {
                clock.advance(Duration.ofMillis(random.nextInt(1_500)));
                if (limiter.tryAcquire("p").granted()) {
                    grants.add(clock.instant());
                }
            }

            for (int i = 0; i < grants.size(); i++) {
                Instant windowEnd = grants.get(i).plus(Duration.ofSeconds(10));
                int inWindow = 0;
                for (int j = i; j < grants.size() && grants.get(j).isBefore(windowEnd); j++) {
                    inWindow++;
                }
                assertTrue(inWindow <= 5, "window starting at " + grants.get(i) + " admitted " + inWindow);
            }
            assertFalse(grants.isEmpty());
        }

        @Test
        @DisplayName("full budget returns once the window has passed")
        void budgetReturnsAfterWindow() {
            limiter.register("p", RateLimitSpec.of(5, Duration.ofSeconds(10), 0));
            assertEquals(5, grantedOf(5, "p"));
            AdmissionResult denied = limiter.tryAcquire("p");
            assertFalse(denied.granted());

            clock.advance(denied.retryAfter());
            assertTrue(limiter.tryAcquire("p").granted());

            clock.advance(Duration.ofSeconds(10));
            assertEquals(5, grantedOf(7, "p"));
        }

        @Test
        @DisplayName("clock stepping backwards adds no tokens")
        void backwardsClockAddsNothing() {
            limiter.register("p", RateLimitSpec.of(2, Duration.ofSeconds(10), 0));
            assertEquals(2, grantedOf(2, "p"));
            clock.set(T0.minus(Duration.ofMinutes(5)));
            assertFalse(limiter.tryAcquire("p").granted());
        }

        @Test
        @DisplayName("concurrent callers never over-admit")
        void concurrentCallersRespectBudget() throws InterruptedException {
            limiter.register("p", RateLimitSpec.of(50, Duration.ofMinutes(1), 0));
            AtomicInteger granted = new AtomicInteger();
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            for (int i = 0; i < 400; i++) {
                pool.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    if (limiter.tryAcquire("p").granted()) granted.incrementAndGet();
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
            assertEquals(50, granted.get());
        }
    }

    @Nested
    @DisplayName("daily cap")
    class DailyCap {

        private final ZoneId newYork = ZoneId.of("America/New_York");

        @Test
        @DisplayName("cap exhausted → denied until the reset instant, then the full cap returns")
        void resetsAtWallClockInstant() {
            clock.set(ZonedDateTime.of(2024, 3, 4, 23, 50, 0, 0, newYork).toInstant());
            limiter.register("p", RateLimitSpec.of(100, Duration.ofMinutes(1), 0)
                .withDailyCap(3, LocalTime.MIDNIGHT, newYork));

            assertEquals(3, grantedOf(3, "p"));
            AdmissionResult denied = limiter.tryAcquire("p");
            assertFalse(denied.granted());
            assertEquals("daily-cap", denied.deniedBy());
            assertEquals(Duration.ofMinutes(10), denied.retryAfter());

            clock.advance(Duration.ofMinutes(9));
            assertFalse(limiter.tryAcquire("p").granted());

            clock.advance(Duration.ofMinutes(1));
            assertEquals(3, grantedOf(5, "p"));
        }
    }

    @Test
    @DisplayName("unknown provider is admitted")
    void unknownProviderAdmitted() {
        assertTrue(limiter.tryAcquire("nobody").granted());
    }

    @Test
    @DisplayName("snapshot lists buckets in check order")
    void snapshotOrder() {
        limiter.register("p", RateLimitSpec.of(5, Duration.ofSeconds(10), 2)
            .withDailyCap(100, LocalTime.MIDNIGHT, ZoneId.of("UTC")));
        List<String> names = limiter.snapshot().get("p").stream().map(BucketSnapshot::name).toList();
        assertEquals(List.of("primary", "primary-window", "burst", "burst-window", "daily-cap"), names);
    }
}
