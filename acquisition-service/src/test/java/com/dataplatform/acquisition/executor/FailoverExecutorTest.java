package com.dataplatform.acquisition.executor;

import com.dataplatform.acquisition.cache.AnomalyDetector;
import com.dataplatform.acquisition.cache.BackgroundRefresher;
import com.dataplatform.acquisition.cache.CacheStore;
import com.dataplatform.acquisition.cache.InMemoryDurableTier;
import com.dataplatform.acquisition.cache.PayloadCodec;
import com.dataplatform.acquisition.catalog.ProviderCatalog;
import com.dataplatform.acquisition.config.AcquisitionProperties;
import com.dataplatform.acquisition.cost.CostTracker;
import com.dataplatform.acquisition.logger.AcquisitionFlowLogger;
import com.dataplatform.acquisition.provider.ProviderAdapter;
import com.dataplatform.acquisition.provider.ProviderAdapterRegistry;
import com.dataplatform.acquisition.provider.ProviderPayload;
import com.dataplatform.acquisition.support.MutableClock;
import com.dataplatform.common.conflict.ConflictResolver;
import com.dataplatform.common.exception.AcquisitionException;
import com.dataplatform.common.exception.ErrorKind;
import com.dataplatform.common.exception.ProviderException;
import com.dataplatform.common.model.CacheState;
import com.dataplatform.common.model.DataRequest;
import com.dataplatform.common.model.DataType;
import com.dataplatform.common.model.ProviderAttempt;
import com.dataplatform.common.model.ProviderDescriptor;
import com.dataplatform.common.model.RateLimitSpec;
import com.dataplatform.common.ratelimit.RateLimiter;
import com.dataplatform.common.routing.CollectorRouter;
import com.dataplatform.common.routing.PriorityFunctions;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.DoubleNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class FailoverExecutorTest {

    private static final Instant T0 = Instant.parse("2024-03-04T15:00:00Z");

    private MutableClock clock;
    private final List<CacheStore> stores = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
    }

    @AfterEach
    void tearDown() {
        stores.forEach(CacheStore::shutdown);
    }

    // ── fixtures ───────────────────────────────────────────────────────────

    private static ProviderDescriptor provider(String id, int priority) {
        return provider(id, priority, RateLimitSpec.of(100, Duration.ofMinutes(1), 0));
    }

    private static ProviderDescriptor provider(String id, int priority, RateLimitSpec rateLimit) {
        return ProviderDescriptor.builder(id)
            .supports(DataType.QUOTE)
            .priorityFn(PriorityFunctions.constant(priority))
            .reliabilityScore(0.9)
            .rateLimit(rateLimit)
            .timeout(Duration.ofSeconds(2))
            .build();
    }

    /** Adapter whose behaviour can be swapped between calls. */
    private static final class FakeAdapter implements ProviderAdapter {
        private final String id;
        private final AtomicInteger calls = new AtomicInteger();
        private volatile Function<DataRequest, Mono<ProviderPayload>> behaviour;

        FakeAdapter(String id, Function<DataRequest, Mono<ProviderPayload>> behaviour) {
            this.id = id;
            this.behaviour = behaviour;
        }

        static FakeAdapter answering(String id, double value, double quality) {
            return new FakeAdapter(id, r -> Mono.just(payload(value, quality)));
        }

        static FakeAdapter failing(String id, ErrorKind kind) {
            return new FakeAdapter(id, r -> Mono.error(new ProviderException(id, kind, "simulated")));
        }

        void answer(double value, double quality) {
            behaviour = r -> Mono.just(payload(value, quality));
        }

        void fail(ErrorKind kind) {
            behaviour = r -> Mono.error(new ProviderException(id, kind, "simulated"));
        }

        @Override
        public String providerId() {
            return id;
        }

        @Override
        public Mono<ProviderPayload> fetch(DataRequest request) {
            calls.incrementAndGet();
            return behaviour.apply(request);
        }
    }

    private static ProviderPayload payload(double value, double quality) {
        return new ProviderPayload(DoubleNode.valueOf(value), quality, T0);
    }

    private FailoverExecutor executor(Clock c, List<ProviderDescriptor> providers, ProviderAdapter... adapters) {
        AcquisitionProperties.Cache settings = new AcquisitionProperties.Cache();
        settings.getTtl().put(DataType.QUOTE, Duration.ofSeconds(60));
        settings.setStalenessCeiling(Duration.ofHours(1));
        CacheStore store = new CacheStore(settings, c, new InMemoryDurableTier(settings.getStalenessCeiling()),
            new PayloadCodec(new ObjectMapper(), settings.getCompressionThresholdBytes()),
            new AnomalyDetector(20, 5, 3.0, 0.5, 1_000),
            new BackgroundRefresher(2, 8, Duration.ofSeconds(5), Duration.ofSeconds(1)));
        stores.add(store);
        return new FailoverExecutor(new ProviderCatalog(providers), new CollectorRouter(),
            new RateLimiter(c, providers), store, new ProviderAdapterRegistry(List.of(adapters)),
            new ConflictResolver(), new ReconciliationPolicy(new AcquisitionProperties.Reconciliation()),
            new CostTracker(c), new AcquisitionFlowLogger(), c, null);
    }

    private static DataRequest quote(String symbol) {
        return DataRequest.of(DataType.QUOTE, symbol);
    }

    // ── failover ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("failover chain")
    class Failover {

        @Test
        @DisplayName("first candidate fails → second answers, attempts record both")
        void failsOverToSecond() {
            ProviderDescriptor primary = provider("primary", 20);
            ProviderDescriptor secondary = provider("secondary", 10);
            FailoverExecutor exec = executor(clock, List.of(primary, secondary),
                FakeAdapter.failing("primary", ErrorKind.UNAVAILABLE),
                FakeAdapter.answering("secondary", 42.0, 0.8));

            AcquisitionResult result = exec.acquire(quote("AAPL")).block();

            assertNotNull(result);
            assertEquals(42.0, result.value().asDouble());
            assertEquals("secondary", result.metadata().sourceId());
            assertEquals(CacheState.REFRESHED, result.metadata().cacheState());
            assertEquals(List.of(ProviderAttempt.Outcome.UNAVAILABLE, ProviderAttempt.Outcome.SUCCESS),
                result.metadata().attempts().stream().map(ProviderAttempt::outcome).toList());
            assertTrue(primary.reliabilityScore() < 0.9);
            assertTrue(secondary.reliabilityScore() > 0.9);
        }

        @Test
        @DisplayName("locally rate-limited candidate is skipped without a call")
        void rateLimitedSkipped() {
            ProviderDescriptor primary = provider("primary", 20, RateLimitSpec.of(1, Duration.ofMinutes(1), 0));
            FakeAdapter primaryAdapter = FakeAdapter.answering("primary", 1.0, 0.9);
            FakeAdapter secondaryAdapter = FakeAdapter.answering("secondary", 2.0, 0.9);
            FailoverExecutor exec = executor(clock, List.of(primary, provider("secondary", 10)),
                primaryAdapter, secondaryAdapter);

            assertEquals("primary", exec.acquire(quote("AAPL")).block().metadata().sourceId());
            AcquisitionResult second = exec.acquire(quote("MSFT")).block();

            assertEquals("secondary", second.metadata().sourceId());
            assertEquals(ProviderAttempt.Outcome.RATE_LIMITED, second.metadata().attempts().get(0).outcome());
            assertEquals(1, primaryAdapter.calls.get());
        }

        @Test
        @DisplayName("provider without an adapter is recorded as unavailable")
        void missingAdapter() {
            FailoverExecutor exec = executor(clock, List.of(provider("ghost", 20), provider("real", 10)),
                FakeAdapter.answering("real", 5.0, 0.9));

            AcquisitionResult result = exec.acquire(quote("AAPL")).block();

            assertEquals("real", result.metadata().sourceId());
            assertEquals("ghost", result.metadata().attempts().get(0).providerId());
            assertEquals(ProviderAttempt.Outcome.UNAVAILABLE, result.metadata().attempts().get(0).outcome());
        }

        @Test
        @DisplayName("a provider without an adapter keeps its rate budget")
        void missingAdapterSpendsNoToken() {
            ProviderDescriptor ghost = provider("ghost", 20, RateLimitSpec.of(1, Duration.ofMinutes(1), 0));
            FailoverExecutor exec = executor(clock, List.of(ghost, provider("real", 10)),
                FakeAdapter.answering("real", 5.0, 0.9));

            exec.acquire(quote("AAPL")).block();
            AcquisitionResult second = exec.acquire(quote("MSFT")).block();

            ProviderAttempt first = second.metadata().attempts().get(0);
            assertEquals("ghost", first.providerId());
            assertEquals(ProviderAttempt.Outcome.UNAVAILABLE, first.outcome());
            assertEquals("no adapter configured", first.detail());
        }

        @Test
        @DisplayName("an empty adapter response counts as invalid")
        void emptyResponse() {
            FailoverExecutor exec = executor(clock, List.of(provider("empty", 20), provider("real", 10)),
                new FakeAdapter("empty", r -> Mono.empty()),
                FakeAdapter.answering("real", 5.0, 0.9));

            AcquisitionResult result = exec.acquire(quote("AAPL")).block();

            assertEquals(ProviderAttempt.Outcome.INVALID_RESPONSE, result.metadata().attempts().get(0).outcome());
        }
    }

    // ── cache interplay ────────────────────────────────────────────────────

    @Nested
    @DisplayName("cache interplay")
    class CacheInterplay {

        @Test
        @DisplayName("second request inside the ttl is served from cache without a provider call")
        void freshHit() {
            FakeAdapter adapter = FakeAdapter.answering("primary", 10.0, 0.9);
            FailoverExecutor exec = executor(clock, List.of(provider("primary", 10)), adapter);

            exec.acquire(quote("AAPL")).block();
            clock.advance(Duration.ofSeconds(20));
            AcquisitionResult second = exec.acquire(quote("aapl")).block();

            assertEquals(CacheState.FRESH, second.metadata().cacheState());
            assertTrue(second.metadata().attempts().isEmpty());
            assertEquals(1, adapter.calls.get());
        }

        @Test
        @DisplayName("all candidates fail after expiry → stale value served with attempts")
        void degradedToStale() {
            FakeAdapter adapter = FakeAdapter.answering("primary", 10.0, 0.9);
            FailoverExecutor exec = executor(clock, List.of(provider("primary", 10)), adapter);
            exec.acquire(quote("AAPL")).block();

            clock.advance(Duration.ofMinutes(5));
            adapter.fail(ErrorKind.UNAVAILABLE);
            AcquisitionResult result = exec.acquire(quote("AAPL")).block();

            assertEquals(CacheState.STALE, result.metadata().cacheState());
            assertEquals(10.0, result.value().asDouble());
            assertEquals(1, result.metadata().attempts().size());
        }

        @Test
        @DisplayName("all candidates fail and nothing cached → UNAVAILABLE with every attempt")
        void unavailable() {
            FailoverExecutor exec = executor(clock, List.of(provider("a", 20), provider("b", 10)),
                FakeAdapter.failing("a", ErrorKind.TIMEOUT),
                FakeAdapter.failing("b", ErrorKind.NOT_FOUND));

            StepVerifier.create(exec.acquire(quote("AAPL")))
                .expectErrorSatisfies(e -> {
                    AcquisitionException ae = assertInstanceOf(AcquisitionException.class, e);
                    assertEquals(ErrorKind.UNAVAILABLE, ae.getKind());
                    assertEquals(List.of(ProviderAttempt.Outcome.TIMEOUT, ProviderAttempt.Outcome.NOT_FOUND),
                        ae.getAttempts().stream().map(ProviderAttempt::outcome).toList());
                })
                .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("fresh value from another source is reconciled with the new fetch")
        void reconcilesWithCachedValue() {
            FakeAdapter a = FakeAdapter.answering("A", 100.0, 0.9);
            FakeAdapter b = FakeAdapter.answering("B", 100.05, 0.6);
            FailoverExecutor exec = executor(clock, List.of(provider("A", 20), provider("B", 10)), a, b);
            exec.acquire(quote("AAPL")).block();

            clock.advance(Duration.ofSeconds(30));
            a.fail(ErrorKind.UNAVAILABLE);
            AcquisitionResult result = exec.acquire(quote("AAPL").withFreshnessRequirement(Duration.ofSeconds(10)))
                .block();

            assertEquals(100.0, result.value().asDouble());
            assertEquals("A", result.metadata().sourceId());
            assertEquals(0.9, result.metadata().confidence(), 1e-9);
            assertEquals(1, b.calls.get());
        }

        @Test
        @DisplayName("hit past the refresh threshold triggers one background fetch")
        void refreshAhead() throws InterruptedException {
            FakeAdapter adapter = FakeAdapter.answering("primary", 10.0, 0.9);
            FailoverExecutor exec = executor(clock, List.of(provider("primary", 10)), adapter);
            exec.acquire(quote("AAPL")).block();

            clock.advance(Duration.ofSeconds(50));
            adapter.answer(11.0, 0.9);
            AcquisitionResult hit = exec.acquire(quote("AAPL")).block();
            assertEquals(CacheState.FRESH, hit.metadata().cacheState());
            assertEquals(10.0, hit.value().asDouble());

            long deadline = System.currentTimeMillis() + 5_000;
            while (adapter.calls.get() < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(2, adapter.calls.get());
        }
    }

    // ── joined fetches ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("joining an in-flight fetch")
    class JoinedFetch {

        private FakeAdapter slow(double value, long millis) {
            return new FakeAdapter("primary",
                r -> Mono.delay(Duration.ofMillis(millis)).thenReturn(payload(value, 0.9)));
        }

        @Test
        @DisplayName("joiner with a short deadline gives up on time; the shared fetch still completes")
        void joinerHonoursOwnDeadline() {
            FakeAdapter adapter = slow(7.0, 1_500);
            FailoverExecutor exec = executor(clock, List.of(provider("primary", 10)), adapter);

            Mono<AcquisitionResult> first = exec.acquire(quote("AAPL")).cache();
            first.subscribe();

            long start = System.nanoTime();
            StepVerifier.create(exec.acquire(quote("AAPL").withDeadline(Duration.ofMillis(200))))
                .expectErrorSatisfies(e -> {
                    AcquisitionException ae = assertInstanceOf(AcquisitionException.class, e);
                    assertEquals(ErrorKind.TIMEOUT, ae.getKind());
                    assertEquals(List.of(ProviderAttempt.Outcome.SKIPPED_DEADLINE),
                        ae.getAttempts().stream().map(ProviderAttempt::outcome).toList());
                })
                .verify(Duration.ofSeconds(5));
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            assertTrue(elapsedMs < 1_000, "joiner waited " + elapsedMs + "ms");

            AcquisitionResult leader = first.block(Duration.ofSeconds(5));
            assertEquals(CacheState.REFRESHED, leader.metadata().cacheState());
            assertEquals(7.0, leader.value().asDouble());
            assertEquals(1, adapter.calls.get());
        }

        @Test
        @DisplayName("joiner past its deadline is served the stale entry")
        void joinerFallsBackToStale() {
            FakeAdapter adapter = FakeAdapter.answering("primary", 10.0, 0.9);
            FailoverExecutor exec = executor(clock, List.of(provider("primary", 10)), adapter);
            exec.acquire(quote("AAPL")).block();

            clock.advance(Duration.ofMinutes(5));
            adapter.behaviour = r -> Mono.delay(Duration.ofMillis(1_500)).thenReturn(payload(11.0, 0.9));
            Mono<AcquisitionResult> first = exec.acquire(quote("AAPL")).cache();
            first.subscribe();

            AcquisitionResult joined = exec.acquire(quote("AAPL").withDeadline(Duration.ofMillis(200)))
                .block(Duration.ofSeconds(1));

            assertEquals(CacheState.STALE, joined.metadata().cacheState());
            assertEquals(10.0, joined.value().asDouble());
            assertEquals(11.0, first.block(Duration.ofSeconds(5)).value().asDouble());
            assertEquals(2, adapter.calls.get());
        }
    }

    // ── routing, deadlines, sharing ────────────────────────────────────────

    @Test
    @DisplayName("no provider supports the data type → UNROUTABLE")
    void unroutable() {
        FailoverExecutor exec = executor(clock, List.of(provider("primary", 10)),
            FakeAdapter.answering("primary", 1.0, 0.9));

        StepVerifier.create(exec.acquire(DataRequest.of(DataType.FILINGS, "AAPL")))
            .expectErrorSatisfies(e -> assertEquals(ErrorKind.UNROUTABLE, ((AcquisitionException) e).getKind()))
            .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("deadline elapses while the first provider hangs → TIMEOUT, rest skipped")
    void deadline() {
        FailoverExecutor exec = executor(Clock.systemUTC(), List.of(provider("slow", 20), provider("later", 10)),
            new FakeAdapter("slow", r -> Mono.never()),
            FakeAdapter.answering("later", 1.0, 0.9));

        StepVerifier.create(exec.acquire(quote("AAPL").withDeadline(Duration.ofMillis(200))))
            .expectErrorSatisfies(e -> {
                AcquisitionException ae = assertInstanceOf(AcquisitionException.class, e);
                assertEquals(ErrorKind.TIMEOUT, ae.getKind());
                assertEquals(ProviderAttempt.Outcome.TIMEOUT, ae.getAttempts().get(0).outcome());
                assertEquals(ProviderAttempt.Outcome.SKIPPED_DEADLINE, ae.getAttempts().get(1).outcome());
            })
            .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("concurrent cold requests for one key share a single provider call")
    void inFlightDedupe() {
        FakeAdapter adapter = new FakeAdapter("primary",
            r -> Mono.delay(Duration.ofMillis(200)).thenReturn(payload(7.0, 0.9)));
        FailoverExecutor exec = executor(clock, List.of(provider("primary", 10)), adapter);

        List<AcquisitionResult> results = Flux.range(0, 10)
            .flatMap(i -> exec.acquire(quote("AAPL")), 10)
            .collectList()
            .block(Duration.ofSeconds(5));

        assertEquals(10, results.size());
        assertEquals(1, adapter.calls.get());
        assertTrue(results.stream().allMatch(r -> r.value().asDouble() == 7.0));
        assertEquals(10, results.stream().map(r -> r.metadata().traceId()).distinct().count());
    }
}
