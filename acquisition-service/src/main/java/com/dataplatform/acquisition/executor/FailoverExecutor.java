package com.dataplatform.acquisition.executor;

import com.dataplatform.acquisition.cache.CacheEntry;
import com.dataplatform.acquisition.cache.CacheKeys;
import com.dataplatform.acquisition.cache.CacheLookup;
import com.dataplatform.acquisition.cache.CacheStore;
import com.dataplatform.acquisition.catalog.ProviderCatalog;
import com.dataplatform.acquisition.cost.CostTracker;
import com.dataplatform.acquisition.logger.AcquisitionFlowLogger;
import com.dataplatform.acquisition.provider.ProviderAdapter;
import com.dataplatform.acquisition.provider.ProviderAdapterRegistry;
import com.dataplatform.acquisition.provider.ProviderErrorClassifier;
import com.dataplatform.acquisition.provider.ProviderPayload;
import com.dataplatform.common.conflict.Candidate;
import com.dataplatform.common.conflict.ConflictRecord;
import com.dataplatform.common.conflict.ConflictResolver;
import com.dataplatform.common.conflict.Resolution;
import com.dataplatform.common.exception.AcquisitionException;
import com.dataplatform.common.exception.ErrorKind;
import com.dataplatform.common.exception.ProviderException;
import com.dataplatform.common.model.CacheState;
import com.dataplatform.common.model.DataRequest;
import com.dataplatform.common.model.ProviderAttempt;
import com.dataplatform.common.model.ProviderDescriptor;
import com.dataplatform.common.ratelimit.AdmissionResult;
import com.dataplatform.common.ratelimit.RateLimiter;
import com.dataplatform.common.routing.CollectorRouter;
import com.dataplatform.common.routing.RoutedProvider;
import com.dataplatform.common.routing.RoutingDecision;
import com.dataplatform.common.trace.TraceContext;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs one acquisition through the state machine
 * {@code ROUTING → CACHE_CHECK → RATE_CHECK → FETCHING → RECONCILING → DONE},
 * with {@code DEGRADED} once every candidate is exhausted or the caller's deadline has passed,
 * and {@code FAILED} when there is nothing left to serve.
 *
 * <p>Concurrent requests for the same cache key share one in-flight fetch; each caller
 * still gives up at its own deadline. Only
 * {@link ErrorKind#UNROUTABLE}, {@link ErrorKind#UNAVAILABLE} and (deadline only)
 * {@link ErrorKind#TIMEOUT} reach the caller, always as an {@link AcquisitionException}
 * carrying the per-provider attempt log.
 */
public class FailoverExecutor {

    private static final Logger log = LoggerFactory.getLogger(FailoverExecutor.class);

    private final ProviderCatalog catalog;
    private final CollectorRouter router;
    private final RateLimiter rateLimiter;
    private final CacheStore cacheStore;
    private final ProviderAdapterRegistry adapters;
    private final ConflictResolver conflictResolver;
    private final ReconciliationPolicy reconciliationPolicy;
    private final CostTracker costTracker;
    private final AcquisitionFlowLogger flow;
    private final Clock clock;
    private final Duration defaultDeadline;

    private final ConcurrentHashMap<String, Mono<AcquisitionResult>> inFlight = new ConcurrentHashMap<>();

    public FailoverExecutor(ProviderCatalog catalog,
                            CollectorRouter router,
                            RateLimiter rateLimiter,
                            CacheStore cacheStore,
                            ProviderAdapterRegistry adapters,
                            ConflictResolver conflictResolver,
                            ReconciliationPolicy reconciliationPolicy,
                            CostTracker costTracker,
                            AcquisitionFlowLogger flow,
                            Clock clock,
                            Duration defaultDeadline) {
        this.catalog = catalog;
        this.router = router;
        this.rateLimiter = rateLimiter;
        this.cacheStore = cacheStore;
        this.adapters = adapters;
        this.conflictResolver = conflictResolver;
        this.reconciliationPolicy = reconciliationPolicy;
        this.costTracker = costTracker;
        this.flow = flow;
        this.clock = clock;
        this.defaultDeadline = defaultDeadline;
    }

    public Mono<AcquisitionResult> acquire(DataRequest request) {
        DataRequest req = request.deadline() == null && defaultDeadline != null
            ? request.withDeadline(defaultDeadline) : request;
        String key = CacheKeys.of(req);
        Mono<AcquisitionResult> pipeline = Mono.defer(() -> {
            flow.transition(AcquisitionState.ROUTING, req.traceId(), key, CacheKeys.describe(req));
            RoutingDecision decision = router.route(req, catalog.providers());
            if (decision.isEmpty()) {
                flow.transition(AcquisitionState.FAILED, req.traceId(), key, "reason=UNROUTABLE");
                return Mono.error(AcquisitionException.unroutable(
                    "No enabled provider can serve " + CacheKeys.describe(req)
                        + " with criteria " + req.filterCriteria()));
            }
            flow.transition(AcquisitionState.CACHE_CHECK, req.traceId(), key,
                            "candidates=" + decision.providerIds());
            return Mono.fromCallable(() -> cacheStore.get(key))
                .flatMap(cached -> {
                    if (cached.found() && cached.entry().satisfies(clock.instant(), req.freshnessRequirement())) {
                        if (cached.needsRefresh()) {
                            scheduleRefresh(key, req);
                        }
                        flow.transition(AcquisitionState.DONE, req.traceId(), key,
                                        "cacheState=FRESH source=" + cached.entry().sourceId());
                        return Mono.just(fromCache(cached, CacheState.FRESH, req.traceId(), List.of()));
                    }
                    Instant deadlineAt = req.deadline() == null ? null : clock.instant().plus(req.deadline());
                    Shared shared = shared(key, () -> fetchUnlessFilled(new Attempt(req, key, decision, deadlineAt)));
                    Mono<AcquisitionResult> view = shared.joined() && deadlineAt != null
                        ? boundByOwnDeadline(shared.mono(), new Attempt(req, key, decision, deadlineAt))
                        : shared.mono();
                    return view.map(result -> req.traceId().equals(result.metadata().traceId())
                        ? result : result.withTraceId(req.traceId()));
                });
        });
        return TraceContext.withTraceId(pipeline, req.traceId());
    }

    // ── in-flight de-duplication ─────────────────────────────────────────────

    /** Joins the fetch already running for {@code key}, or starts one. */
    private Shared shared(String key, Supplier<Mono<AcquisitionResult>> work) {
        AtomicBoolean started = new AtomicBoolean();
        Mono<AcquisitionResult> mono = inFlight.computeIfAbsent(key, k -> {
            started.set(true);
            AtomicReference<Mono<AcquisitionResult>> self = new AtomicReference<>();
            Mono<AcquisitionResult> m = Mono.defer(work)
                .doFinally(signal -> inFlight.remove(k, self.get()))
                .cache();
            self.set(m);
            return m;
        });
        if (!started.get()) {
            log.info("IN_FLIGHT_JOIN key={}", key);
        }
        return new Shared(mono, !started.get());
    }

    /**
     * A caller that joined someone else's fetch still answers within its own deadline. Giving
     * up only detaches this caller; the cached fetch keeps running and fills the cache.
     */
    private Mono<AcquisitionResult> boundByOwnDeadline(Mono<AcquisitionResult> fetch, Attempt a) {
        Duration remaining = Duration.between(clock.instant(), a.deadlineAt);
        if (remaining.isNegative()) {
            remaining = Duration.ZERO;
        }
        return fetch
            .timeout(remaining)
            .onErrorResume(TimeoutException.class, e -> {
                for (RoutedProvider candidate : a.decision.candidates()) {
                    a.record(candidate.providerId(), ProviderAttempt.Outcome.SKIPPED_DEADLINE,
                             "deadline elapsed while joined to an in-flight fetch");
                }
                return degraded(a, true);
            });
    }

    /** A leader that finished just before this one started may already have filled the cache. */
    private Mono<AcquisitionResult> fetchUnlessFilled(Attempt a) {
        Optional<CacheLookup> filled = cacheStore.peek(a.key);
        if (filled.isPresent() && filled.get().entry().satisfies(clock.instant(), a.request.freshnessRequirement())) {
            flow.transition(AcquisitionState.DONE, a.traceId(), a.key,
                            "cacheState=FRESH source=" + filled.get().entry().sourceId());
            return Mono.just(fromCache(filled.get(), CacheState.FRESH, a.traceId(), List.of()));
        }
        return tryCandidate(a, 0);
    }

    private void scheduleRefresh(String key, DataRequest req) {
        DataRequest refresh = req.withDeadline(null).withFreshnessRequirement(null).withTraceId(null);
        boolean scheduled = cacheStore.scheduleBackgroundRefresh(key, () -> shared(key, () -> {
            RoutingDecision decision = router.route(refresh, catalog.providers());
            if (decision.isEmpty()) {
                return Mono.error(AcquisitionException.unroutable("No provider left to refresh " + key));
            }
            flow.transition(AcquisitionState.ROUTING, refresh.traceId(), key,
                            "refreshOf=" + req.traceId() + " candidates=" + decision.providerIds());
            return tryCandidate(new Attempt(refresh, key, decision, null), 0);
        }).mono());
        log.info("REFRESH_AHEAD key={} scheduled={} traceId={}", key, scheduled, req.traceId());
    }

    // ── failover chain ───────────────────────────────────────────────────────

    private Mono<AcquisitionResult> tryCandidate(Attempt a, int index) {
        List<RoutedProvider> candidates = a.decision.candidates();
        if (index >= candidates.size()) {
            return degraded(a, false);
        }
        if (a.deadlineHit.get() || a.deadlineElapsed(clock.instant())) {
            for (int i = index; i < candidates.size(); i++) {
                a.record(candidates.get(i).providerId(), ProviderAttempt.Outcome.SKIPPED_DEADLINE, "deadline elapsed");
            }
            return degraded(a, true);
        }
        ProviderDescriptor provider = candidates.get(index).provider();
        Optional<ProviderAdapter> adapter = adapters.find(provider.id());
        if (adapter.isEmpty()) {
            log.warn("ADAPTER_MISSING provider={}", provider.id());
            a.record(provider.id(), ProviderAttempt.Outcome.UNAVAILABLE, "no adapter configured");
            return tryCandidate(a, index + 1);
        }
        flow.transition(AcquisitionState.RATE_CHECK, a.traceId(), a.key, "provider=" + provider.id());
        AdmissionResult admission = rateLimiter.tryAcquire(provider.id());
        if (!admission.granted()) {
            a.record(provider.id(), ProviderAttempt.Outcome.RATE_LIMITED,
                     "local " + admission.deniedBy() + " retryAfterMs=" + admission.retryAfter().toMillis());
            return tryCandidate(a, index + 1);
        }
        Duration timeout = provider.timeout();
        boolean cutByDeadline = false;
        if (a.deadlineAt != null) {
            Duration remaining = Duration.between(clock.instant(), a.deadlineAt);
            if (remaining.compareTo(timeout) < 0) {
                timeout = remaining;
                cutByDeadline = true;
            }
        }
        boolean deadlineBound = cutByDeadline;
        flow.transition(AcquisitionState.FETCHING, a.traceId(), a.key,
                        "provider=" + provider.id() + " timeoutMs=" + timeout.toMillis());
        return Mono.defer(() -> adapter.get().fetch(a.request))
            .timeout(timeout)
            .map(FetchOutcome::success)
            .switchIfEmpty(Mono.fromSupplier(() -> FetchOutcome.failure(
                new ProviderException(provider.id(), ErrorKind.INVALID_RESPONSE, "empty response"))))
            .onErrorResume(e -> Mono.just(FetchOutcome.failure(e)))
            .flatMap(outcome -> outcome.payload() != null
                ? onSuccess(a, provider, outcome.payload())
                : onFailure(a, provider, index, outcome.error(), deadlineBound));
    }

    private Mono<AcquisitionResult> onFailure(Attempt a, ProviderDescriptor provider, int index,
                                              Throwable error, boolean deadlineBound) {
        ErrorKind kind = ProviderErrorClassifier.classify(error);
        double reliability = provider.recordOutcome(kind);
        if (kind == ErrorKind.TIMEOUT && deadlineBound) {
            a.deadlineHit.set(true);
        }
        a.record(provider.id(), toOutcome(kind), error.getMessage());
        TraceContext.withMdc(a.traceId(), () ->
            log.warn("PROVIDER_FAILED provider={} kind={} reliability={} error={}",
                     provider.id(), kind, String.format("%.3f", reliability), error.getMessage()));
        return tryCandidate(a, index + 1);
    }

    private Mono<AcquisitionResult> onSuccess(Attempt a, ProviderDescriptor provider, ProviderPayload payload) {
        provider.recordOutcome(null);
        costTracker.record(provider);
        a.record(provider.id(), ProviderAttempt.Outcome.SUCCESS, null);
        flow.transition(AcquisitionState.RECONCILING, a.traceId(), a.key,
                        "provider=" + provider.id() + " quality=" + payload.qualityScore());
        return Mono.fromCallable(() -> reconcileAndStore(a, provider, payload));
    }

    private AcquisitionResult reconcileAndStore(Attempt a, ProviderDescriptor provider, ProviderPayload payload) {
        JsonNode value = payload.value();
        String sourceId = provider.id();
        double confidence = payload.qualityScore();
        boolean reviewRequired = false;

        Optional<CacheLookup> prior = cacheStore.peek(a.key);
        if (prior.isPresent() && prior.get().fresh() && !prior.get().entry().sourceId().equals(provider.id())) {
            CacheEntry previous = prior.get().entry();
            List<Candidate> candidates = List.of(
                new Candidate(prior.get().value(), previous.sourceId(), previous.qualityScore(),
                              reliabilityOf(previous.sourceId())),
                new Candidate(payload.value(), provider.id(), payload.qualityScore(), provider.reliabilityScore()));
            ReconciliationPolicy.Rule rule = reconciliationPolicy.ruleFor(a.request.dataType());
            ConflictRecord record = conflictResolver.reconcile(a.key, candidates, rule.strategy(), rule.tolerancePercent());
            Resolution resolution = record.resolution();
            value = resolution.value();
            sourceId = resolution.sourceId();
            confidence = resolution.confidence();
            reviewRequired = resolution.reviewRequired();
        }

        CacheEntry stored = cacheStore.set(a.key, value, sourceId,
                                           cacheStore.ttlFor(a.request.dataType()), confidence);
        confidence = Math.min(confidence, stored.qualityScore());
        flow.transition(AcquisitionState.DONE, a.traceId(), a.key,
                        "cacheState=REFRESHED source=" + sourceId + " confidence=" + confidence);
        return new AcquisitionResult(value, new AcquisitionResult.Metadata(
            sourceId, CacheState.REFRESHED, confidence, reviewRequired,
            a.attempts(), a.traceId(), stored.fetchedAt()));
    }

    private Mono<AcquisitionResult> degraded(Attempt a, boolean deadlineExceeded) {
        flow.transition(AcquisitionState.DEGRADED, a.traceId(), a.key,
                        "reason=" + (deadlineExceeded ? "deadline" : "candidates exhausted")
                            + " attempts=" + a.attempts());
        return Mono.fromCallable(() -> cacheStore.getStale(a.key))
            .flatMap(stale -> {
                if (stale.found()) {
                    flow.transition(AcquisitionState.DONE, a.traceId(), a.key,
                                    "cacheState=STALE source=" + stale.entry().sourceId());
                    return Mono.just(fromCache(stale, CacheState.STALE, a.traceId(), a.attempts()));
                }
                ErrorKind kind = deadlineExceeded ? ErrorKind.TIMEOUT : ErrorKind.UNAVAILABLE;
                flow.transition(AcquisitionState.FAILED, a.traceId(), a.key, "reason=" + kind);
                String message = deadlineExceeded
                    ? "Deadline elapsed before any provider answered " + CacheKeys.describe(a.request)
                    : "All providers failed for " + CacheKeys.describe(a.request);
                return Mono.error(new AcquisitionException(kind, message, a.attempts()));
            });
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private AcquisitionResult fromCache(CacheLookup lookup, CacheState state, String traceId,
                                        List<ProviderAttempt> attempts) {
        CacheEntry entry = lookup.entry();
        return new AcquisitionResult(lookup.value(), new AcquisitionResult.Metadata(
            entry.sourceId(), state, entry.qualityScore(), false, attempts, traceId, entry.fetchedAt()));
    }

    private double reliabilityOf(String sourceId) {
        return catalog.find(sourceId).map(ProviderDescriptor::reliabilityScore).orElse(0.5);
    }

    private static ProviderAttempt.Outcome toOutcome(ErrorKind kind) {
        return switch (kind) {
            case RATE_LIMITED     -> ProviderAttempt.Outcome.RATE_LIMITED;
            case TIMEOUT          -> ProviderAttempt.Outcome.TIMEOUT;
            case NOT_FOUND        -> ProviderAttempt.Outcome.NOT_FOUND;
            case INVALID_RESPONSE -> ProviderAttempt.Outcome.INVALID_RESPONSE;
            case UNAVAILABLE, UNROUTABLE -> ProviderAttempt.Outcome.UNAVAILABLE;
        };
    }

    /** Mutable state of one pass over the candidate list. */
    private static final class Attempt {
        private final DataRequest request;
        private final String key;
        private final RoutingDecision decision;
        private final Instant deadlineAt;
        private final List<ProviderAttempt> attempts = Collections.synchronizedList(new ArrayList<>());
        private final AtomicBoolean deadlineHit = new AtomicBoolean();

        Attempt(DataRequest request, String key, RoutingDecision decision, Instant deadlineAt) {
            this.request = request;
            this.key = key;
            this.decision = decision;
            this.deadlineAt = deadlineAt;
        }

        String traceId() {
            return request.traceId();
        }

        boolean deadlineElapsed(Instant now) {
            return deadlineAt != null && !now.isBefore(deadlineAt);
        }

        void record(String providerId, ProviderAttempt.Outcome outcome, String detail) {
            attempts.add(new ProviderAttempt(providerId, outcome, detail));
        }

        List<ProviderAttempt> attempts() {
            synchronized (attempts) {
                return List.copyOf(attempts);
            }
        }
    }

    private record Shared(Mono<AcquisitionResult> mono, boolean joined) {}

    private record FetchOutcome(ProviderPayload payload, Throwable error) {
        static FetchOutcome success(ProviderPayload payload) {
            return new FetchOutcome(payload, null);
        }

        static FetchOutcome failure(Throwable error) {
            return new FetchOutcome(null, error);
        }
    }
}
