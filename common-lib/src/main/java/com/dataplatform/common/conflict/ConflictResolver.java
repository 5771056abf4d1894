package com.dataplatform.common.conflict;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reconciles disagreeing values for the same logical entity into one value and a
 * confidence score.
 *
 * <p>Dispatch is by {@link ResolutionStrategy} tag into a registry of
 * {@link ConflictResolutionStrategy} implementations, so a new strategy is one new class and
 * one registry entry; the executor never changes.
 *
 * <p>Guarantees, whatever the strategy:
 * <ul>
 *   <li>one candidate → its value, with confidence equal to its quality</li>
 *   <li>candidates agreeing exactly → that value with confidence 1.0</li>
 *   <li>otherwise confidence ≤ the highest candidate quality</li>
 * </ul>
 */
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    private static final Comparator<Candidate> BY_QUALITY =
        Comparator.comparingDouble(Candidate::qualityScore)
            .thenComparingDouble(Candidate::reliabilityScore)
            .reversed()
            .thenComparing(Candidate::sourceId);

    private final Map<ResolutionStrategy, ConflictResolutionStrategy> strategies =
        new EnumMap<>(ResolutionStrategy.class);

    public ConflictResolver() {
        FlagForReviewStrategy review = new FlagForReviewStrategy();
        register(new PrimarySourceStrategy());
        register(new HighestQualityStrategy());
        register(new AverageStrategy(review));
        register(review);
    }

    public final void register(ConflictResolutionStrategy strategy) {
        strategies.put(strategy.kind(), strategy);
    }

    public Resolution resolve(List<Candidate> candidates, ResolutionStrategy strategy, double tolerancePercent) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("at least one candidate is required");
        }
        if (candidates.size() == 1) {
            Candidate only = candidates.get(0);
            return new Resolution(only.value(), only.qualityScore(), only.sourceId(), strategy, strategy, false);
        }
        if (agreeExactly(candidates)) {
            Candidate best = highestQuality(candidates);
            return new Resolution(best.value(), 1.0, best.sourceId(), strategy, strategy, false);
        }
        ConflictResolutionStrategy impl = strategies.get(strategy);
        if (impl == null) {
            throw new IllegalArgumentException("no strategy registered for " + strategy);
        }
        Resolution raw = impl.resolve(candidates, tolerancePercent).withRequested(strategy);
        double ceiling = candidates.stream().mapToDouble(Candidate::qualityScore).max().orElse(0.0);
        return raw.confidence() > ceiling ? raw.withConfidence(ceiling) : raw;
    }

    /**
     * Resolves and logs an audit record for {@code key}.
     */
    public ConflictRecord reconcile(String key, List<Candidate> candidates,
                                    ResolutionStrategy strategy, double tolerancePercent) {
        Resolution resolution = resolve(candidates, strategy, tolerancePercent);
        ConflictRecord record = new ConflictRecord(key, candidates, resolution);
        if (resolution.reviewRequired()) {
            log.warn("CONFLICT_FLAGGED key={} requested={} applied={} sources={} confidence={}",
                     key, strategy, resolution.strategyApplied(),
                     candidates.stream().map(Candidate::sourceId).toList(),
                     String.format("%.2f", resolution.confidence()));
        } else {
            log.info("CONFLICT_RESOLVED key={} strategy={} winner={} candidates={} confidence={}",
                     key, resolution.strategyApplied(), resolution.sourceId(), candidates.size(),
                     String.format("%.2f", resolution.confidence()));
        }
        return record;
    }

    static Candidate highestQuality(List<Candidate> candidates) {
        return candidates.stream().min(BY_QUALITY).orElseThrow();
    }

    private static boolean agreeExactly(List<Candidate> candidates) {
        Candidate first = candidates.get(0);
        return candidates.stream().allMatch(c -> c.value().equals(first.value()));
    }
}
