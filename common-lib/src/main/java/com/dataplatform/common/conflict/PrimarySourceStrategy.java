package com.dataplatform.common.conflict;

import java.util.Comparator;
import java.util.List;

final class PrimarySourceStrategy implements ConflictResolutionStrategy {

    private static final Comparator<Candidate> MOST_RELIABLE =
        Comparator.comparingDouble(Candidate::reliabilityScore)
            .thenComparingDouble(Candidate::qualityScore)
            .reversed()
            .thenComparing(Candidate::sourceId);

    @Override
    public ResolutionStrategy kind() {
        return ResolutionStrategy.USE_PRIMARY;
    }

    @Override
    public Resolution resolve(List<Candidate> candidates, double tolerancePercent) {
        Candidate winner = candidates.stream().min(MOST_RELIABLE).orElseThrow();
        return new Resolution(winner.value(), winner.qualityScore(), winner.sourceId(),
                              kind(), kind(), false);
    }
}
