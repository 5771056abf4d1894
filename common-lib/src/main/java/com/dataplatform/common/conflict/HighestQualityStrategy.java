package com.dataplatform.common.conflict;

import java.util.List;

final class HighestQualityStrategy implements ConflictResolutionStrategy {

    @Override
    public ResolutionStrategy kind() {
        return ResolutionStrategy.USE_HIGHEST_QUALITY;
    }

    @Override
    public Resolution resolve(List<Candidate> candidates, double tolerancePercent) {
        Candidate best = ConflictResolver.highestQuality(candidates);
        return new Resolution(best.value(), best.qualityScore(), best.sourceId(), kind(), kind(), false);
    }
}
