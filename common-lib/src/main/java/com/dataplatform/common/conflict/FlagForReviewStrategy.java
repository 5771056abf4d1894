package com.dataplatform.common.conflict;

import java.util.List;

/**
 * Returns the highest-quality candidate untouched but marks the result for human review
 * and caps its confidence at {@value #REVIEW_CONFIDENCE_CAP}.
 */
final class FlagForReviewStrategy implements ConflictResolutionStrategy {

    static final double REVIEW_CONFIDENCE_CAP = 0.3;

    @Override
    public ResolutionStrategy kind() {
        return ResolutionStrategy.FLAG_FOR_REVIEW;
    }

    @Override
    public Resolution resolve(List<Candidate> candidates, double tolerancePercent) {
        Candidate best = ConflictResolver.highestQuality(candidates);
        double confidence = Math.min(REVIEW_CONFIDENCE_CAP, best.qualityScore());
        return new Resolution(best.value(), confidence, best.sourceId(), kind(), kind(), true);
    }
}
