package com.dataplatform.common.conflict;

import java.util.List;

/**
 * Strategy contract for reconciling two or more disagreeing candidates.
 *
 * <p>Implementations must be stateless and pure, and must never report a confidence
 * above the highest candidate quality. {@link ConflictResolver} handles the single-candidate
 * and exact-agreement cases before delegating, so implementations always see at least two
 * candidates that disagree somewhere.
 */
public interface ConflictResolutionStrategy {

    ResolutionStrategy kind();

    /**
     * @param candidates       two or more candidates, in arrival order
     * @param tolerancePercent allowed relative spread between numeric values, in percent
     */
    Resolution resolve(List<Candidate> candidates, double tolerancePercent);
}
