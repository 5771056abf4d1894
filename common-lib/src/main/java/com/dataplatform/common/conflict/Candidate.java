package com.dataplatform.common.conflict;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One sourced value competing for the same logical entity.
 */
public record Candidate(
    JsonNode value,
    String   sourceId,
    double   qualityScore,
    double   reliabilityScore
) {

    public Candidate {
        if (value == null) {
            throw new IllegalArgumentException("candidate value is required");
        }
        if (qualityScore < 0 || qualityScore > 1) {
            throw new IllegalArgumentException("qualityScore must be in [0, 1]: " + qualityScore);
        }
    }
}
