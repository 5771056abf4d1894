package com.dataplatform.common.conflict;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of reconciling candidates.
 *
 * @param strategyRequested strategy configured for the data type
 * @param strategyApplied   strategy actually used; differs when averaging fell back to review
 * @param sourceId          winning source, or a {@code "+"}-joined list for averaged values
 */
public record Resolution(
    JsonNode           value,
    double             confidence,
    String             sourceId,
    ResolutionStrategy strategyRequested,
    ResolutionStrategy strategyApplied,
    boolean            reviewRequired
) {

    Resolution withRequested(ResolutionStrategy requested) {
        return new Resolution(value, confidence, sourceId, requested, strategyApplied, reviewRequired);
    }

    Resolution withConfidence(double c) {
        return new Resolution(value, c, sourceId, strategyRequested, strategyApplied, reviewRequired);
    }
}
