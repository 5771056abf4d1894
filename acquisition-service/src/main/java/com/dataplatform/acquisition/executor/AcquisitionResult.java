package com.dataplatform.acquisition.executor;

import com.dataplatform.common.model.CacheState;
import com.dataplatform.common.model.ProviderAttempt;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Value handed back to the caller, with where it came from and how much to trust it.
 */
public record AcquisitionResult(
    JsonNode value,
    Metadata metadata
) {

    /** Same result as seen by another caller that shared the fetch. */
    public AcquisitionResult withTraceId(String traceId) {
        Metadata m = metadata;
        return new AcquisitionResult(value, new Metadata(m.sourceId(), m.cacheState(), m.confidence(),
            m.reviewRequired(), m.attempts(), traceId, m.fetchedAt()));
    }

    /**
     * @param attempts providers tried on this call; empty when served from cache
     */
    public record Metadata(
        String                sourceId,
        CacheState            cacheState,
        double                confidence,
        boolean               reviewRequired,
        List<ProviderAttempt> attempts,
        String                traceId,
        Instant               fetchedAt
    ) {
        public Metadata {
            attempts = attempts == null ? List.of() : List.copyOf(attempts);
        }
    }
}
