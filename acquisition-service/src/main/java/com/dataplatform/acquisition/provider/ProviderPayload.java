package com.dataplatform.acquisition.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Normalised answer of one provider.
 *
 * @param qualityScore provider-reported completeness/quality in {@code [0, 1]}
 * @param asOf         when the provider says the data was observed; not the fetch time
 */
public record ProviderPayload(
    JsonNode value,
    double   qualityScore,
    Instant  asOf
) {

    public ProviderPayload {
        if (value == null) {
            throw new IllegalArgumentException("value is required");
        }
        qualityScore = Math.max(0.0, Math.min(1.0, qualityScore));
    }
}
