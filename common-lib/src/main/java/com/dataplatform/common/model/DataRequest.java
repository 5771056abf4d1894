package com.dataplatform.common.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * One semantic ask from the analysis engine, e.g. "daily series for AAPL over the
 * last 30 days". Immutable; lives only for the duration of the call.
 *
 * <p>Entity keys are trimmed, upper-cased and de-duplicated in arrival order, and
 * {@link FilterCriteria#entityCount()} is aligned with the resulting list.
 *
 * @param freshnessRequirement max acceptable staleness of a cached answer; {@code null} means
 *                             the data type's TTL alone decides freshness
 * @param deadline             overall budget for the whole acquisition; {@code null} means no
 *                             caller deadline beyond the per-provider timeouts
 */
public record DataRequest(
    List<String>   entityKeys,
    FilterCriteria filterCriteria,
    DataType       dataType,
    Duration       freshnessRequirement,
    Duration       deadline,
    String         traceId
) {

    public DataRequest {
        if (dataType == null) {
            throw new IllegalArgumentException("dataType is required");
        }
        entityKeys     = normalise(entityKeys);
        filterCriteria = (filterCriteria == null ? FilterCriteria.empty() : filterCriteria)
            .withEntityCount(entityKeys.size());
        traceId        = traceId == null || traceId.isBlank() ? UUID.randomUUID().toString() : traceId;
    }

    public static DataRequest of(DataType dataType, List<String> entityKeys, FilterCriteria criteria) {
        return new DataRequest(entityKeys, criteria, dataType, null, null, null);
    }

    public static DataRequest of(DataType dataType, String... entityKeys) {
        return of(dataType, List.of(entityKeys), FilterCriteria.empty());
    }

    public DataRequest withDeadline(Duration newDeadline) {
        return new DataRequest(entityKeys, filterCriteria, dataType, freshnessRequirement, newDeadline, traceId);
    }

    public DataRequest withFreshnessRequirement(Duration maxStaleness) {
        return new DataRequest(entityKeys, filterCriteria, dataType, maxStaleness, deadline, traceId);
    }

    public DataRequest withTraceId(String newTraceId) {
        return new DataRequest(entityKeys, filterCriteria, dataType, freshnessRequirement, deadline, newTraceId);
    }

    private static List<String> normalise(List<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        for (String k : keys) {
            if (k != null && !k.isBlank()) {
                seen.add(k.trim().toUpperCase(Locale.ROOT));
            }
        }
        return List.copyOf(new ArrayList<>(seen));
    }
}
