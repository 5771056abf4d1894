package com.dataplatform.common.model;

import java.util.Objects;

/**
 * Structured filter a request carries to the router.
 *
 * <p>Activation predicates are typed functions over this value, so routing never
 * depends on string matching against a free-form dictionary. {@code entityCount}
 * mirrors the size of the owning request's entity list so predicates can bound it.
 *
 * <p>Immutable; the {@code with*} methods return copies.
 */
public record FilterCriteria(
    String       sector,
    DateRange    dateRange,
    Granularity  granularity,
    AnalysisType analysisType,
    boolean      realTime,
    int          entityCount
) {

    public FilterCriteria {
        granularity  = granularity  == null ? Granularity.DAILY    : granularity;
        analysisType = analysisType == null ? AnalysisType.GENERAL : analysisType;
        sector       = sector == null || sector.isBlank() ? null : sector.trim();
        if (entityCount < 0) {
            throw new IllegalArgumentException("entityCount must be >= 0");
        }
    }

    public static FilterCriteria empty() {
        return new FilterCriteria(null, null, Granularity.DAILY, AnalysisType.GENERAL, false, 0);
    }

    public boolean hasSector() {
        return sector != null;
    }

    public boolean hasEntities() {
        return entityCount > 0;
    }

    public FilterCriteria withSector(String newSector) {
        return new FilterCriteria(newSector, dateRange, granularity, analysisType, realTime, entityCount);
    }

    public FilterCriteria withDateRange(DateRange range) {
        return new FilterCriteria(sector, range, granularity, analysisType, realTime, entityCount);
    }

    public FilterCriteria withGranularity(Granularity g) {
        return new FilterCriteria(sector, dateRange, g, analysisType, realTime, entityCount);
    }

    public FilterCriteria withAnalysisType(AnalysisType type) {
        return new FilterCriteria(sector, dateRange, granularity, type, realTime, entityCount);
    }

    public FilterCriteria withRealTime(boolean rt) {
        return new FilterCriteria(sector, dateRange, granularity, analysisType, rt, entityCount);
    }

    public FilterCriteria withEntityCount(int count) {
        if (count == entityCount) {
            return this;
        }
        return new FilterCriteria(sector, dateRange, granularity, analysisType, realTime, count);
    }

    public boolean sameSector(String other) {
        return Objects.equals(sector, other);
    }
}
