package com.dataplatform.common.routing;

import com.dataplatform.common.model.AnalysisType;
import com.dataplatform.common.model.FilterCriteria;
import com.dataplatform.common.model.Granularity;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Typed building blocks for provider activation predicates.
 *
 * <p>Each predicate encodes a competence boundary over {@link FilterCriteria}; catalog
 * entries combine them with {@link Predicate#and}/{@link Predicate#or}. Data-category
 * restrictions are not expressed here: a provider simply does not list data types outside
 * its category, and the router filters on that first.
 */
public final class ActivationPredicates {

    /** Upper bound on entity lists served by individual-analysis providers. */
    public static final int MAX_INDIVIDUAL_ENTITIES = 20;

    private ActivationPredicates() {}

    public static Predicate<FilterCriteria> always() {
        return f -> true;
    }

    /** Active when the request names between {@code min} and {@code max} entities, inclusive. */
    public static Predicate<FilterCriteria> entityCountBetween(int min, int max) {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("invalid entity range " + min + ".." + max);
        }
        return f -> f.entityCount() >= min && f.entityCount() <= max;
    }

    /** Single-entity deep analysis: 1 to {@value #MAX_INDIVIDUAL_ENTITIES} entities. */
    public static Predicate<FilterCriteria> individualEntities() {
        return entityCountBetween(1, MAX_INDIVIDUAL_ENTITIES);
    }

    /** Sector-wide screens: active only when there is no explicit entity list. */
    public static Predicate<FilterCriteria> noExplicitEntities() {
        return f -> !f.hasEntities();
    }

    public static Predicate<FilterCriteria> sectorPresent() {
        return FilterCriteria::hasSector;
    }

    public static Predicate<FilterCriteria> anyAnalysisType(AnalysisType first, AnalysisType... rest) {
        Set<AnalysisType> allowed = EnumSet.of(first, rest);
        return f -> allowed.contains(f.analysisType());
    }

    public static Predicate<FilterCriteria> realTimeOnly() {
        return FilterCriteria::realTime;
    }

    public static Predicate<FilterCriteria> notRealTime() {
        return f -> !f.realTime();
    }

    /** Active when the requested granularity is {@code finest} or coarser. */
    public static Predicate<FilterCriteria> granularityAtLeast(Granularity finest) {
        return f -> !f.granularity().isFinerThan(finest);
    }
}
