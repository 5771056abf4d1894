package com.dataplatform.common.routing;

import com.dataplatform.common.model.AnalysisType;
import com.dataplatform.common.model.FilterCriteria;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * Priority functions for the provider catalog. Higher wins.
 */
public final class PriorityFunctions {

    private PriorityFunctions() {}

    public static ToIntFunction<FilterCriteria> constant(int priority) {
        return f -> priority;
    }

    /**
     * {@code base}, plus {@code analysisBoost} when the request's analysis type is one the
     * provider specialises in, plus {@code realTimeBoost} for real-time requests, plus
     * {@code sectorBoost} when a sector filter is present.
     */
    public static ToIntFunction<FilterCriteria> boosted(int base,
                                                        Set<AnalysisType> specialties,
                                                        int analysisBoost,
                                                        int realTimeBoost,
                                                        int sectorBoost) {
        Set<AnalysisType> spec = specialties == null || specialties.isEmpty()
            ? EnumSet.noneOf(AnalysisType.class) : EnumSet.copyOf(specialties);
        return f -> {
            int score = base;
            if (spec.contains(f.analysisType())) score += analysisBoost;
            if (f.realTime())                    score += realTimeBoost;
            if (f.hasSector())                   score += sectorBoost;
            return score;
        };
    }
}
