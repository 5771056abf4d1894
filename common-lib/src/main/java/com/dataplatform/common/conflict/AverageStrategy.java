package com.dataplatform.common.conflict;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Field-wise arithmetic mean of numeric values.
 *
 * <p>Only averages when every numeric field's spread across candidates stays inside the
 * tolerance band. Any divergent field, or a payload without comparable numeric content,
 * hands the whole decision to {@link FlagForReviewStrategy}: outliers are never silently
 * averaged in.
 *
 * <p>Non-numeric fields of an averaged object come from the highest-quality candidate.
 * Confidence is the mean candidate quality.
 */
final class AverageStrategy implements ConflictResolutionStrategy {

    private final FlagForReviewStrategy fallback;

    AverageStrategy(FlagForReviewStrategy fallback) {
        this.fallback = fallback;
    }

    @Override
    public ResolutionStrategy kind() {
        return ResolutionStrategy.USE_AVERAGE;
    }

    @Override
    public Resolution resolve(List<Candidate> candidates, double tolerancePercent) {
        JsonNode averaged = allScalars(candidates)
            ? averageScalars(candidates, tolerancePercent)
            : averageObjects(candidates, tolerancePercent);
        if (averaged == null) {
            return fallback.resolve(candidates, tolerancePercent);
        }
        double confidence = candidates.stream().mapToDouble(Candidate::qualityScore).average().orElse(0.0);
        String sources = candidates.stream().map(Candidate::sourceId).collect(Collectors.joining("+"));
        return new Resolution(averaged, confidence, sources, kind(), kind(), false);
    }

    private static boolean allScalars(List<Candidate> candidates) {
        return candidates.stream().allMatch(c -> NumericValues.scalar(c.value()).isPresent());
    }

    private static JsonNode averageScalars(List<Candidate> candidates, double tolerancePercent) {
        List<Double> values = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            values.add(NumericValues.scalar(c.value()).getAsDouble());
        }
        if (!NumericValues.withinTolerance(values, tolerancePercent)) {
            return null;
        }
        return DoubleNode.valueOf(NumericValues.mean(values));
    }

    private static JsonNode averageObjects(List<Candidate> candidates, double tolerancePercent) {
        if (!candidates.stream().allMatch(c -> c.value().isObject())) {
            return null;
        }
        Candidate best = ConflictResolver.highestQuality(candidates);
        Map<String, Double> reference = NumericValues.numericFields(best.value());
        if (reference.isEmpty()) {
            return null;
        }
        ObjectNode result = ((ObjectNode) best.value()).deepCopy();
        int averagedFields = 0;
        for (String field : reference.keySet()) {
            List<Double> values = new ArrayList<>(candidates.size());
            for (Candidate c : candidates) {
                OptionalDouble v = NumericValues.scalar(c.value().get(field));
                if (v.isPresent()) {
                    values.add(v.getAsDouble());
                }
            }
            if (values.size() < 2) {
                continue;
            }
            if (!NumericValues.withinTolerance(values, tolerancePercent)) {
                return null;
            }
            result.put(field, NumericValues.mean(values));
            averagedFields++;
        }
        return averagedFields == 0 ? null : result;
    }
}
