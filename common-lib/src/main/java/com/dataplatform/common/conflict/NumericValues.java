package com.dataplatform.common.conflict;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Numeric views of opaque JSON payloads, shared by reconciliation and the cache's
 * anomaly check.
 */
public final class NumericValues {

    /** Fields checked, in order, for the headline number of an object payload. */
    private static final List<String> PRIMARY_FIELDS =
        List.of("value", "price", "close", "latestClose", "last");

    private NumericValues() {}

    /** A numeric JSON scalar (or numeric string) as a double. */
    public static OptionalDouble scalar(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return OptionalDouble.empty();
        }
        if (node.isNumber()) {
            return OptionalDouble.of(node.asDouble());
        }
        if (node.isTextual()) {
            try {
                return OptionalDouble.of(Double.parseDouble(node.asText().trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    /** Top-level numeric fields of an object payload, in document order. */
    public static Map<String, Double> numericFields(JsonNode node) {
        Map<String, Double> out = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return out;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNumber()) {
                out.put(field.getKey(), field.getValue().asDouble());
            }
        }
        return out;
    }

    /**
     * The headline number of a payload: the scalar itself, the first well-known field
     * ({@code value}, {@code price}, {@code close}, ...), else the first numeric field.
     */
    public static OptionalDouble primary(JsonNode node) {
        OptionalDouble direct = scalar(node);
        if (direct.isPresent() || node == null || !node.isObject()) {
            return direct;
        }
        for (String name : PRIMARY_FIELDS) {
            OptionalDouble v = scalar(node.get(name));
            if (v.isPresent()) {
                return v;
            }
        }
        return numericFields(node).values().stream().mapToDouble(Double::doubleValue).findFirst();
    }

    public static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
    }

    /**
     * True when {@code (max - min) / |mean|} is at most {@code tolerancePercent} percent.
     * Around a zero mean only identical values count as within tolerance.
     */
    public static boolean withinTolerance(List<Double> values, double tolerancePercent) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double spread = max - min;
        double mean = Math.abs(mean(values));
        if (mean == 0.0) {
            return spread == 0.0;
        }
        return spread / mean * 100.0 <= tolerancePercent;
    }
}
