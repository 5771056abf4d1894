package com.dataplatform.acquisition.cache;

import com.dataplatform.common.conflict.NumericValues;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalDouble;

/**
 * Downgrades the quality score of a write whose primary numeric value sits more than
 * {@code stdDevs} standard deviations from the recent history of the same key.
 * The value itself is stored unchanged.
 */
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private final int historySize;
    private final int minHistory;
    private final double stdDevs;
    private final double downgradeFactor;
    private final Cache<String, Deque<Double>> history;

    public AnomalyDetector(int historySize, int minHistory, double stdDevs,
                           double downgradeFactor, long maxKeys) {
        this.historySize = historySize;
        this.minHistory = minHistory;
        this.stdDevs = stdDevs;
        this.downgradeFactor = downgradeFactor;
        this.history = Caffeine.newBuilder().maximumSize(maxKeys).build();
    }

    /**
     * Records the value in the key's history and returns the quality score to store with it.
     * Values without a primary number pass through untouched.
     */
    public double assess(String key, JsonNode value, double qualityScore) {
        OptionalDouble primary = NumericValues.primary(value);
        if (primary.isEmpty()) {
            return qualityScore;
        }
        double x = primary.getAsDouble();
        Deque<Double> values = history.get(key, k -> new ArrayDeque<>(historySize));
        synchronized (values) {
            double adjusted = qualityScore;
            if (values.size() >= minHistory && isOutlier(values, x)) {
                adjusted = qualityScore * downgradeFactor;
                log.warn("CACHE_ANOMALY key={} value={} quality={} downgradedTo={}",
                         key, x, qualityScore, adjusted);
            }
            if (values.size() == historySize) {
                values.removeFirst();
            }
            values.addLast(x);
            return adjusted;
        }
    }

    private boolean isOutlier(Deque<Double> values, double x) {
        double mean = 0;
        for (double v : values) mean += v;
        mean /= values.size();
        double variance = 0;
        for (double v : values) variance += (v - mean) * (v - mean);
        double sd = Math.sqrt(variance / values.size());
        if (sd == 0) {
            return x != mean;
        }
        return Math.abs(x - mean) > stdDevs * sd;
    }
}
