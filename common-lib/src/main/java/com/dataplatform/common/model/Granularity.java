package com.dataplatform.common.model;

/**
 * Sampling resolution of a time series, ordered finest first.
 */
public enum Granularity {
    TICK,
    MINUTE,
    HOURLY,
    DAILY,
    WEEKLY,
    MONTHLY,
    QUARTERLY,
    ANNUAL;

    public boolean isFinerThan(Granularity other) {
        return ordinal() < other.ordinal();
    }
}
