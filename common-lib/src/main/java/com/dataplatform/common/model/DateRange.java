package com.dataplatform.common.model;

import java.time.LocalDate;

/**
 * Inclusive calendar range. Either bound may be {@code null} (open-ended).
 */
public record DateRange(LocalDate from, LocalDate to) {

    public boolean isInverted() {
        return from != null && to != null && from.isAfter(to);
    }

    @Override
    public String toString() {
        return (from == null ? "*" : from) + ".." + (to == null ? "*" : to);
    }
}
