package com.dataplatform.common.model;

/**
 * One candidate the executor tried, and why it did or did not produce a value.
 * Carried on terminal errors so callers can log and alert without seeing raw
 * provider exceptions.
 */
public record ProviderAttempt(
    String providerId,
    Outcome outcome,
    String detail
) {

    public enum Outcome {
        SUCCESS,
        RATE_LIMITED,
        TIMEOUT,
        NOT_FOUND,
        INVALID_RESPONSE,
        UNAVAILABLE,
        SKIPPED_DEADLINE
    }

    @Override
    public String toString() {
        return providerId + ":" + outcome + (detail == null ? "" : "(" + detail + ")");
    }
}
