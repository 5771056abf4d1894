package com.dataplatform.common.conflict;

/**
 * Reconciliation policy, configured per data type and never inferred.
 */
public enum ResolutionStrategy {
    /** Highest-reliability source wins outright. */
    USE_PRIMARY,
    /** Highest quality score wins. */
    USE_HIGHEST_QUALITY,
    /** Arithmetic mean of numeric fields, only when all candidates sit inside the tolerance band. */
    USE_AVERAGE,
    /** No automatic resolution: best candidate returned with capped confidence and a review flag. */
    FLAG_FOR_REVIEW
}
