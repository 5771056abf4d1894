package com.dataplatform.acquisition.executor;

/**
 * States of one acquisition. {@link #DONE} and {@link #FAILED} are terminal;
 * {@link #DEGRADED} always ends in one of them.
 */
public enum AcquisitionState {
    ROUTING,
    CACHE_CHECK,
    RATE_CHECK,
    FETCHING,
    RECONCILING,
    DEGRADED,
    DONE,
    FAILED
}
