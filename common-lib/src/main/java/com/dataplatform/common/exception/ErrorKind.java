package com.dataplatform.common.exception;

/**
 * Error taxonomy of the acquisition core.
 *
 * <p>Only {@link #UNROUTABLE}, {@link #UNAVAILABLE} and {@link #TIMEOUT} (overall caller
 * deadline) ever reach a caller. The other kinds are provider-level and are converted
 * into a failover decision inside the executor.
 *
 * <p>{@link #reliabilityOutcome()} is the observation fed into a provider's reliability
 * moving average when a call fails with this kind: a rate-limit response says little
 * about data quality, a malformed payload says a lot.
 */
public enum ErrorKind {
    UNROUTABLE(1.0),
    RATE_LIMITED(0.8),
    TIMEOUT(0.3),
    NOT_FOUND(0.7),
    INVALID_RESPONSE(0.0),
    UNAVAILABLE(0.2);

    private final double reliabilityOutcome;

    ErrorKind(double reliabilityOutcome) {
        this.reliabilityOutcome = reliabilityOutcome;
    }

    public double reliabilityOutcome() {
        return reliabilityOutcome;
    }
}
