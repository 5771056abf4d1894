package com.dataplatform.common.exception;

import com.dataplatform.common.model.ProviderAttempt;

import java.util.List;

/**
 * Terminal failure surfaced to the caller of the acquisition core. Carries every
 * provider attempt so the caller can log which sources were tried and why each failed.
 */
public class AcquisitionException extends RuntimeException {

    private final ErrorKind kind;
    private final List<ProviderAttempt> attempts;

    public AcquisitionException(ErrorKind kind, String message, List<ProviderAttempt> attempts) {
        super(kind + ": " + message);
        this.kind     = kind;
        this.attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public static AcquisitionException unroutable(String message) {
        return new AcquisitionException(ErrorKind.UNROUTABLE, message, List.of());
    }

    public ErrorKind getKind() {
        return kind;
    }

    public List<ProviderAttempt> getAttempts() {
        return attempts;
    }
}
