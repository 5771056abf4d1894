package com.dataplatform.common.exception;

/**
 * Classified failure raised by a provider adapter. Never escapes the acquisition core.
 */
public class ProviderException extends RuntimeException {

    private final String providerId;
    private final ErrorKind kind;

    public ProviderException(String providerId, ErrorKind kind, String message) {
        super("[" + providerId + "] " + kind + ": " + message);
        this.providerId = providerId;
        this.kind       = kind;
    }

    public ProviderException(String providerId, ErrorKind kind, String message, Throwable cause) {
        super("[" + providerId + "] " + kind + ": " + message, cause);
        this.providerId = providerId;
        this.kind       = kind;
    }

    public String getProviderId() {
        return providerId;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
