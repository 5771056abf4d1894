package com.dataplatform.acquisition.provider;

import com.dataplatform.common.exception.ErrorKind;
import com.dataplatform.common.exception.ProviderException;
import com.fasterxml.jackson.core.JacksonException;
import io.netty.handler.timeout.ReadTimeoutException;
import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * Maps whatever an adapter call failed with onto the provider error taxonomy.
 */
public final class ProviderErrorClassifier {

    private ProviderErrorClassifier() {}

    public static ErrorKind classify(Throwable error) {
        Throwable t = error;
        for (int depth = 0; t != null && depth < 5; depth++, t = t.getCause()) {
            ErrorKind kind = direct(t);
            if (kind != null) {
                return kind;
            }
        }
        return ErrorKind.UNAVAILABLE;
    }

    private static ErrorKind direct(Throwable t) {
        if (t instanceof ProviderException pe) {
            return pe.getKind();
        }
        if (t instanceof TimeoutException || t instanceof ReadTimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        if (t instanceof WebClientResponseException wre) {
            int status = wre.getStatusCode().value();
            if (status == 429) return ErrorKind.RATE_LIMITED;
            if (status == 404) return ErrorKind.NOT_FOUND;
            if (status == 408 || status == 504) return ErrorKind.TIMEOUT;
            if (status >= 500) return ErrorKind.UNAVAILABLE;
            return ErrorKind.INVALID_RESPONSE;
        }
        if (t instanceof JacksonException || t instanceof DecodingException) {
            return ErrorKind.INVALID_RESPONSE;
        }
        if (t instanceof WebClientRequestException) {
            return ErrorKind.UNAVAILABLE;
        }
        return null;
    }
}
