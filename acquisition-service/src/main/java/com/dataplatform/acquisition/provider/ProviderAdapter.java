package com.dataplatform.acquisition.provider;

import com.dataplatform.common.model.DataRequest;
import reactor.core.publisher.Mono;

/**
 * One external data source. Adapters normalise the provider's wire format and signal failures
 * as {@link com.dataplatform.common.exception.ProviderException}; anything else they let
 * escape is classified by {@link ProviderErrorClassifier}.
 *
 * <p>Adapters do no caching, rate limiting, retrying or timeouts of their own.
 */
public interface ProviderAdapter {

    String providerId();

    Mono<ProviderPayload> fetch(DataRequest request);
}
