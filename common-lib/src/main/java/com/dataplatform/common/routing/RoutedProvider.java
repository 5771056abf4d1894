package com.dataplatform.common.routing;

import com.dataplatform.common.model.ProviderDescriptor;

/**
 * One entry of a {@link RoutingDecision}: a competent provider and the priority it scored.
 */
public record RoutedProvider(ProviderDescriptor provider, int priority) {

    public String providerId() {
        return provider.id();
    }
}
