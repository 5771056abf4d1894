package com.dataplatform.acquisition.provider;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Adapters by provider id. */
public class ProviderAdapterRegistry {

    private final Map<String, ProviderAdapter> adapters;

    public ProviderAdapterRegistry(Collection<? extends ProviderAdapter> adapters) {
        this.adapters = adapters.stream()
            .collect(Collectors.toMap(ProviderAdapter::providerId, Function.identity(), (a, b) -> {
                throw new IllegalArgumentException("Two adapters for provider " + a.providerId());
            }, TreeMap::new));
    }

    public Optional<ProviderAdapter> find(String providerId) {
        return Optional.ofNullable(adapters.get(providerId));
    }

    public Collection<String> providerIds() {
        return adapters.keySet();
    }
}
