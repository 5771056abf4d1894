package com.dataplatform.acquisition.catalog;

import com.dataplatform.common.model.ProviderDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of enabled providers, in configuration order. Descriptors are shared
 * so their reliability scores are the live ones the router ranks by.
 */
public class ProviderCatalog {

    private final Map<String, ProviderDescriptor> byId;

    public ProviderCatalog(List<ProviderDescriptor> providers) {
        Map<String, ProviderDescriptor> map = new LinkedHashMap<>();
        for (ProviderDescriptor p : providers) {
            if (map.putIfAbsent(p.id(), p) != null) {
                throw new IllegalArgumentException("Duplicate provider id: " + p.id());
            }
        }
        this.byId = Collections.unmodifiableMap(map);
    }

    public List<ProviderDescriptor> providers() {
        return List.copyOf(byId.values());
    }

    public Optional<ProviderDescriptor> find(String providerId) {
        return Optional.ofNullable(byId.get(providerId));
    }

    public int size() {
        return byId.size();
    }
}
