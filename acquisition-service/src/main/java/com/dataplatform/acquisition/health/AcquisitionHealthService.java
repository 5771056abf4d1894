package com.dataplatform.acquisition.health;

import com.dataplatform.acquisition.cache.CacheStore;
import com.dataplatform.acquisition.catalog.ProviderCatalog;
import com.dataplatform.acquisition.cost.CostTracker;
import com.dataplatform.acquisition.provider.ProviderAdapterRegistry;
import com.dataplatform.common.model.ProviderDescriptor;
import com.dataplatform.common.ratelimit.RateLimiter;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
public class AcquisitionHealthService {

    static final double RELIABILITY_WARNING = 0.3;

    private final ProviderCatalog catalog;
    private final RateLimiter rateLimiter;
    private final CacheStore cacheStore;
    private final CostTracker costTracker;
    private final ProviderAdapterRegistry adapters;

    public AcquisitionHealthService(ProviderCatalog catalog, RateLimiter rateLimiter, CacheStore cacheStore,
                                    CostTracker costTracker, ProviderAdapterRegistry adapters) {
        this.catalog = catalog;
        this.rateLimiter = rateLimiter;
        this.cacheStore = cacheStore;
        this.costTracker = costTracker;
        this.adapters = adapters;
    }

    public AcquisitionHealth snapshot() {
        List<ProviderDescriptor> providers = catalog.providers();
        Map<String, Double> reliability = new TreeMap<>();
        providers.forEach(p -> reliability.put(p.id(), p.reliabilityScore()));

        List<String> withoutAdapter = providers.stream()
            .map(ProviderDescriptor::id)
            .filter(id -> adapters.find(id).isEmpty())
            .sorted()
            .toList();
        boolean allUnreliable = !reliability.isEmpty()
            && reliability.values().stream().allMatch(r -> r < RELIABILITY_WARNING);
        boolean noAdapters = withoutAdapter.size() == providers.size();
        String status = noAdapters || allUnreliable ? "DEGRADED" : "UP";

        return new AcquisitionHealth(status, rateLimiter.snapshot(), cacheStore.health(), reliability,
                                     costTracker.snapshot(providers), withoutAdapter);
    }
}
