package com.dataplatform.common.routing;

import java.util.List;

/**
 * Ordered candidate list for one request, best first. Empty means no provider is
 * competent: the request is unroutable, which callers report distinctly from
 * "every candidate failed".
 *
 * <p>Recomputed per request and never cached; filter criteria vary per call.
 */
public record RoutingDecision(List<RoutedProvider> candidates) {

    public RoutingDecision {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static RoutingDecision unroutable() {
        return new RoutingDecision(List.of());
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public int size() {
        return candidates.size();
    }

    public List<String> providerIds() {
        return candidates.stream().map(RoutedProvider::providerId).toList();
    }
}
