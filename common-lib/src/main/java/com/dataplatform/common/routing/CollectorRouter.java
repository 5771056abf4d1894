package com.dataplatform.common.routing;

import com.dataplatform.common.model.DataRequest;
import com.dataplatform.common.model.FilterCriteria;
import com.dataplatform.common.model.ProviderCategory;
import com.dataplatform.common.model.ProviderDescriptor;
import com.dataplatform.common.routing.ValidationResult.SuggestedFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Ranks the providers competent to answer a request.
 *
 * <p><strong>Algorithm:</strong>
 * <ol>
 *   <li>Keep providers that serve the request's data type.</li>
 *   <li>Keep providers whose activation predicate accepts the filter criteria.</li>
 *   <li>Drop commercial providers the budget gate rejects (monthly spend exhausted).</li>
 *   <li>Sort by priority desc, reliability desc, cost asc, then id for a total order.</li>
 * </ol>
 *
 * <p>An empty result is not an error here; the executor turns it into {@code UNROUTABLE}.
 * Stateless apart from the injected budget gate, and safe to share across threads.
 */
public class CollectorRouter {

    private static final Logger log = LoggerFactory.getLogger(CollectorRouter.class);

    /** Entity lists longer than this are split in validation suggestions. */
    static final int SUGGESTED_ENTITY_SLICE = 10;

    private static final Comparator<RoutedProvider> ORDER =
        Comparator.comparingInt(RoutedProvider::priority).reversed()
            .thenComparing(Comparator.comparingDouble(
                (RoutedProvider r) -> r.provider().reliabilityScore()).reversed())
            .thenComparingDouble(r -> r.provider().costPerRequest())
            .thenComparing(RoutedProvider::providerId);

    private final Predicate<ProviderDescriptor> budgetGate;

    public CollectorRouter() {
        this(p -> true);
    }

    /**
     * @param budgetGate returns false for a commercial provider that must not be called
     *                   because its budget is spent; never consulted for government sources
     */
    public CollectorRouter(Predicate<ProviderDescriptor> budgetGate) {
        this.budgetGate = budgetGate;
    }

    public RoutingDecision route(DataRequest request, List<ProviderDescriptor> catalog) {
        FilterCriteria criteria = request.filterCriteria();
        List<RoutedProvider> eligible = new ArrayList<>();
        for (ProviderDescriptor provider : catalog) {
            if (!provider.supports(request.dataType()) || !provider.isActiveFor(criteria)) {
                continue;
            }
            if (provider.category() == ProviderCategory.COMMERCIAL && !budgetGate.test(provider)) {
                log.info("ROUTING_BUDGET_EXCLUDED provider={} traceId={}", provider.id(), request.traceId());
                continue;
            }
            eligible.add(new RoutedProvider(provider, provider.priorityFor(criteria)));
        }
        eligible.sort(ORDER);
        RoutingDecision decision = new RoutingDecision(eligible);
        log.info("ROUTING_DECISION dataType={} entities={} candidates={} traceId={}",
                 request.dataType(), criteria.entityCount(), decision.providerIds(), request.traceId());
        return decision;
    }

    /**
     * Pre-flight feedback for upstream callers. Pure: no logging, no state change,
     * does not consult or mutate rate limits or caches.
     */
    public ValidationResult validate(DataRequest request, List<ProviderDescriptor> catalog) {
        FilterCriteria criteria = request.filterCriteria();
        List<String> warnings = new ArrayList<>();
        List<SuggestedFilter> suggestions = new ArrayList<>();
        boolean valid = true;

        if (criteria.dateRange() != null && criteria.dateRange().isInverted()) {
            valid = false;
            warnings.add("Date range " + criteria.dateRange() + " ends before it starts");
        }

        int entities = criteria.entityCount();
        if (entities > ActivationPredicates.MAX_INDIVIDUAL_ENTITIES) {
            warnings.add("Entity list of " + entities + " is too large for individual-analysis providers "
                         + "(max " + ActivationPredicates.MAX_INDIVIDUAL_ENTITIES + "); consider a sector filter instead");
            suggestions.add(new SuggestedFilter("sector", "<sector>",
                "Sector screens serve large universes in one call"));
            suggestions.add(new SuggestedFilter("entityKeys",
                request.entityKeys().subList(0, SUGGESTED_ENTITY_SLICE),
                "Split the list into batches of " + SUGGESTED_ENTITY_SLICE));
        }

        if (entities == 0 && !criteria.hasSector() && request.dataType().isEntityLevel()) {
            warnings.add("No entities or sector given for entity-level data type " + request.dataType());
            suggestions.add(new SuggestedFilter("sector", "<sector>",
                "Name entities or a sector to narrow the request"));
        }

        List<ProviderDescriptor> serving = catalog.stream()
            .filter(p -> p.supports(request.dataType()))
            .toList();
        if (criteria.realTime() && serving.stream().noneMatch(p -> p.isActiveFor(criteria))
                && serving.stream().anyMatch(p -> p.isActiveFor(criteria.withRealTime(false)))) {
            warnings.add("No provider serves real-time " + request.dataType() + "; delayed data is available");
            suggestions.add(new SuggestedFilter("realTime", false,
                "Delayed sources can answer this request"));
        }

        boolean routable = serving.stream().anyMatch(p -> p.isActiveFor(criteria)
            && (p.category() != ProviderCategory.COMMERCIAL || budgetGate.test(p)));
        if (!routable) {
            valid = false;
            warnings.add(serving.isEmpty()
                ? "No provider in the catalog serves " + request.dataType()
                : "No provider is competent for this combination of filters");
        }

        return new ValidationResult(valid, warnings, suggestions);
    }
}
