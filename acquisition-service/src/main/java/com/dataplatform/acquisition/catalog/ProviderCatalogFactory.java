package com.dataplatform.acquisition.catalog;

import com.dataplatform.acquisition.config.AcquisitionProperties;
import com.dataplatform.common.model.AnalysisType;
import com.dataplatform.common.model.FilterCriteria;
import com.dataplatform.common.model.ProviderDescriptor;
import com.dataplatform.common.model.RateLimitSpec;
import com.dataplatform.common.routing.ActivationPredicates;
import com.dataplatform.common.routing.PriorityFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * Compiles {@code acquisition.providers[]} into {@link ProviderDescriptor}s.
 * Activation blocks become a conjunction of {@link ActivationPredicates}; priority blocks
 * become {@link PriorityFunctions#boosted}. Disabled entries are skipped.
 */
public final class ProviderCatalogFactory {

    private static final Logger log = LoggerFactory.getLogger(ProviderCatalogFactory.class);

    private ProviderCatalogFactory() {}

    public static ProviderCatalog build(List<AcquisitionProperties.Provider> entries) {
        List<ProviderDescriptor> providers = new ArrayList<>();
        for (AcquisitionProperties.Provider entry : entries) {
            if (!entry.isEnabled()) {
                log.info("PROVIDER_DISABLED id={}", entry.getId());
                continue;
            }
            ProviderDescriptor descriptor = toDescriptor(entry);
            providers.add(descriptor);
            log.info("PROVIDER_REGISTERED id={} category={} scope={} dataTypes={} reliability={}",
                     descriptor.id(), descriptor.category(), descriptor.scope(),
                     descriptor.supportedDataTypes(), descriptor.reliabilityScore());
        }
        return new ProviderCatalog(providers);
    }

    static ProviderDescriptor toDescriptor(AcquisitionProperties.Provider entry) {
        if (entry.getId() == null || entry.getId().isBlank()) {
            throw new IllegalArgumentException("Provider entry without id");
        }
        if (entry.getDataTypes().isEmpty()) {
            throw new IllegalArgumentException("Provider " + entry.getId() + " declares no data types");
        }
        return ProviderDescriptor.builder(entry.getId())
            .displayName(entry.getDisplayName() == null ? entry.getId() : entry.getDisplayName())
            .category(entry.getCategory())
            .scope(entry.getScope())
            .supports(entry.getDataTypes())
            .rateLimit(rateLimit(entry.getRateLimit()))
            .reliabilityScore(entry.getReliability())
            .costPerRequest(entry.getCostPerRequest())
            .monthlyBudget(entry.getMonthlyBudget())
            .timeout(entry.getTimeout())
            .activationPredicate(activation(entry.getActivation()))
            .priorityFn(priority(entry.getPriority()))
            .build();
    }

    static RateLimitSpec rateLimit(AcquisitionProperties.RateLimit rl) {
        RateLimitSpec spec = RateLimitSpec.of(rl.getRequests(), rl.getWindow(), rl.getBurst())
            .withBurstWindow(rl.getBurstWindow());
        if (rl.getDailyCap() > 0) {
            spec = spec.withDailyCap(rl.getDailyCap(), LocalTime.parse(rl.getDailyResetTime()), ZoneId.of(rl.getZone()));
        }
        return spec;
    }

    static Predicate<FilterCriteria> activation(AcquisitionProperties.Activation a) {
        Predicate<FilterCriteria> p = ActivationPredicates.always();
        if (a.getMinEntities() != null || a.getMaxEntities() != null) {
            int min = a.getMinEntities() == null ? 0 : a.getMinEntities();
            int max = a.getMaxEntities() == null ? Integer.MAX_VALUE : a.getMaxEntities();
            p = p.and(ActivationPredicates.entityCountBetween(min, max));
        }
        if (a.isRequiresNoEntities()) {
            p = p.and(ActivationPredicates.noExplicitEntities());
        }
        if (a.isRequiresSector()) {
            p = p.and(ActivationPredicates.sectorPresent());
        }
        if (!a.getAnalysisTypes().isEmpty()) {
            AnalysisType[] types = a.getAnalysisTypes().toArray(new AnalysisType[0]);
            AnalysisType[] rest = new AnalysisType[types.length - 1];
            System.arraycopy(types, 1, rest, 0, rest.length);
            p = p.and(ActivationPredicates.anyAnalysisType(types[0], rest));
        }
        if (a.getRealTime() != null) {
            p = p.and(a.getRealTime() ? ActivationPredicates.realTimeOnly() : ActivationPredicates.notRealTime());
        }
        if (a.getFinestGranularity() != null) {
            p = p.and(ActivationPredicates.granularityAtLeast(a.getFinestGranularity()));
        }
        return p;
    }

    static ToIntFunction<FilterCriteria> priority(AcquisitionProperties.Priority pr) {
        if (pr.getSpecialties().isEmpty() && pr.getRealTimeBoost() == 0 && pr.getSectorBoost() == 0) {
            return PriorityFunctions.constant(pr.getBase());
        }
        return PriorityFunctions.boosted(pr.getBase(), pr.getSpecialties(), pr.getAnalysisTypeBoost(),
                                         pr.getRealTimeBoost(), pr.getSectorBoost());
    }
}
