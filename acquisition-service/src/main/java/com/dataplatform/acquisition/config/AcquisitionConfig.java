package com.dataplatform.acquisition.config;

import com.dataplatform.acquisition.cache.CacheStore;
import com.dataplatform.acquisition.catalog.ProviderCatalog;
import com.dataplatform.acquisition.catalog.ProviderCatalogFactory;
import com.dataplatform.acquisition.cost.CostTracker;
import com.dataplatform.acquisition.executor.FailoverExecutor;
import com.dataplatform.acquisition.executor.ReconciliationPolicy;
import com.dataplatform.acquisition.logger.AcquisitionFlowLogger;
import com.dataplatform.acquisition.provider.ProviderAdapterRegistry;
import com.dataplatform.common.conflict.ConflictResolver;
import com.dataplatform.common.ratelimit.RateLimiter;
import com.dataplatform.common.routing.CollectorRouter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AcquisitionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Boot's auto-configured mapper (JSR-310 included) with ISO timestamps in payloads and responses. */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer acquisitionJacksonCustomizer() {
        return builder -> builder.featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    public ProviderCatalog providerCatalog(AcquisitionProperties properties) {
        return ProviderCatalogFactory.build(properties.getProviders());
    }

    @Bean
    public RateLimiter rateLimiter(Clock clock, ProviderCatalog catalog) {
        return new RateLimiter(clock, catalog.providers());
    }

    @Bean
    public CostTracker costTracker(Clock clock) {
        return new CostTracker(clock);
    }

    @Bean
    public CollectorRouter collectorRouter(CostTracker costTracker) {
        return new CollectorRouter(costTracker::withinBudget);
    }

    @Bean
    public ConflictResolver conflictResolver() {
        return new ConflictResolver();
    }

    @Bean
    public ReconciliationPolicy reconciliationPolicy(AcquisitionProperties properties) {
        return new ReconciliationPolicy(properties.getReconciliation());
    }

    @Bean
    public FailoverExecutor failoverExecutor(ProviderCatalog catalog,
                                             CollectorRouter router,
                                             RateLimiter rateLimiter,
                                             CacheStore cacheStore,
                                             ProviderAdapterRegistry adapters,
                                             ConflictResolver conflictResolver,
                                             ReconciliationPolicy reconciliationPolicy,
                                             CostTracker costTracker,
                                             AcquisitionFlowLogger flowLogger,
                                             Clock clock,
                                             AcquisitionProperties properties) {
        return new FailoverExecutor(catalog, router, rateLimiter, cacheStore, adapters, conflictResolver,
                                    reconciliationPolicy, costTracker, flowLogger, clock,
                                    properties.getExecutor().getDefaultDeadline());
    }
}
