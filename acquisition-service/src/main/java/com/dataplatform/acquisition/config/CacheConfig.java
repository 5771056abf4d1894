package com.dataplatform.acquisition.config;

import com.dataplatform.acquisition.cache.AnomalyDetector;
import com.dataplatform.acquisition.cache.BackgroundRefresher;
import com.dataplatform.acquisition.cache.CacheStore;
import com.dataplatform.acquisition.cache.DurableCacheTier;
import com.dataplatform.acquisition.cache.InMemoryDurableTier;
import com.dataplatform.acquisition.cache.PayloadCodec;
import com.dataplatform.acquisition.cache.RedisDurableTier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Cache wiring. The durable tier is chosen by {@code acquisition.cache.durable.type}:
 * {@code memory} (default) or {@code redis}.
 */
@Configuration
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    @Bean
    @ConditionalOnProperty(name = "acquisition.cache.durable.type", havingValue = "memory", matchIfMissing = true)
    public DurableCacheTier inMemoryDurableTier(AcquisitionProperties properties) {
        log.info("CACHE_DURABLE_TIER type=memory stalenessCeiling={}",
                 properties.getCache().getStalenessCeiling());
        return new InMemoryDurableTier(properties.getCache().getStalenessCeiling());
    }

    @Bean
    @ConditionalOnProperty(name = "acquisition.cache.durable.type", havingValue = "redis")
    public DurableCacheTier redisDurableTier(StringRedisTemplate redis, ObjectMapper objectMapper,
                                             AcquisitionProperties properties) {
        AcquisitionProperties.Cache cache = properties.getCache();
        log.info("CACHE_DURABLE_TIER type=redis prefix={} stalenessCeiling={}",
                 cache.getDurable().getKeyPrefix(), cache.getStalenessCeiling());
        return new RedisDurableTier(redis, objectMapper, cache.getDurable().getKeyPrefix(),
                                    cache.getStalenessCeiling());
    }

    @Bean
    public CacheStore cacheStore(AcquisitionProperties properties, Clock clock,
                                 DurableCacheTier durableTier, ObjectMapper objectMapper) {
        AcquisitionProperties.Cache cache = properties.getCache();
        AcquisitionProperties.Anomaly anomaly = cache.getAnomaly();
        AcquisitionProperties.Refresh refresh = cache.getRefresh();
        return new CacheStore(
            cache,
            clock,
            durableTier,
            new PayloadCodec(objectMapper, cache.getCompressionThresholdBytes()),
            new AnomalyDetector(anomaly.getHistorySize(), anomaly.getMinHistory(), anomaly.getStdDevs(),
                                anomaly.getDowngradeFactor(), cache.getFastTierMaxSize()),
            new BackgroundRefresher(refresh.getWorkers(), refresh.getQueueCapacity(),
                                    refresh.getTaskTimeout(), refresh.getShutdownGrace()));
    }
}
