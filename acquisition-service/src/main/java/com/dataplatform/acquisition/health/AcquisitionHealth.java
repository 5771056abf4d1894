package com.dataplatform.acquisition.health;

import com.dataplatform.acquisition.cache.CacheHealth;
import com.dataplatform.acquisition.cost.CostSnapshot;
import com.dataplatform.common.ratelimit.BucketSnapshot;

import java.util.List;
import java.util.Map;

/**
 * @param status {@code UP}, or {@code DEGRADED} when no enabled provider has an adapter
 *               or every provider's reliability has fallen below the warning level
 */
public record AcquisitionHealth(
    String                              status,
    Map<String, List<BucketSnapshot>>   rateLimiter,
    CacheHealth                         cache,
    Map<String, Double>                 reliability,
    Map<String, CostSnapshot>           costs,
    List<String>                        providersWithoutAdapter
) {}
