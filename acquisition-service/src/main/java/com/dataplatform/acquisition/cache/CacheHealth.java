package com.dataplatform.acquisition.cache;

public record CacheHealth(
    long   hits,
    long   misses,
    double hitRate,
    long   staleServes,
    long   fastTierSize,
    long   durableTierSize,
    int    pendingRefreshes
) {}
