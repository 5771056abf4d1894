package com.dataplatform.acquisition.job;

import com.dataplatform.acquisition.cache.CacheStore;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Drops durable cache entries past the staleness ceiling, independently of reads. */
@Component
public class CacheMaintenanceJob {

    private final CacheStore cacheStore;

    public CacheMaintenanceJob(CacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    @Scheduled(initialDelayString = "${acquisition.cache.sweep-interval:PT10M}",
               fixedDelayString = "${acquisition.cache.sweep-interval:PT10M}")
    public void sweep() {
        cacheStore.sweep();
    }
}
