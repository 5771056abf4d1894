package com.dataplatform.acquisition.job;

import com.dataplatform.acquisition.config.AcquisitionProperties;
import com.dataplatform.acquisition.executor.FailoverExecutor;
import com.dataplatform.common.model.DataRequest;
import com.dataplatform.common.model.FilterCriteria;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Keeps configured hot keys warm by pushing them through the {@link FailoverExecutor}
 * on a fixed loop:
 * <pre>
 *   delay(interval) → acquire every warm-up request → repeat
 * </pre>
 *
 * <p>Each cycle is a fresh {@link Mono} pipeline whose terminal {@code subscribe()} schedules
 * the next one. Failures of individual requests are logged and absorbed so the loop never
 * stops. Disabled unless {@code acquisition.warmup.enabled=true}.
 */
@Component
public class CacheWarmupScheduler {

    private static final Logger log = LoggerFactory.getLogger(CacheWarmupScheduler.class);

    private final FailoverExecutor executor;
    private final AcquisitionProperties.Warmup settings;

    private volatile Disposable current;
    private volatile boolean stopped;

    public CacheWarmupScheduler(FailoverExecutor executor, AcquisitionProperties properties) {
        this.executor = executor;
        this.settings = properties.getWarmup();
    }

    @PostConstruct
    public void start() {
        if (!settings.isEnabled() || settings.getRequests().isEmpty()) {
            log.info("CACHE_WARMUP_DISABLED enabled={} requests={}",
                     settings.isEnabled(), settings.getRequests().size());
            return;
        }
        log.info("CACHE_WARMUP_STARTED requests={} intervalSeconds={}",
                 settings.getRequests().size(), settings.getInterval().toSeconds());
        scheduleNextCycle(settings.getInitialDelay());
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        Disposable d = current;
        if (d != null) {
            d.dispose();
        }
    }

    private void scheduleNextCycle(Duration delay) {
        if (stopped) {
            return;
        }
        current = Mono.delay(delay)
            .then(runCycle())
            .subscribe(
                warmed -> {
                    log.info("CACHE_WARMUP_CYCLE warmed={} of={}", warmed, settings.getRequests().size());
                    scheduleNextCycle(settings.getInterval());
                },
                err -> {
                    log.error("Warm-up cycle failed, rescheduling", err);
                    scheduleNextCycle(settings.getInterval());
                });
    }

    Mono<Long> runCycle() {
        List<DataRequest> requests = settings.getRequests().stream()
            .map(CacheWarmupScheduler::toDataRequest)
            .toList();
        return Flux.fromIterable(requests)
            .concatMap(request -> executor.acquire(request)
                .map(result -> 1L)
                .onErrorResume(e -> {
                    log.warn("CACHE_WARMUP_FAILED request={} error={}", request.dataType(), e.getMessage());
                    return Mono.just(0L);
                }))
            .reduce(0L, Long::sum);
    }

    static DataRequest toDataRequest(AcquisitionProperties.WarmupRequest w) {
        FilterCriteria criteria = FilterCriteria.empty().withSector(w.getSector());
        return DataRequest.of(w.getDataType(), w.getEntityKeys(), criteria);
    }
}
