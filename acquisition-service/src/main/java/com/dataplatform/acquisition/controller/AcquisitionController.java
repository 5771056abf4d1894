package com.dataplatform.acquisition.controller;

import com.dataplatform.acquisition.catalog.ProviderCatalog;
import com.dataplatform.acquisition.executor.AcquisitionResult;
import com.dataplatform.acquisition.executor.FailoverExecutor;
import com.dataplatform.acquisition.health.AcquisitionHealth;
import com.dataplatform.acquisition.health.AcquisitionHealthService;
import com.dataplatform.common.model.DataRequest;
import com.dataplatform.common.routing.CollectorRouter;
import com.dataplatform.common.routing.RoutingDecision;
import com.dataplatform.common.routing.ValidationResult;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST entry point for the analysis engine.
 *
 * <pre>
 *   POST /api/v1/acquisition/fetch       acquire data (cache, routing, failover)
 *   POST /api/v1/acquisition/validate    check a request without fetching
 *   POST /api/v1/acquisition/route       ordered candidate providers (diagnostic)
 *   GET  /api/v1/acquisition/health      rate limits, cache, reliability, costs
 *   GET  /api/v1/acquisition/health/ping liveness
 * </pre>
 *
 * <p>Acquisition failures are mapped to HTTP statuses by {@link AcquisitionExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/acquisition")
public class AcquisitionController {

    private static final Logger log = LoggerFactory.getLogger(AcquisitionController.class);

    private final FailoverExecutor executor;
    private final CollectorRouter router;
    private final ProviderCatalog catalog;
    private final AcquisitionHealthService healthService;

    public AcquisitionController(FailoverExecutor executor, CollectorRouter router,
                                 ProviderCatalog catalog, AcquisitionHealthService healthService) {
        this.executor = executor;
        this.router = router;
        this.catalog = catalog;
        this.healthService = healthService;
    }

    @PostMapping("/fetch")
    public Mono<ResponseEntity<AcquisitionResult>> fetch(
            @Valid @RequestBody AcquisitionRequest body,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceId) {
        DataRequest request = body.toDataRequest(traceId);
        log.info("[AcquisitionAPI] Fetch requested. dataType={} entities={} traceId={}",
                 request.dataType(), request.entityKeys().size(), request.traceId());
        return executor.acquire(request)
            .map(result -> ResponseEntity.ok()
                .header("X-Trace-Id", request.traceId())
                .body(result));
    }

    @PostMapping("/validate")
    public Mono<ValidationResult> validate(@Valid @RequestBody AcquisitionRequest body) {
        return Mono.fromSupplier(() -> router.validate(body.toDataRequest(null), catalog.providers()));
    }

    @PostMapping("/route")
    public Mono<Map<String, Object>> route(@Valid @RequestBody AcquisitionRequest body) {
        return Mono.fromSupplier(() -> {
            DataRequest request = body.toDataRequest(null);
            RoutingDecision decision = router.route(request, catalog.providers());
            List<Map<String, Object>> candidates = decision.candidates().stream()
                .map(c -> {
                    Map<String, Object> m = new LinkedHashMap<>();
                    m.put("providerId", c.providerId());
                    m.put("category", c.provider().category());
                    m.put("priority", c.priority());
                    m.put("reliability", c.provider().reliabilityScore());
                    m.put("costPerRequest", c.provider().costPerRequest());
                    return m;
                })
                .toList();
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("traceId", request.traceId());
            response.put("unroutable", decision.isEmpty());
            response.put("candidates", candidates);
            return response;
        });
    }

    @GetMapping("/health")
    public Mono<AcquisitionHealth> health() {
        return Mono.fromSupplier(healthService::snapshot);
    }

    @GetMapping("/health/ping")
    public Mono<String> ping() {
        return Mono.just("OK");
    }
}
