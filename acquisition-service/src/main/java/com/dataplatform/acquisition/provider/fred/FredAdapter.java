package com.dataplatform.acquisition.provider.fred;

import com.dataplatform.acquisition.provider.ProviderAdapter;
import com.dataplatform.acquisition.provider.ProviderPayload;
import com.dataplatform.common.exception.ErrorKind;
import com.dataplatform.common.exception.ProviderException;
import com.dataplatform.common.model.DataRequest;
import com.dataplatform.common.model.DataType;
import com.dataplatform.common.model.DateRange;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * FRED (St. Louis Fed) series observations. Entity keys are series ids such as
 * {@code UNRATE} or {@code DGS10}. Missing observations, which FRED reports as {@code "."},
 * become JSON nulls and lower the quality score.
 */
public class FredAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(FredAdapter.class);

    private static final String MISSING = ".";

    private final String providerId;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public FredAdapter(String providerId, WebClient webClient, ObjectMapper objectMapper, String apiKey) {
        this.providerId   = providerId;
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
        this.apiKey       = apiKey;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public Mono<ProviderPayload> fetch(DataRequest request) {
        if (request.dataType() != DataType.ECONOMIC_SERIES) {
            return Mono.error(new ProviderException(providerId, ErrorKind.NOT_FOUND,
                "Unsupported data type " + request.dataType()));
        }
        if (request.entityKeys().isEmpty()) {
            return Mono.error(new ProviderException(providerId, ErrorKind.NOT_FOUND,
                "FRED needs at least one series id"));
        }
        DateRange range = request.filterCriteria().dateRange();
        return Flux.fromIterable(request.entityKeys())
            .concatMap(seriesId -> fetchSeries(seriesId, range))
            .collectList()
            .map(this::combine);
    }

    private Mono<ProviderPayload> fetchSeries(String seriesId, DateRange range) {
        log.info("Fetching economic series. provider={} seriesId={} range={}", providerId, seriesId, range);
        return webClient.get()
            .uri(uriBuilder -> {
                uriBuilder.path("/fred/series/observations")
                    .queryParam("series_id", seriesId)
                    .queryParam("api_key", apiKey)
                    .queryParam("file_type", "json");
                if (range != null && range.from() != null) uriBuilder.queryParam("observation_start", range.from());
                if (range != null && range.to() != null)   uriBuilder.queryParam("observation_end", range.to());
                return uriBuilder.build();
            })
            .retrieve()
            .bodyToMono(String.class)
            .onErrorMap(WebClientResponseException.BadRequest.class, e ->
                new ProviderException(providerId, ErrorKind.NOT_FOUND,
                    "FRED rejected series " + seriesId + ": " + e.getResponseBodyAsString(), e))
            .map(json -> mapObservations(seriesId, read(json)));
    }

    ProviderPayload mapObservations(String seriesId, FredObservationsResponse response) {
        if (response.errorCode() != null) {
            throw new ProviderException(providerId, ErrorKind.NOT_FOUND,
                "FRED error " + response.errorCode() + " for series " + seriesId + ": " + response.errorMessage());
        }
        List<FredObservationsResponse.Observation> observations = response.observations();
        if (observations == null || observations.isEmpty()) {
            throw new ProviderException(providerId, ErrorKind.NOT_FOUND, "No observations for series " + seriesId);
        }
        ObjectNode node = objectMapper.createObjectNode();
        node.put("seriesId", seriesId);
        ArrayNode values = node.putArray("observations");
        int numeric = 0;
        String latestDate = null;
        Double latest = null;
        for (FredObservationsResponse.Observation o : observations) {
            ObjectNode obs = values.addObject();
            obs.put("date", o.date());
            Double v = parse(o.value());
            if (v == null) {
                obs.putNull("value");
                continue;
            }
            obs.put("value", v);
            numeric++;
            latest = v;
            latestDate = o.date();
        }
        if (latest == null) {
            throw new ProviderException(providerId, ErrorKind.INVALID_RESPONSE,
                "Series " + seriesId + " has no numeric observations");
        }
        node.put("value", latest);
        node.put("latestDate", latestDate);
        Instant asOf = LocalDate.parse(latestDate).atStartOfDay(ZoneOffset.UTC).toInstant();
        return new ProviderPayload(node, (double) numeric / observations.size(), asOf);
    }

    private ProviderPayload combine(List<ProviderPayload> perSeries) {
        if (perSeries.size() == 1) {
            return perSeries.get(0);
        }
        ObjectNode combined = objectMapper.createObjectNode();
        double quality = 0;
        Instant asOf = Instant.MAX;
        for (ProviderPayload p : perSeries) {
            combined.set(p.value().path("seriesId").asText(), p.value());
            quality += p.qualityScore();
            if (p.asOf().isBefore(asOf)) asOf = p.asOf();
        }
        return new ProviderPayload(combined, quality / perSeries.size(), asOf);
    }

    private FredObservationsResponse read(String json) {
        try {
            return objectMapper.readValue(json, FredObservationsResponse.class);
        } catch (JsonProcessingException e) {
            throw new ProviderException(providerId, ErrorKind.INVALID_RESPONSE, "Unparseable FRED response", e);
        }
    }

    private static Double parse(String raw) {
        if (raw == null || raw.isBlank() || MISSING.equals(raw.trim())) {
            return null;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
