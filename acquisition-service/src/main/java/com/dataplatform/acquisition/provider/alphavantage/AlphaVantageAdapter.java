package com.dataplatform.acquisition.provider.alphavantage;

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
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Alpha Vantage: {@code GLOBAL_QUOTE} for quotes, {@code TIME_SERIES_DAILY} for daily bars.
 *
 * <p>Alpha Vantage answers throttling and unknown symbols with HTTP 200 and a {@code Note},
 * {@code Information} or {@code Error Message} field; those are mapped to
 * {@link ErrorKind#RATE_LIMITED} and {@link ErrorKind#NOT_FOUND}. Several entity keys are
 * fetched one by one and returned as an object keyed by symbol.
 */
public class AlphaVantageAdapter implements ProviderAdapter {

    private static final Logger log = LoggerFactory.getLogger(AlphaVantageAdapter.class);

    private static final int MAX_BARS = 100;

    private final String providerId;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public AlphaVantageAdapter(String providerId, WebClient webClient, ObjectMapper objectMapper, String apiKey) {
        this.providerId   = providerId;
        this.webClient    = webClient;
        this.objectMapper = objectMapper;
        this.apiKey       = apiKey == null || apiKey.isBlank() ? "demo" : apiKey;
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public Mono<ProviderPayload> fetch(DataRequest request) {
        if (request.entityKeys().isEmpty()) {
            return Mono.error(new ProviderException(providerId, ErrorKind.NOT_FOUND,
                "Alpha Vantage needs at least one symbol"));
        }
        if (request.dataType() != DataType.QUOTE && request.dataType() != DataType.DAILY_SERIES) {
            return Mono.error(new ProviderException(providerId, ErrorKind.NOT_FOUND,
                "Unsupported data type " + request.dataType()));
        }
        return Flux.fromIterable(request.entityKeys())
            .concatMap(symbol -> request.dataType() == DataType.QUOTE
                ? fetchQuote(symbol)
                : fetchDaily(symbol, request.filterCriteria().dateRange()))
            .collectList()
            .map(this::combine);
    }

    // ── GLOBAL_QUOTE ─────────────────────────────────────────────────────────

    private Mono<ProviderPayload> fetchQuote(String symbol) {
        log.info("Fetching quote. provider={} symbol={}", providerId, symbol);
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/query")
                .queryParam("function", "GLOBAL_QUOTE")
                .queryParam("symbol", symbol)
                .queryParam("apikey", apiKey)
                .build())
            .retrieve()
            .bodyToMono(String.class)
            .map(json -> read(json, AlphaVantageQuoteResponse.class))
            .map(response -> mapQuote(symbol, response));
    }

    ProviderPayload mapQuote(String symbol, AlphaVantageQuoteResponse response) {
        checkNotice(symbol, response.note(), response.information(), response.errorMessage());
        AlphaVantageQuoteResponse.GlobalQuote q = response.globalQuote();
        if (q == null || q.price() == null) {
            throw new ProviderException(providerId, ErrorKind.NOT_FOUND, "No quote for symbol " + symbol);
        }
        ObjectNode node = objectMapper.createObjectNode();
        node.put("symbol", symbol);
        int present = 0;
        present += putNumber(node, "price", q.price());
        present += putNumber(node, "open", q.open());
        present += putNumber(node, "high", q.high());
        present += putNumber(node, "low", q.low());
        present += putNumber(node, "volume", q.volume());
        present += putNumber(node, "previousClose", q.previousClose());
        present += putNumber(node, "changePercent", q.changePercent() == null ? null
            : q.changePercent().replace("%", ""));
        node.put("latestTradingDay", q.latestTradingDay());
        Instant asOf = q.latestTradingDay() == null ? Instant.now()
            : LocalDate.parse(q.latestTradingDay()).atStartOfDay(ZoneOffset.UTC).toInstant();
        return new ProviderPayload(node, present / 7.0, asOf);
    }

    // ── TIME_SERIES_DAILY ────────────────────────────────────────────────────

    private Mono<ProviderPayload> fetchDaily(String symbol, DateRange range) {
        boolean full = range != null && range.from() != null
            && range.from().isBefore(LocalDate.now(ZoneOffset.UTC).minusDays(140));
        log.info("Fetching daily series. provider={} symbol={} outputsize={}",
                 providerId, symbol, full ? "full" : "compact");
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/query")
                .queryParam("function", "TIME_SERIES_DAILY")
                .queryParam("symbol", symbol)
                .queryParam("outputsize", full ? "full" : "compact")
                .queryParam("apikey", apiKey)
                .build())
            .retrieve()
            .bodyToMono(String.class)
            .map(json -> read(json, AlphaVantageDailyResponse.class))
            .map(response -> mapDaily(symbol, range, response));
    }

    ProviderPayload mapDaily(String symbol, DateRange range, AlphaVantageDailyResponse response) {
        checkNotice(symbol, response.note(), response.information(), response.errorMessage());
        if (response.timeSeriesDaily() == null || response.timeSeriesDaily().isEmpty()) {
            throw new ProviderException(providerId, ErrorKind.NOT_FOUND, "Empty daily series for symbol " + symbol);
        }
        TreeMap<String, AlphaVantageDailyResponse.OhlcvData> sorted = new TreeMap<>((a, b) -> b.compareTo(a));
        sorted.putAll(response.timeSeriesDaily());

        ObjectNode node = objectMapper.createObjectNode();
        node.put("symbol", symbol);
        ArrayNode bars = node.putArray("bars");
        int complete = 0;
        for (Map.Entry<String, AlphaVantageDailyResponse.OhlcvData> e : sorted.entrySet()) {
            LocalDate day = LocalDate.parse(e.getKey());
            if (range != null && ((range.to() != null && day.isAfter(range.to()))
                               || (range.from() != null && day.isBefore(range.from())))) {
                continue;
            }
            if (bars.size() == MAX_BARS && range == null) {
                break;
            }
            ObjectNode bar = bars.addObject();
            bar.put("date", e.getKey());
            AlphaVantageDailyResponse.OhlcvData d = e.getValue();
            int fields = putNumber(bar, "open", d.open()) + putNumber(bar, "high", d.high())
                + putNumber(bar, "low", d.low()) + putNumber(bar, "close", d.close())
                + putNumber(bar, "volume", d.volume());
            if (fields == 5) complete++;
        }
        if (bars.isEmpty()) {
            throw new ProviderException(providerId, ErrorKind.NOT_FOUND,
                "No daily bars in range " + range + " for symbol " + symbol);
        }
        node.set("latestClose", bars.get(0).get("close"));
        Instant asOf = LocalDate.parse(bars.get(0).get("date").asText()).atStartOfDay(ZoneOffset.UTC).toInstant();
        return new ProviderPayload(node, (double) complete / bars.size(), asOf);
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private ProviderPayload combine(List<ProviderPayload> perSymbol) {
        if (perSymbol.size() == 1) {
            return perSymbol.get(0);
        }
        ObjectNode combined = objectMapper.createObjectNode();
        double quality = 0;
        Instant asOf = Instant.MAX;
        for (ProviderPayload p : perSymbol) {
            combined.set(p.value().path("symbol").asText(), p.value());
            quality += p.qualityScore();
            if (p.asOf().isBefore(asOf)) asOf = p.asOf();
        }
        return new ProviderPayload(combined, quality / perSymbol.size(), asOf);
    }

    private void checkNotice(String symbol, String note, String information, String errorMessage) {
        if (errorMessage != null) {
            throw new ProviderException(providerId, ErrorKind.NOT_FOUND,
                "Alpha Vantage rejected symbol " + symbol + ": " + errorMessage);
        }
        if (note != null || information != null) {
            log.warn("Alpha Vantage throttled. provider={} symbol={} notice={}",
                     providerId, symbol, note != null ? note : information);
            throw new ProviderException(providerId, ErrorKind.RATE_LIMITED,
                "Alpha Vantage call frequency exceeded");
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ProviderException(providerId, ErrorKind.INVALID_RESPONSE,
                "Unparseable Alpha Vantage response", e);
        }
    }

    private static int putNumber(ObjectNode node, String field, String raw) {
        if (raw == null || raw.isBlank()) {
            node.putNull(field);
            return 0;
        }
        try {
            node.put(field, Double.parseDouble(raw.trim()));
            return 1;
        } catch (NumberFormatException e) {
            node.putNull(field);
            return 0;
        }
    }
}
