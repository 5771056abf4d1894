package com.dataplatform.acquisition.config;

import com.dataplatform.acquisition.provider.ProviderAdapter;
import com.dataplatform.acquisition.provider.ProviderAdapterRegistry;
import com.dataplatform.acquisition.provider.alphavantage.AlphaVantageAdapter;
import com.dataplatform.acquisition.provider.fred.FredAdapter;
import com.dataplatform.common.trace.TraceContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Builds one adapter per enabled catalog entry that names a known {@code adapter} type.
 * Entries without an adapter stay routable but fail over immediately when picked.
 */
@Configuration
public class ProviderAdapterConfig {

    private static final Logger log = LoggerFactory.getLogger(ProviderAdapterConfig.class);

    static final String ALPHA_VANTAGE = "alpha-vantage";
    static final String FRED          = "fred";

    @Bean
    public ProviderAdapterRegistry providerAdapterRegistry(AcquisitionProperties properties,
                                                           WebClient.Builder builder,
                                                           ObjectMapper objectMapper) {
        List<ProviderAdapter> adapters = new ArrayList<>();
        for (AcquisitionProperties.Provider p : properties.getProviders()) {
            if (!p.isEnabled() || p.getAdapter() == null) {
                continue;
            }
            switch (p.getAdapter()) {
                case ALPHA_VANTAGE -> adapters.add(new AlphaVantageAdapter(p.getId(),
                    webClient(builder, baseUrl(p, "https://www.alphavantage.co"), p.getTimeout()),
                    objectMapper, p.getApiKey()));
                case FRED -> adapters.add(new FredAdapter(p.getId(),
                    webClient(builder, baseUrl(p, "https://api.stlouisfed.org"), p.getTimeout()),
                    objectMapper, p.getApiKey()));
                default -> throw new IllegalArgumentException(
                    "Unknown adapter '" + p.getAdapter() + "' for provider " + p.getId());
            }
            log.info("ADAPTER_CREATED provider={} adapter={}", p.getId(), p.getAdapter());
        }
        return new ProviderAdapterRegistry(adapters);
    }

    private static String baseUrl(AcquisitionProperties.Provider p, String fallback) {
        return p.getBaseUrl() == null || p.getBaseUrl().isBlank() ? fallback : p.getBaseUrl();
    }

    /**
     * The executor's {@code Mono.timeout} is the authoritative per-call timeout; the socket
     * timeouts here only stop connections from hanging past it.
     */
    private static WebClient webClient(WebClient.Builder builder, String baseUrl, Duration timeout) {
        Duration socketTimeout = timeout.plusSeconds(5);
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(socketTimeout)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(socketTimeout.toMillis(), TimeUnit.MILLISECONDS))
            );

        return builder.clone()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    /** Logs the outbound call, api key masked, under the trace id the executor put in the Reactor Context. */
    static ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> Mono.deferContextual(ctx -> {
            String sanitized = sanitize(clientRequest.url().toString());
            TraceContext.withMdc(TraceContext.traceId(ctx), () ->
                log.debug("Outbound request: {} {}", clientRequest.method(), sanitized));
            return Mono.just(clientRequest);
        }));
    }

    static String sanitize(String uri) {
        return uri.replaceAll("(?i)(apikey|api_key)=[^&]+", "$1=***");
    }
}
