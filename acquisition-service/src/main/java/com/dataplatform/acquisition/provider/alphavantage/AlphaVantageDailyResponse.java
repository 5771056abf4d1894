package com.dataplatform.acquisition.provider.alphavantage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
record AlphaVantageDailyResponse(
    @JsonProperty("Meta Data") MetaData metaData,
    @JsonProperty("Time Series (Daily)") Map<String, OhlcvData> timeSeriesDaily,
    @JsonProperty("Note") String note,
    @JsonProperty("Information") String information,
    @JsonProperty("Error Message") String errorMessage
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    record MetaData(
        @JsonProperty("2. Symbol") String symbol,
        @JsonProperty("3. Last Refreshed") String lastRefreshed
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OhlcvData(
        @JsonProperty("1. open") String open,
        @JsonProperty("2. high") String high,
        @JsonProperty("3. low") String low,
        @JsonProperty("4. close") String close,
        @JsonProperty("5. volume") String volume
    ) {}
}
