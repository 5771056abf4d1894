package com.dataplatform.acquisition.provider.alphavantage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
record AlphaVantageQuoteResponse(
    @JsonProperty("Global Quote") GlobalQuote globalQuote,
    @JsonProperty("Note") String note,
    @JsonProperty("Information") String information,
    @JsonProperty("Error Message") String errorMessage
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    record GlobalQuote(
        @JsonProperty("01. symbol") String symbol,
        @JsonProperty("02. open") String open,
        @JsonProperty("03. high") String high,
        @JsonProperty("04. low") String low,
        @JsonProperty("05. price") String price,
        @JsonProperty("06. volume") String volume,
        @JsonProperty("07. latest trading day") String latestTradingDay,
        @JsonProperty("08. previous close") String previousClose,
        @JsonProperty("10. change percent") String changePercent
    ) {}
}
