package com.dataplatform.acquisition.provider.fred;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
record FredObservationsResponse(
    List<Observation> observations,
    @JsonProperty("error_code") Integer errorCode,
    @JsonProperty("error_message") String errorMessage
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Observation(String date, String value) {}
}
