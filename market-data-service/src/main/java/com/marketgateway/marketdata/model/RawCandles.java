package com.marketgateway.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Finnhub {@code GET /stock/candle} payload: parallel arrays plus a status flag.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawCandles(
    @JsonProperty("t") List<Double> time,      // epoch seconds
    @JsonProperty("o") List<Double> open,
    @JsonProperty("h") List<Double> high,
    @JsonProperty("l") List<Double> low,
    @JsonProperty("c") List<Double> close,
    @JsonProperty("v") List<Double> volume,
    @JsonProperty("s") String status
) {
    public static final String STATUS_OK = "ok";

    public boolean isOk() {
        return STATUS_OK.equals(status);
    }
}
