package com.marketgateway.marketdata.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Finnhub {@code GET /quote} payload. Every field may be absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawQuote(
    @JsonProperty("c")  Double current,
    @JsonProperty("d")  Double change,
    @JsonProperty("dp") Double changePercent,
    @JsonProperty("h")  Double high,
    @JsonProperty("l")  Double low,
    @JsonProperty("o")  Double open,
    @JsonProperty("pc") Double previousClose,
    @JsonProperty("t")  Double timestamp   // epoch seconds
) {}
