package com.marketgateway.marketdata.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Candle series for one symbol, interval and range. Candles are strictly ascending
 * and unique by {@link Candle#time()}.
 */
public record NormalizedChart(
    String symbol,
    String market,
    String source,
    Instant fetchedAt,
    String interval,
    int rangeDays,
    List<Candle> candles,
    boolean stale
) {
    public NormalizedChart {
        candles = List.copyOf(candles);
    }

    @JsonProperty("candleCount")
    public int candleCount() {
        return candles.size();
    }

    public NormalizedChart withStale(boolean stale) {
        return new NormalizedChart(symbol, market, source, fetchedAt, interval, rangeDays, candles, stale);
    }
}
