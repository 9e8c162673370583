package com.marketgateway.marketdata.model;

import java.time.Instant;

/**
 * Provider-independent quote. Numeric fields are {@code null} when the provider
 * value is missing or not finite; they are never coerced to zero.
 */
public record NormalizedQuote(
    String symbol,
    String market,
    String source,
    Instant fetchedAt,
    Double price,
    String currency,
    Double open,
    Double previousClose,
    Double dayHigh,
    Double dayLow,
    Double change,
    Double changePercent,
    Instant timestamp,
    boolean stale
) {
    public NormalizedQuote withStale(boolean stale) {
        return new NormalizedQuote(symbol, market, source, fetchedAt, price, currency, open,
            previousClose, dayHigh, dayLow, change, changePercent, timestamp, stale);
    }
}
