package com.marketgateway.marketdata.config;

import java.time.Duration;

/**
 * Fetch-layer tuning, read once at startup.
 *
 * @param quoteTtl         how long a quote is served from cache without refetching
 * @param chartTtl         same for candle series, which are costlier to refetch
 * @param maxStale         how long past its TTL an entry may still be served after a failed fetch
 * @param maxBatchSymbols  upper bound on symbols in one batch quote request
 * @param batchConcurrency parallel single-quote fetches per batch limiter
 * @param maxAttempts      upstream attempts per fetch, first one included
 * @param baseBackoff      delay after the first failed attempt; doubles on each further failure
 */
public record MarketDataSettings(
    Duration quoteTtl,
    Duration chartTtl,
    Duration maxStale,
    int maxBatchSymbols,
    int batchConcurrency,
    int maxAttempts,
    Duration baseBackoff
) {
    public static MarketDataSettings defaults() {
        return new MarketDataSettings(
            Duration.ofSeconds(5),
            Duration.ofSeconds(60),
            Duration.ofSeconds(120),
            25,
            3,
            3,
            Duration.ofSeconds(1));
    }
}
