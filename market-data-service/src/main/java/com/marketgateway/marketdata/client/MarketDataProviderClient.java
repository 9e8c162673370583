package com.marketgateway.marketdata.client;

import com.marketgateway.marketdata.model.RawCandles;
import com.marketgateway.marketdata.model.RawQuote;
import reactor.core.publisher.Mono;

/**
 * One upstream request per call. Retries, pacing and caching belong to the caller.
 *
 * <p>Failures are reported as {@link com.marketgateway.common.exception.UpstreamCallException}
 * so that the retry layer can see the HTTP status and any retry hint; an unsupported
 * resolution fails with {@link com.marketgateway.common.exception.ValidationException}
 * before any I/O.
 */
public interface MarketDataProviderClient {

    Mono<RawQuote> getQuote(String symbol);

    /**
     * @param resolution provider resolution code, see {@link FinnhubResolution}
     * @param fromUnix   range start, epoch seconds
     * @param toUnix     range end, epoch seconds
     */
    Mono<RawCandles> getCandles(String symbol, String resolution, long fromUnix, long toUnix);
}
