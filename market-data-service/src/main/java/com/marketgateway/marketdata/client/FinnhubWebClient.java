package com.marketgateway.marketdata.client;

import com.marketgateway.common.exception.UpstreamCallException;
import com.marketgateway.common.exception.ValidationException;
import com.marketgateway.common.retry.TransientFailureClassifier;
import com.marketgateway.marketdata.model.RawCandles;
import com.marketgateway.marketdata.model.RawQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Finnhub REST client backed by the shared reactive {@link WebClient}.
 *
 * <p>Every call carries the API token as the {@code token} query parameter and the same
 * fixed timeout. Transport errors are normalized into {@link UpstreamCallException}:
 * HTTP errors keep their status and {@code Retry-After} hint, connection-level faults and
 * timeouts become {@code NETWORK}, as does a response whose body stream fails mid-read;
 * unreadable bodies become {@code MALFORMED}.
 */
public class FinnhubWebClient implements MarketDataProviderClient {

    private static final Logger log = LoggerFactory.getLogger(FinnhubWebClient.class);

    private static final TransientFailureClassifier TRANSPORT_FAULTS = new NettyTransportFailureClassifier();

    private final WebClient webClient;
    private final String apiKey;
    private final Duration requestTimeout;

    public FinnhubWebClient(WebClient finnhubWebClient, String apiKey, Duration requestTimeout) {
        this.webClient      = finnhubWebClient;
        this.apiKey         = apiKey == null ? "" : apiKey;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Mono<RawQuote> getQuote(String symbol) {
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/quote")
                .queryParam("symbol", symbol)
                .queryParam("token", apiKey)
                .build())
            .retrieve()
            .bodyToMono(RawQuote.class)
            .switchIfEmpty(Mono.error(() -> UpstreamCallException.malformed("empty quote body", null)))
            .timeout(requestTimeout)
            .onErrorMap(FinnhubWebClient::normalize)
            .doOnError(e -> log.warn("Finnhub quote call failed. symbol={} reason={}", symbol, e.getMessage()));
    }

    @Override
    public Mono<RawCandles> getCandles(String symbol, String resolution, long fromUnix, long toUnix) {
        if (FinnhubResolution.fromCode(resolution).isEmpty()) {
            return Mono.error(new ValidationException("Invalid resolution: " + resolution));
        }
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/stock/candle")
                .queryParam("symbol", symbol)
                .queryParam("resolution", resolution)
                .queryParam("from", fromUnix)
                .queryParam("to", toUnix)
                .queryParam("token", apiKey)
                .build())
            .retrieve()
            .bodyToMono(RawCandles.class)
            .switchIfEmpty(Mono.error(() -> UpstreamCallException.malformed("empty candle body", null)))
            .timeout(requestTimeout)
            .onErrorMap(FinnhubWebClient::normalize)
            .doOnError(e -> log.warn("Finnhub candle call failed. symbol={} resolution={} reason={}",
                                     symbol, resolution, e.getMessage()));
    }

    // ── error normalization ─────────────────────────────────────────────────

    static Throwable normalize(Throwable error) {
        if (error instanceof UpstreamCallException) {
            return error;
        }
        if (error instanceof WebClientResponseException response) {
            // a body read cut short surfaces with the status already received, often 200
            if (response.getStatusCode().is2xxSuccessful() || isTransportFault(response.getCause())) {
                return UpstreamCallException.network(response.getCause() != null ? response.getCause() : response);
            }
            return UpstreamCallException.http(
                response.getStatusCode().value(),
                parseRetryAfter(response.getHeaders()),
                response);
        }
        if (error instanceof WebClientRequestException || error instanceof TimeoutException) {
            return UpstreamCallException.network(error);
        }
        if (error instanceof CodecException) {
            return UpstreamCallException.malformed(error.getMessage(), error);
        }
        if (isTransportFault(error)) {
            return UpstreamCallException.network(error);
        }
        return error;
    }

    private static boolean isTransportFault(Throwable cause) {
        return cause != null && TRANSPORT_FAULTS.isTransient(cause);
    }

    /** {@code Retry-After} in whole seconds; HTTP-date values are ignored. */
    static Duration parseRetryAfter(HttpHeaders headers) {
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds > 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After header value={}", value);
            return null;
        }
    }
}
