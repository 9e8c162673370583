package com.marketgateway.marketdata.service;

import com.marketgateway.common.cache.CacheLookup;
import com.marketgateway.common.cache.FreshnessCache;
import com.marketgateway.common.coalesce.RequestCoalescer;
import com.marketgateway.common.exception.MarketDataException;
import com.marketgateway.common.exception.ProviderException;
import com.marketgateway.common.exception.UpstreamCallException;
import com.marketgateway.common.exception.UpstreamErrorTranslator;
import com.marketgateway.common.exception.ValidationException;
import com.marketgateway.common.limiter.ConcurrencyLimiter;
import com.marketgateway.common.limiter.RequestPacer;
import com.marketgateway.common.retry.RetryPolicy;
import com.marketgateway.marketdata.client.MarketDataProviderClient;
import com.marketgateway.marketdata.config.MarketDataSettings;
import com.marketgateway.marketdata.model.Candle;
import com.marketgateway.marketdata.model.NormalizedChart;
import com.marketgateway.marketdata.model.NormalizedQuote;
import com.marketgateway.marketdata.normalize.MarketDataNormalizer;
import com.marketgateway.marketdata.params.RangeDays;
import com.marketgateway.marketdata.params.UsInterval;
import com.marketgateway.marketdata.params.UsSymbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * US market data backed by Finnhub, with caching, coalescing and stale-if-error.
 *
 * <p><strong>Flow per resource key:</strong>
 * <ol>
 *   <li>Fresh cache hit → return immediately, no upstream call.</li>
 *   <li>Miss → join or start the coalesced fetch for the key. The fetch re-checks the
 *       cache first, then calls the provider through the {@link RequestPacer} and the
 *       {@link RetryPolicy}.</li>
 *   <li>Success → normalize, store with the resource TTL, return.</li>
 *   <li>Failure → serve the cached value tagged {@code stale=true} if it expired less
 *       than {@code maxStale} ago; otherwise surface the classified error.</li>
 * </ol>
 *
 * <p>Batch quotes fan out to the single-quote path through a {@link ConcurrencyLimiter}.
 * All cache, coalescer and limiter state is owned by this instance.
 */
@Service
public class UsMarketService {

    private static final Logger log = LoggerFactory.getLogger(UsMarketService.class);

    private static final long SECONDS_PER_DAY = 86_400L;

    private final MarketDataProviderClient client;
    private final RequestPacer pacer;
    private final RetryPolicy retryPolicy;
    private final MarketDataSettings settings;
    private final Clock clock;

    private final FreshnessCache<NormalizedQuote> quoteCache;
    private final FreshnessCache<NormalizedChart> chartCache;
    private final RequestCoalescer coalescer = new RequestCoalescer();
    private final ConcurrencyLimiter quotesLimiter;

    public UsMarketService(MarketDataProviderClient client,
                           RequestPacer pacer,
                           RetryPolicy retryPolicy,
                           MarketDataSettings settings,
                           Clock clock) {
        this.client        = client;
        this.pacer         = pacer;
        this.retryPolicy   = retryPolicy;
        this.settings      = settings;
        this.clock         = clock;
        this.quoteCache    = new FreshnessCache<>(settings.maxStale(), clock);
        this.chartCache    = new FreshnessCache<>(settings.maxStale(), clock);
        this.quotesLimiter = new ConcurrencyLimiter(settings.batchConcurrency());
    }

    // ── quotes ──────────────────────────────────────────────────────────────

    public Mono<NormalizedQuote> getQuote(String symbolInput) {
        return Mono.defer(() -> {
            String symbol = UsSymbols.normalize(symbolInput);
            String key = quoteKey(symbol);

            Optional<NormalizedQuote> cached = quoteCache.get(key);
            if (cached.isPresent()) {
                log.debug("CACHE_HIT key={}", key);
                return Mono.just(cached.get());
            }

            log.debug("CACHE_MISS key={}", key);
            return coalescer.run(key, () -> fetchQuote(symbol, key))
                .onErrorResume(e -> staleOrError(quoteCache, key, e, q -> q.withStale(true)));
        });
    }

    /**
     * Quotes for several symbols. Input is normalized and deduplicated (first occurrence
     * wins); results follow the deduplicated input order.
     */
    public Mono<List<NormalizedQuote>> getQuotes(List<String> symbolInputs) {
        return Mono.defer(() -> {
            if (symbolInputs.size() > settings.maxBatchSymbols()) {
                return Mono.error(new ValidationException(
                    "At most " + settings.maxBatchSymbols() + " symbols allowed"));
            }
            List<String> unique = symbolInputs.stream()
                .map(UsSymbols::normalize)
                .distinct()
                .toList();
            if (unique.isEmpty()) {
                return Mono.just(List.<NormalizedQuote>of());
            }

            log.debug("BATCH_QUOTES requested={} unique={}", symbolInputs.size(), unique.size());
            return Flux.fromIterable(unique)
                .flatMapSequential(symbol -> quotesLimiter.schedule(() -> getQuote(symbol)), unique.size())
                .collectList();
        });
    }

    private Mono<NormalizedQuote> fetchQuote(String symbol, String key) {
        Optional<NormalizedQuote> recheck = quoteCache.get(key);
        if (recheck.isPresent()) {
            return Mono.just(recheck.get());
        }
        Instant fetchedAt = clock.instant();
        return callProvider(() -> client.getQuote(symbol))
            .map(raw -> MarketDataNormalizer.toQuote(raw, symbol, fetchedAt))
            .doOnNext(quote -> {
                quoteCache.set(key, quote, settings.quoteTtl());
                log.info("CACHE_REFRESH key={} price={} ttlMs={}", key, quote.price(), settings.quoteTtl().toMillis());
            });
    }

    // ── charts ──────────────────────────────────────────────────────────────

    /**
     * @param intervalInput one of {@code 1m, 5m, 15m, 30m, 1h, 1d}; blank means {@code 1h}
     * @param rangeDays     calendar days back from now, 1 to 365
     */
    public Mono<NormalizedChart> getChart(String symbolInput, String intervalInput, int rangeDays) {
        return Mono.defer(() -> {
            String symbol = UsSymbols.normalize(symbolInput);
            UsInterval interval = UsInterval.parse(intervalInput);
            RangeDays.validate(rangeDays);
            String key = chartKey(symbol, interval, rangeDays);

            Optional<NormalizedChart> cached = chartCache.get(key);
            if (cached.isPresent()) {
                log.debug("CACHE_HIT key={}", key);
                return Mono.just(cached.get());
            }

            log.debug("CACHE_MISS key={}", key);
            return coalescer.run(key, () -> fetchChart(symbol, interval, rangeDays, key))
                .onErrorResume(e -> staleOrError(chartCache, key, e, c -> c.withStale(true)));
        });
    }

    private Mono<NormalizedChart> fetchChart(String symbol, UsInterval interval, int rangeDays, String key) {
        Optional<NormalizedChart> recheck = chartCache.get(key);
        if (recheck.isPresent()) {
            return Mono.just(recheck.get());
        }
        Instant fetchedAt = clock.instant();
        long to   = fetchedAt.getEpochSecond();
        long from = to - rangeDays * SECONDS_PER_DAY;

        return callProvider(() -> client.getCandles(symbol, interval.resolution().code(), from, to))
            .map(raw -> {
                if (!raw.isOk()) {
                    throw new ProviderException("Data provider returned no data or error status");
                }
                List<Candle> candles = MarketDataNormalizer.toCandles(raw);
                return new NormalizedChart(symbol, MarketDataNormalizer.MARKET, MarketDataNormalizer.SOURCE,
                    fetchedAt, interval.label(), rangeDays, candles, false);
            })
            .doOnNext(chart -> {
                chartCache.set(key, chart, settings.chartTtl());
                log.info("CACHE_REFRESH key={} candles={} ttlMs={}", key, chart.candleCount(), settings.chartTtl().toMillis());
            });
    }

    // ── maintenance ─────────────────────────────────────────────────────────

    /** Drops cache entries past their stale deadline. */
    public int evictExpired() {
        return quoteCache.evictExpired() + chartCache.evictExpired();
    }

    public int cachedEntryCount() {
        return quoteCache.size() + chartCache.size();
    }

    // ── shared plumbing ─────────────────────────────────────────────────────

    /** One logical provider call: every attempt is paced, failures are retried then translated. */
    private <T> Mono<T> callProvider(Supplier<Mono<T>> call) {
        return retryPolicy.execute(() -> pacer.schedule(call), settings.maxAttempts(), settings.baseBackoff())
            .switchIfEmpty(Mono.error(() -> UpstreamCallException.malformed("no response", null)))
            .onErrorMap(UpstreamErrorTranslator::translate);
    }

    private <V> Mono<V> staleOrError(FreshnessCache<V> cache, String key, Throwable error,
                                     UnaryOperator<V> markStale) {
        Optional<CacheLookup<V>> lookup = cache.getWithStale(key, settings.maxStale());
        if (lookup.isPresent()) {
            CacheLookup<V> hit = lookup.get();
            if (!hit.stale()) {
                return Mono.just(hit.value());
            }
            log.warn("STALE_SERVED key={} fetchedAt={} reason={}", key, hit.fetchedAt(), error.getMessage());
            return Mono.just(markStale.apply(hit.value()));
        }
        MarketDataException classified = UpstreamErrorTranslator.translate(error);
        log.warn("FETCH_FAILED key={} code={} reason={}", key, classified.getCode(), error.getMessage());
        return Mono.error(classified);
    }

    static String quoteKey(String symbol) {
        return "us:quote:" + symbol;
    }

    static String chartKey(String symbol, UsInterval interval, int rangeDays) {
        return "us:chart:" + symbol + ":" + interval.label() + ":" + rangeDays;
    }
}
