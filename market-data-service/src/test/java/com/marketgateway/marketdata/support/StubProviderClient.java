package com.marketgateway.marketdata.support;

import com.marketgateway.marketdata.client.MarketDataProviderClient;
import com.marketgateway.marketdata.model.RawCandles;
import com.marketgateway.marketdata.model.RawQuote;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** Scriptable provider that counts every upstream attempt. */
public class StubProviderClient implements MarketDataProviderClient {

    public record CandleRequest(String symbol, String resolution, long from, long to) {}

    private final AtomicInteger quoteCalls = new AtomicInteger();
    private final AtomicInteger candleCalls = new AtomicInteger();
    private final Map<String, AtomicInteger> quoteCallsBySymbol = new ConcurrentHashMap<>();
    private final List<CandleRequest> candleRequests = new CopyOnWriteArrayList<>();

    private volatile Function<String, Mono<RawQuote>> quoteResponder = symbol -> Mono.just(quote(100.0));
    private volatile Function<CandleRequest, Mono<RawCandles>> candleResponder =
        request -> Mono.just(candles(List.of(1_709_300_000d), List.of(10d)));

    @Override
    public Mono<RawQuote> getQuote(String symbol) {
        quoteCalls.incrementAndGet();
        quoteCallsBySymbol.computeIfAbsent(symbol, s -> new AtomicInteger()).incrementAndGet();
        return Mono.defer(() -> quoteResponder.apply(symbol));
    }

    @Override
    public Mono<RawCandles> getCandles(String symbol, String resolution, long fromUnix, long toUnix) {
        candleCalls.incrementAndGet();
        CandleRequest request = new CandleRequest(symbol, resolution, fromUnix, toUnix);
        candleRequests.add(request);
        return Mono.defer(() -> candleResponder.apply(request));
    }

    public void onQuote(Function<String, Mono<RawQuote>> responder) {
        this.quoteResponder = responder;
    }

    public void onCandles(Function<CandleRequest, Mono<RawCandles>> responder) {
        this.candleResponder = responder;
    }

    public int quoteCalls() {
        return quoteCalls.get();
    }

    public int quoteCalls(String symbol) {
        AtomicInteger count = quoteCallsBySymbol.get(symbol);
        return count == null ? 0 : count.get();
    }

    public int candleCalls() {
        return candleCalls.get();
    }

    public List<CandleRequest> candleRequests() {
        return candleRequests;
    }

    // ── fixtures ────────────────────────────────────────────────────────────

    public static RawQuote quote(double price) {
        return new RawQuote(price, 1.5, 1.52, price + 2, price - 2, price - 1, price - 1.5, 1_709_303_400d);
    }

    /** Candles whose open/high/low/volume are derived from the close. */
    public static RawCandles candles(List<Double> times, List<Double> closes) {
        return new RawCandles(times, closes, closes, closes, closes, closes, RawCandles.STATUS_OK);
    }
}
