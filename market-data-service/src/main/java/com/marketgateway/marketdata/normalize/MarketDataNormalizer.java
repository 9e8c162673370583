package com.marketgateway.marketdata.normalize;

import com.marketgateway.marketdata.model.Candle;
import com.marketgateway.marketdata.model.NormalizedQuote;
import com.marketgateway.marketdata.model.RawCandles;
import com.marketgateway.marketdata.model.RawQuote;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts raw Finnhub payloads into the provider-independent model.
 *
 * <p>Stateless and side-effect free. Missing or non-finite numbers become {@code null}
 * for quotes; for candles, rows without a finite time or close are dropped and the
 * remaining OHLC gaps are filled from the close.
 */
public final class MarketDataNormalizer {

    public static final String MARKET   = "US";
    public static final String SOURCE   = "finnhub";
    public static final String CURRENCY = "USD";

    private MarketDataNormalizer() {}

    public static NormalizedQuote toQuote(RawQuote raw, String symbol, Instant fetchedAt) {
        return new NormalizedQuote(
            symbol,
            MARKET,
            SOURCE,
            fetchedAt,
            finiteOrNull(raw.current()),
            CURRENCY,
            finiteOrNull(raw.open()),
            finiteOrNull(raw.previousClose()),
            finiteOrNull(raw.high()),
            finiteOrNull(raw.low()),
            finiteOrNull(raw.change()),
            finiteOrNull(raw.changePercent()),
            epochSecondsOrNull(raw.timestamp()),
            false
        );
    }

    /**
     * Zips the parallel arrays (truncated to the shortest), drops unusable rows, sorts by
     * time and keeps the first candle for each distinct time.
     */
    public static List<Candle> toCandles(RawCandles raw) {
        int len = minLength(raw.time(), raw.open(), raw.high(), raw.low(), raw.close(), raw.volume());

        List<Candle> rows = new ArrayList<>(len);
        for (int i = 0; i < len; i++) {
            Double ts    = raw.time().get(i);
            Double close = raw.close().get(i);
            if (!isFinite(ts) || !isFinite(close)) {
                continue;
            }
            rows.add(new Candle(
                toInstant(ts),
                orDefault(raw.open().get(i), close),
                orDefault(raw.high().get(i), close),
                orDefault(raw.low().get(i), close),
                close,
                finiteOrNull(raw.volume().get(i))
            ));
        }

        // stable sort: equal times keep provider order, so "first" is well defined
        rows.sort(Comparator.comparing(Candle::time));

        Set<Instant> seen = new HashSet<>();
        List<Candle> unique = new ArrayList<>(rows.size());
        for (Candle candle : rows) {
            if (seen.add(candle.time())) {
                unique.add(candle);
            }
        }
        return List.copyOf(unique);
    }

    static Double finiteOrNull(Double value) {
        return isFinite(value) ? value : null;
    }

    private static Instant epochSecondsOrNull(Double seconds) {
        return isFinite(seconds) ? toInstant(seconds) : null;
    }

    private static Instant toInstant(double epochSeconds) {
        return Instant.ofEpochMilli(Math.round(epochSeconds * 1000d));
    }

    private static double orDefault(Double value, double fallback) {
        return isFinite(value) ? value : fallback;
    }

    private static boolean isFinite(Double value) {
        return value != null && Double.isFinite(value);
    }

    @SafeVarargs
    private static int minLength(List<Double>... arrays) {
        int min = Integer.MAX_VALUE;
        for (List<Double> array : arrays) {
            min = Math.min(min, array == null ? 0 : array.size());
        }
        return min;
    }
}
