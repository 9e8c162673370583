package com.marketgateway.marketdata.normalize;

import com.marketgateway.marketdata.model.Candle;
import com.marketgateway.marketdata.model.NormalizedQuote;
import com.marketgateway.marketdata.model.RawCandles;
import com.marketgateway.marketdata.model.RawQuote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarketDataNormalizerTest {

    private static final Instant FETCHED_AT = Instant.parse("2024-03-01T15:00:00Z");

    private static List<Double> list(Double... values) {
        return Arrays.asList(values);
    }

    @Nested
    @DisplayName("quotes")
    class Quotes {

        @Test
        @DisplayName("finite values pass through and the timestamp becomes an instant")
        void finiteValues() {
            RawQuote raw = new RawQuote(187.25, 1.5, 0.81, 188.0, 185.1, 186.0, 185.75, 1_709_303_400d);

            NormalizedQuote q = MarketDataNormalizer.toQuote(raw, "AAPL", FETCHED_AT);

            assertEquals("AAPL", q.symbol());
            assertEquals(187.25, q.price());
            assertEquals(1.5, q.change());
            assertEquals(0.81, q.changePercent());
            assertEquals(188.0, q.dayHigh());
            assertEquals(185.1, q.dayLow());
            assertEquals(186.0, q.open());
            assertEquals(185.75, q.previousClose());
            assertEquals(Instant.parse("2024-03-01T14:30:00Z"), q.timestamp());
            assertEquals(FETCHED_AT, q.fetchedAt());
            assertFalse(q.stale());
        }

        @Test
        @DisplayName("missing and non-finite numbers become null, never zero")
        void nonFiniteBecomesNull() {
            RawQuote raw = new RawQuote(Double.NaN, null, Double.POSITIVE_INFINITY, 10.0, null, null, 9.0, Double.NaN);

            NormalizedQuote q = MarketDataNormalizer.toQuote(raw, "MSFT", FETCHED_AT);

            assertNull(q.price());
            assertNull(q.change());
            assertNull(q.changePercent());
            assertNull(q.dayLow());
            assertNull(q.open());
            assertNull(q.timestamp());
            assertEquals(10.0, q.dayHigh());
            assertEquals(9.0, q.previousClose());
        }
    }

    @Nested
    @DisplayName("candles")
    class Candles {

        @Test
        @DisplayName("arrays are truncated to the shortest one")
        void truncatesToShortest() {
            RawCandles raw = new RawCandles(
                list(100d, 200d, 300d),
                list(1d, 2d, 3d),
                list(1d, 2d),
                list(1d, 2d, 3d),
                list(1d, 2d, 3d),
                list(5d, 6d, 7d),
                "ok");

            List<Candle> candles = MarketDataNormalizer.toCandles(raw);

            assertEquals(2, candles.size());
        }

        @Test
        @DisplayName("a missing array yields no candles")
        void missingArray() {
            RawCandles raw = new RawCandles(list(100d), list(1d), list(1d), list(1d), list(1d), null, "ok");

            assertTrue(MarketDataNormalizer.toCandles(raw).isEmpty());
        }

        @Test
        @DisplayName("rows without a finite time or close are dropped; gaps fall back to the close")
        void dropsAndDefaults() {
            RawCandles raw = new RawCandles(
                list(100d, Double.NaN, 300d, 400d),
                list(null, 2d, 3d, 4d),
                list(Double.NaN, 2d, 3d, 4d),
                list(1d, 2d, 3d, 4d),
                list(10d, 20d, null, 40d),
                list(5d, 6d, 7d, Double.NaN),
                "ok");

            List<Candle> candles = MarketDataNormalizer.toCandles(raw);

            assertEquals(2, candles.size());
            Candle first = candles.get(0);
            assertEquals(Instant.ofEpochSecond(100), first.time());
            assertEquals(10d, first.open());
            assertEquals(10d, first.high());
            assertEquals(1d, first.low());
            assertEquals(5d, first.volume());
            assertNull(candles.get(1).volume());
        }

        @Test
        @DisplayName("output is sorted by time and keeps the first candle for a repeated time")
        void sortsAndDedupes() {
            RawCandles raw = new RawCandles(
                list(300d, 100d, 200d, 100d),
                list(3d, 1d, 2d, 9d),
                list(3d, 1d, 2d, 9d),
                list(3d, 1d, 2d, 9d),
                list(3d, 1d, 2d, 9d),
                list(3d, 1d, 2d, 9d),
                "ok");

            List<Candle> candles = MarketDataNormalizer.toCandles(raw);

            assertEquals(List.of(Instant.ofEpochSecond(100), Instant.ofEpochSecond(200), Instant.ofEpochSecond(300)),
                candles.stream().map(Candle::time).toList());
            assertEquals(1d, candles.get(0).close());
        }

        @Test
        @DisplayName("normalizing already-normalized candles changes nothing")
        void idempotent() {
            RawCandles raw = new RawCandles(
                list(300d, 100d, 200d, 100d, Double.NaN),
                list(3d, null, 2d, 9d, 1d),
                list(3d, 1d, 2d, 9d, 1d),
                list(3d, 1d, Double.NaN, 9d, 1d),
                list(3d, 1d, 2d, 9d, 1d),
                list(3d, null, 2d, 9d, 1d),
                "ok");
            List<Candle> once = MarketDataNormalizer.toCandles(raw);

            List<Candle> twice = MarketDataNormalizer.toCandles(toRaw(once));

            assertEquals(once, twice);
        }

        private RawCandles toRaw(List<Candle> candles) {
            return new RawCandles(
                candles.stream().map(c -> c.time().toEpochMilli() / 1000d).toList(),
                candles.stream().map(c -> (Double) c.open()).toList(),
                candles.stream().map(c -> (Double) c.high()).toList(),
                candles.stream().map(c -> (Double) c.low()).toList(),
                candles.stream().map(c -> (Double) c.close()).toList(),
                candles.stream().map(Candle::volume).toList(),
                "ok");
        }
    }
}
