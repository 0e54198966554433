package com.kraken.trading.engine;

import com.kraken.trading.model.Breakout;
import com.kraken.trading.model.Candle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class IndicatorsTest {

    @Nested
    @DisplayName("rsi()")
    class Rsi {

        @Test
        @DisplayName("rising closes → 100")
        void risingSaturates() {
            assertEquals(100.0, Indicators.rsi(Candles.closes(1, 2, 3, 4, 5), 4));
        }

        @Test
        @DisplayName("flat closes → 100 (zero average loss)")
        void flatSaturates() {
            assertEquals(100.0, Indicators.rsi(Candles.closes(5, 5, 5, 5), 3));
        }

        @Test
        @DisplayName("falling closes → 0")
        void fallingIsZero() {
            assertEquals(0.0, Indicators.rsi(Candles.closes(5, 4, 3, 2), 3), 1e-12);
        }

        @Test
        @DisplayName("mixed deltas: gains 2, losses 1 over period 2 → 66.67")
        void mixed() {
            // deltas +2, -1 → avgGain 1.0, avgLoss 0.5, RS 2
            assertEquals(100.0 - 100.0 / 3.0, Indicators.rsi(Candles.closes(10, 12, 11), 2), 1e-9);
        }

        @Test
        @DisplayName("only the last period deltas count")
        void ignoresOlderDeltas() {
            assertEquals(100.0 - 100.0 / 3.0, Indicators.rsi(Candles.closes(50, 10, 12, 11), 2), 1e-9);
        }

        @Test
        @DisplayName("not enough closes → neutral 50")
        void insufficient() {
            assertEquals(Indicators.NEUTRAL_RSI, Indicators.rsi(Candles.closes(1, 2, 3), 14));
        }

        @Test
        @DisplayName("always within [0, 100]")
        void bounded() {
            Random random = new Random(42);
            for (int run = 0; run < 200; run++) {
                double[] closes = new double[30];
                double price = 100;
                for (int i = 0; i < closes.length; i++) {
                    price = Math.max(1, price + random.nextGaussian() * 3);
                    closes[i] = price;
                }
                double rsi = Indicators.rsi(Candles.closes(closes), 14);
                assertTrue(rsi >= 0 && rsi <= 100, "rsi out of range: " + rsi);
            }
        }
    }

    @Nested
    @DisplayName("sma() / trauma()")
    class Trauma {

        @Test
        @DisplayName("empty window → caller default")
        void emptyFallsBack() {
            assertEquals(42.0, Indicators.sma(List.of(), 20, 42.0));
            assertEquals(42.0, Indicators.trauma(List.of(), 20, 42.0));
        }

        @Test
        @DisplayName("shorter than period → mean of all closes")
        void shortWindow() {
            assertEquals(2.0, Indicators.sma(Candles.closes(1, 2, 3), 20, 0));
        }

        @Test
        @DisplayName("uses only the last period closes")
        void lastPeriod() {
            assertEquals(3.5, Indicators.sma(Candles.closes(100, 3, 4), 2, 0));
        }

        @Test
        @DisplayName("single candle → plain SMA")
        void singleCandleIsSma() {
            List<Candle> one = List.of(Candles.bar(0, 110, 90, 100, 1));
            assertEquals(Indicators.sma(one, 20, 0), Indicators.trauma(one, 20, 0));
            assertEquals(100.0, Indicators.trauma(one, 20, 0));
        }

        @Test
        @DisplayName("SMA minus half the average true range")
        void subtractsHalfAtr() {
            List<Candle> two = List.of(
                    Candles.bar(0, 11, 9, 10, 1),
                    Candles.bar(1, 13, 11, 12, 1));
            // SMA 11, TR = max(2, |13-10|, |11-10|) = 3
            assertEquals(3.0, Indicators.atr(two, 20));
            assertEquals(9.5, Indicators.trauma(two, 20, 0));
        }

        @Test
        @DisplayName("true range picks the gap against the previous close")
        void trueRangeGap() {
            Candle c = Candles.bar(1, 105, 104, 104.5, 1);
            assertEquals(5.0, Indicators.trueRange(c, 100));
            assertEquals(1.0, Indicators.trueRange(c, 104.5));
        }
    }

    @Nested
    @DisplayName("breakout()")
    class BreakoutDetection {

        private List<Candle> range(double lastHigh, double lastLow, double lastClose, double lastVolume) {
            List<Candle> list = new ArrayList<>();
            for (int i = 0; i < 19; i++) list.add(Candles.bar(i, 101, 99, 100, 10));
            list.add(Candles.bar(19, lastHigh, lastLow, lastClose, lastVolume));
            return list;
        }

        @Test
        @DisplayName("close above resistance with volume surge → UP")
        void up() {
            assertEquals(Breakout.UP, Indicators.breakout(range(102.5, 101, 102, 13), 20, 1.2));
        }

        @Test
        @DisplayName("close below support with volume surge → DOWN")
        void down() {
            assertEquals(Breakout.DOWN, Indicators.breakout(range(99, 97.5, 98, 13), 20, 1.2));
        }

        @Test
        @DisplayName("price extreme without volume surge → NONE")
        void priceAloneNeverTriggers() {
            assertEquals(Breakout.NONE, Indicators.breakout(range(150, 101, 150, 12), 20, 1.2));
            assertEquals(Breakout.NONE, Indicators.breakout(range(99, 50, 50, 11), 20, 1.2));
        }

        @Test
        @DisplayName("volume surge inside the range → NONE")
        void surgeInsideRange() {
            assertEquals(Breakout.NONE, Indicators.breakout(range(100.5, 99.5, 100, 100), 20, 1.2));
        }

        @Test
        @DisplayName("fewer candles than lookback → NONE")
        void tooShort() {
            List<Candle> list = range(150, 101, 150, 100).subList(1, 20);
            assertEquals(Breakout.NONE, Indicators.breakout(list, 20, 1.2));
        }
    }
}
