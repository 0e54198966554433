package com.kraken.trading.engine;

import com.kraken.trading.model.Breakout;
import com.kraken.trading.model.Candle;

import java.util.List;

/**
 * Pure indicator math. Candle lists are oldest-first (last element = newest candle).
 */
public final class Indicators {

    /** RSI returned when there are not enough closes to form {@code period} deltas. */
    public static final double NEUTRAL_RSI = 50.0;

    private Indicators() {}

    // ── RSI ─────────────────────────────────────────────────────────────────

    /**
     * Simple-average RSI over the last {@code period} close-to-close deltas.
     * Zero average loss saturates to 100.
     */
    public static double rsi(List<Candle> candles, int period) {
        if (candles.size() < period + 1) return NEUTRAL_RSI;

        int n = candles.size();
        double gains = 0;
        double losses = 0;
        for (int i = n - period; i < n; i++) {
            double delta = candles.get(i).close() - candles.get(i - 1).close();
            if (delta > 0) gains += delta;
            else losses -= delta;
        }
        double avgGain = gains / period;
        double avgLoss = losses / period;

        if (avgLoss == 0) return 100.0;
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    // ── Moving average / true range ─────────────────────────────────────────

    /**
     * Mean close of the last {@code period} candles, or of all candles when fewer.
     * Empty input yields {@code fallback}.
     */
    public static double sma(List<Candle> candles, int period, double fallback) {
        if (candles.isEmpty()) return fallback;
        int from = Math.max(0, candles.size() - period);
        double sum = 0;
        for (int i = from; i < candles.size(); i++) sum += candles.get(i).close();
        return sum / (candles.size() - from);
    }

    public static double trueRange(Candle candle, double prevClose) {
        double hl = candle.high() - candle.low();
        double hc = Math.abs(candle.high() - prevClose);
        double lc = Math.abs(candle.low() - prevClose);
        return Math.max(hl, Math.max(hc, lc));
    }

    /**
     * Mean true range of the last {@code period} candles that have a predecessor.
     * NaN when fewer than 2 candles are available.
     */
    public static double atr(List<Candle> candles, int period) {
        int n = candles.size();
        if (n < 2) return Double.NaN;
        int from = Math.max(1, n - period);
        double sum = 0;
        for (int i = from; i < n; i++) sum += trueRange(candles.get(i), candles.get(i - 1).close());
        return sum / (n - from);
    }

    // ── Trauma line ─────────────────────────────────────────────────────────

    /** SMA minus half the ATR; collapses to the SMA below 2 candles. */
    public static double trauma(List<Candle> candles, int period, double fallback) {
        double sma = sma(candles, period, fallback);
        double atr = atr(candles, period);
        if (Double.isNaN(atr)) return sma;
        return sma - 0.5 * atr;
    }

    // ── Breakout ────────────────────────────────────────────────────────────

    /**
     * Checks the newest candle against the high/low and mean volume of the
     * previous {@code lookback - 1} candles. Price alone never triggers: the
     * volume must exceed {@code volumeSurge} times the mean as well.
     */
    public static Breakout breakout(List<Candle> candles, int lookback, double volumeSurge) {
        if (candles.size() < lookback) return Breakout.NONE;

        int n = candles.size();
        Candle current = candles.get(n - 1);
        double resistance = Double.NEGATIVE_INFINITY;
        double support = Double.POSITIVE_INFINITY;
        double volumeSum = 0;
        for (int i = n - lookback; i < n - 1; i++) {
            Candle c = candles.get(i);
            resistance = Math.max(resistance, c.high());
            support = Math.min(support, c.low());
            volumeSum += c.volume();
        }
        double avgVolume = volumeSum / (lookback - 1);
        boolean surge = current.volume() > volumeSurge * avgVolume;
        if (!surge) return Breakout.NONE;

        if (current.close() > resistance) return Breakout.UP;
        if (current.close() < support) return Breakout.DOWN;
        return Breakout.NONE;
    }
}
