package com.kraken.trading.config;

import java.time.Duration;

/**
 * Tunables of the indicator model and signal policy. Strategy variants are
 * expressed as different values of this record.
 */
public record StrategyConfig(
        int windowCapacity,
        int rsiPeriod,
        double overbought,
        double oversold,
        int traumaPeriod,
        int breakoutLookback,
        double volumeSurge,
        Duration minSignalInterval,
        boolean debounceExits,
        double quantity
) {
    public StrategyConfig {
        if (rsiPeriod < 1) throw new IllegalArgumentException("rsiPeriod must be >= 1: " + rsiPeriod);
        if (traumaPeriod < 1) throw new IllegalArgumentException("traumaPeriod must be >= 1: " + traumaPeriod);
        if (breakoutLookback < 2) throw new IllegalArgumentException("breakoutLookback must be >= 2: " + breakoutLookback);
        if (windowCapacity < warmup(rsiPeriod, traumaPeriod) || windowCapacity < breakoutLookback) {
            throw new IllegalArgumentException("windowCapacity " + windowCapacity + " too small for the configured periods");
        }
        if (oversold < 0 || overbought > 100 || oversold >= overbought) {
            throw new IllegalArgumentException("thresholds must satisfy 0 <= oversold < overbought <= 100");
        }
        if (volumeSurge <= 0) throw new IllegalArgumentException("volumeSurge must be > 0: " + volumeSurge);
        if (minSignalInterval == null || minSignalInterval.isNegative()) {
            throw new IllegalArgumentException("minSignalInterval must be >= 0");
        }
        if (quantity <= 0) throw new IllegalArgumentException("quantity must be > 0: " + quantity);
    }

    public static StrategyConfig defaults() {
        return new StrategyConfig(100, 14, 70.0, 30.0, 20, 20, 1.2, Duration.ofSeconds(300), false, 0.01);
    }

    /** Number of candles required before the first snapshot is produced. */
    public int warmupCandles() {
        return warmup(rsiPeriod, traumaPeriod);
    }

    private static int warmup(int rsiPeriod, int traumaPeriod) {
        return Math.max(rsiPeriod, traumaPeriod) + 1;
    }
}
