package com.kraken.trading.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable OHLCV bar. A ticker sample is represented as a single-price candle.
 */
public record Candle(Instant timestamp, double open, double high, double low, double close, double volume) {

    public Candle {
        Objects.requireNonNull(timestamp, "timestamp");
        if (high < low) {
            throw new IllegalArgumentException("high " + high + " < low " + low);
        }
        if (volume < 0) {
            throw new IllegalArgumentException("negative volume " + volume);
        }
    }

    public static Candle ofPrice(Instant timestamp, double price, double volume) {
        return new Candle(timestamp, price, price, price, price, volume);
    }
}
