package com.kraken.trading.model;

import java.time.Instant;

/**
 * Indicator values computed from the price window at the instant of one candle.
 *
 * @param timestamp timestamp of the newest candle in the window
 * @param close     close of the newest candle
 * @param rsi       relative strength index, 0..100
 * @param trauma    SMA of closes minus half the average true range
 * @param breakout  volume-confirmed breakout of the newest candle
 */
public record IndicatorSnapshot(Instant timestamp, double close, double rsi, double trauma, Breakout breakout) {
}
