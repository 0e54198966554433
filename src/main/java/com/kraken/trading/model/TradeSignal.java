package com.kraken.trading.model;

import java.time.Instant;

/**
 * Output of one policy evaluation.
 *
 * @param type   what to do
 * @param price  close the decision was made on
 * @param at     candle timestamp the decision was made at
 * @param reason human readable explanation, also stored on the resulting trade
 */
public record TradeSignal(SignalType type, double price, Instant at, String reason) {

    public static TradeSignal none(double price, Instant at, String reason) {
        return new TradeSignal(SignalType.NONE, price, at, reason);
    }

    public boolean isActionable() {
        return type != SignalType.NONE;
    }
}
