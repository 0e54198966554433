package com.kraken.trading.model;

import java.time.Instant;

public record Position(PositionSide side, double entryPrice, Instant entryTime, double quantity, String orderId) {

    /** Realized PnL if this position were closed at {@code exitPrice}. */
    public double pnlAt(double exitPrice) {
        return side == PositionSide.LONG
                ? (exitPrice - entryPrice) * quantity
                : (entryPrice - exitPrice) * quantity;
    }
}
