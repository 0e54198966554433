package com.kraken.trading.model;

public enum PositionSide {
    LONG,
    SHORT;

    /** Order side that opens a position on this side. */
    public OrderSide openingOrder() {
        return this == LONG ? OrderSide.BUY : OrderSide.SELL;
    }

    /** Order side that flattens a position on this side. */
    public OrderSide closingOrder() {
        return this == LONG ? OrderSide.SELL : OrderSide.BUY;
    }
}
