package com.kraken.trading.model;

import java.util.Locale;

public enum OrderSide {
    BUY,
    SELL;

    /** Wire value used by the Kraken REST API ("buy" / "sell"). */
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
