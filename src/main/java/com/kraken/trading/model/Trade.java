package com.kraken.trading.model;

import java.time.Instant;

/** A closed round trip. Appended once to the trade history and never changed. */
public record Trade(
        Instant entryTime,
        Instant exitTime,
        double entryPrice,
        double exitPrice,
        PositionSide side,
        double quantity,
        double pnl,
        String reason
) {
    public boolean isWin() {
        return pnl > 0;
    }
}
