package com.kraken.trading.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of the engine state handed to readers (status API, dashboard).
 * Position, trades and PnL always come from the same engine step.
 */
public record EngineStatus(
        boolean running,
        String pair,
        Double currentPrice,
        Position position,
        List<Trade> trades,
        int totalTrades,
        double totalPnl,
        double winRate,
        PerformanceSummary summary,
        TradeSignal lastSignal,
        String lastError,
        Instant timestamp
) {
    public EngineStatus {
        trades = List.copyOf(trades);
    }

    public static EngineStatus initial(String pair, Instant at) {
        return new EngineStatus(false, pair, null, null, List.of(), 0, 0.0, 0.0,
                PerformanceSummary.EMPTY, null, null, at);
    }

    /** Copy with the loop flag and read time filled in at query time. */
    public EngineStatus withRunning(boolean running, Instant at) {
        return new EngineStatus(running, pair, currentPrice, position, trades, totalTrades, totalPnl, winRate,
                summary, lastSignal, lastError, at);
    }
}
