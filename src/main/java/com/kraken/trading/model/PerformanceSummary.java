package com.kraken.trading.model;

import java.util.List;

/**
 * Statistics derived from the closed trades. Never stored, always recomputed.
 */
public record PerformanceSummary(
        int tradeCount,
        int winCount,
        double winRate,
        double totalPnl,
        double averagePnl,
        double bestPnl,
        double worstPnl
) {
    public static final PerformanceSummary EMPTY = new PerformanceSummary(0, 0, 0.0, 0.0, 0.0, 0.0, 0.0);

    public static PerformanceSummary of(List<Trade> trades) {
        if (trades.isEmpty()) return EMPTY;
        int wins = 0;
        double total = 0.0;
        double best = Double.NEGATIVE_INFINITY;
        double worst = Double.POSITIVE_INFINITY;
        for (Trade t : trades) {
            if (t.isWin()) wins++;
            total += t.pnl();
            best = Math.max(best, t.pnl());
            worst = Math.min(worst, t.pnl());
        }
        int n = trades.size();
        return new PerformanceSummary(n, wins, (double) wins / n, total, total / n, best, worst);
    }
}
