package com.kraken.trading.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceSummaryTest {

    private static Trade trade(double pnl) {
        return new Trade(Instant.EPOCH, Instant.EPOCH, 100, 100, PositionSide.SHORT, 1, pnl, "test");
    }

    @Test
    void noTradesReportsZeroWinRate() {
        PerformanceSummary s = PerformanceSummary.of(List.of());
        assertEquals(0, s.tradeCount());
        assertEquals(0.0, s.winRate());
        assertEquals(0.0, s.averagePnl());
    }

    @Test
    void breakEvenIsNotAWin() {
        PerformanceSummary s = PerformanceSummary.of(List.of(trade(0), trade(3), trade(-1), trade(2)));
        assertEquals(4, s.tradeCount());
        assertEquals(2, s.winCount());
        assertEquals(0.5, s.winRate());
        assertEquals(4.0, s.totalPnl());
        assertEquals(1.0, s.averagePnl());
        assertEquals(3.0, s.bestPnl());
        assertEquals(-1.0, s.worstPnl());
    }

    @Test
    void positionPnlBySide() {
        Instant t = Instant.EPOCH;
        assertEquals(2.0, new Position(PositionSide.LONG, 100, t, 0.5, "x").pnlAt(104), 1e-12);
        assertEquals(-2.0, new Position(PositionSide.SHORT, 100, t, 0.5, "x").pnlAt(104), 1e-12);
    }
}
