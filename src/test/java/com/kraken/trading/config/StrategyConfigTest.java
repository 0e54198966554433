package com.kraken.trading.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class StrategyConfigTest {

    @Test
    void defaultsMatchTheReferenceModel() {
        StrategyConfig c = StrategyConfig.defaults();
        assertEquals(100, c.windowCapacity());
        assertEquals(14, c.rsiPeriod());
        assertEquals(20, c.traumaPeriod());
        assertEquals(20, c.breakoutLookback());
        assertEquals(70.0, c.overbought());
        assertEquals(30.0, c.oversold());
        assertEquals(Duration.ofSeconds(300), c.minSignalInterval());
        assertEquals(21, c.warmupCandles());
        assertFalse(c.debounceExits());
    }

    @Test
    void rejectsInvertedThresholds() {
        assertThrows(IllegalArgumentException.class, () ->
                new StrategyConfig(100, 14, 30, 70, 20, 20, 1.2, Duration.ofSeconds(300), false, 0.01));
    }

    @Test
    void rejectsWindowSmallerThanWarmup() {
        assertThrows(IllegalArgumentException.class, () ->
                new StrategyConfig(20, 14, 70, 30, 20, 20, 1.2, Duration.ofSeconds(300), false, 0.01));
    }

    @Test
    void rejectsNonPositiveQuantity() {
        assertThrows(IllegalArgumentException.class, () ->
                new StrategyConfig(100, 14, 70, 30, 20, 20, 1.2, Duration.ofSeconds(300), false, 0));
    }
}
