package com.kraken.trading.engine;

import com.kraken.trading.config.StrategyConfig;
import com.kraken.trading.model.Breakout;
import com.kraken.trading.model.Candle;
import com.kraken.trading.model.IndicatorSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Rolling window of candles plus the indicators derived from it.
 */
public class IndicatorEngine {

    private static final Logger log = LoggerFactory.getLogger(IndicatorEngine.class);

    private final StrategyConfig config;
    private final PriceWindow window;

    public IndicatorEngine(StrategyConfig config) {
        this.config = config;
        this.window = new PriceWindow(config.windowCapacity());
    }

    /**
     * Adds the candle to the window and computes a snapshot.
     *
     * @return the snapshot, or empty while the window is still warming up or the
     *         candle arrived out of order
     */
    public Optional<IndicatorSnapshot> ingest(Candle candle) {
        PriceWindow.AddResult added = window.add(candle);
        if (added == PriceWindow.AddResult.OUT_OF_ORDER) {
            log.warn("Dropping out-of-order candle {} (newest is {})", candle.timestamp(), window.latest().timestamp());
            return Optional.empty();
        }
        if (window.size() < config.warmupCandles()) {
            log.debug("Warming up: {}/{} candles", window.size(), config.warmupCandles());
            return Optional.empty();
        }
        return Optional.of(compute());
    }

    private IndicatorSnapshot compute() {
        List<Candle> candles = window.toList();
        Candle latest = candles.get(candles.size() - 1);
        double rsi = Indicators.rsi(candles, config.rsiPeriod());
        double trauma = Indicators.trauma(candles, config.traumaPeriod(), latest.close());
        Breakout breakout = Indicators.breakout(candles, config.breakoutLookback(), config.volumeSurge());
        return new IndicatorSnapshot(latest.timestamp(), latest.close(), rsi, trauma, breakout);
    }

    public int size() {
        return window.size();
    }

    /** Close of the newest candle, or null when nothing has been ingested. */
    public Double latestClose() {
        Candle latest = window.latest();
        return latest == null ? null : latest.close();
    }
}
