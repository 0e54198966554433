package com.kraken.trading.feed;

import com.kraken.trading.model.Candle;

import java.time.Duration;
import java.util.List;

/**
 * Source of timestamped price observations in arrival order.
 */
public interface MarketDataSource extends AutoCloseable {

    /** Blocks until the next observation, a timeout, or a feed error. Never throws for feed problems. */
    FeedResult next() throws InterruptedException;

    /** Delay the consumer waits after a successful read. Push feeds return zero. */
    default Duration pollInterval() {
        return Duration.ZERO;
    }

    /**
     * Closed bars that predate the live observations, oldest first. The consumer feeds
     * them to the indicators for warm-up only and never trades on them. Drained by the call.
     */
    default List<Candle> backfill() {
        return List.of();
    }

    @Override
    default void close() {}
}
