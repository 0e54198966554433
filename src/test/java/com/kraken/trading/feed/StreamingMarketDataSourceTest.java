package com.kraken.trading.feed;

import com.kraken.trading.model.Candle;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class StreamingMarketDataSourceTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void deliversCandlesInArrivalOrder() throws Exception {
        StreamingMarketDataSource stream = new StreamingMarketDataSource(8, Duration.ofMillis(10));
        stream.accept(Candle.ofPrice(T0, 100, 1));
        stream.accept(Candle.ofPrice(T0.plusSeconds(60), 101, 1));

        assertEquals(100, stream.next().candle().close());
        assertEquals(101, stream.next().candle().close());
        assertEquals(FeedResult.Status.TIMEOUT, stream.next().status());
    }

    @Test
    void transportFailureSurfacesAsError() throws Exception {
        StreamingMarketDataSource stream = new StreamingMarketDataSource(8, Duration.ofMillis(10));
        stream.fail("malformed frame");

        FeedResult r = stream.next();
        assertEquals(FeedResult.Status.ERROR, r.status());
        assertEquals("malformed frame", r.error());
    }

    @Test
    void dropsWhenFullAndAfterClose() {
        StreamingMarketDataSource stream = new StreamingMarketDataSource(1, Duration.ofMillis(10));
        stream.accept(Candle.ofPrice(T0, 100, 1));
        stream.accept(Candle.ofPrice(T0.plusSeconds(60), 101, 1));
        assertEquals(1, stream.pending());

        stream.close();
        stream.accept(Candle.ofPrice(T0.plusSeconds(120), 102, 1));
        assertEquals(0, stream.pending());
    }

    @Test
    void pushFeedHasNoPollDelay() {
        assertEquals(Duration.ZERO, new StreamingMarketDataSource(1, Duration.ofMillis(10)).pollInterval());
    }
}
