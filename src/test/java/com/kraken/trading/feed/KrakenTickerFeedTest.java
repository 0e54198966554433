package com.kraken.trading.feed;

import com.kraken.trading.broker.KrakenClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KrakenTickerFeedTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    @Mock private KrakenClient kraken;

    private KrakenTickerFeed feed() {
        return new KrakenTickerFeed(kraken, "XBTUSD", Duration.ofSeconds(60), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void tickerBecomesSinglePriceCandle() {
        when(kraken.ticker("XBTUSD")).thenReturn(Map.of(
                "error", List.of(),
                "result", Map.of("XXBTZUSD", Map.of(
                        "a", List.of("42010.1", "1", "1.000"),
                        "b", List.of("42009.9", "2", "2.000"),
                        "c", List.of("42010.0", "0.0125")))));

        FeedResult r = feed().next();

        assertEquals(FeedResult.Status.CANDLE, r.status());
        assertEquals(NOW, r.candle().timestamp());
        assertEquals(42010.0, r.candle().close());
        assertEquals(42010.0, r.candle().high());
        assertEquals(0.0125, r.candle().volume());
    }

    @Test
    void apiErrorBecomesFeedError() {
        when(kraken.ticker("XBTUSD")).thenReturn(Map.of("error", List.of("EGeneral:Too many requests")));

        FeedResult r = feed().next();

        assertEquals(FeedResult.Status.ERROR, r.status());
        assertTrue(r.error().contains("EGeneral:Too many requests"));
    }

    @Test
    void malformedBodyBecomesFeedError() {
        when(kraken.ticker("XBTUSD")).thenReturn(Map.of("error", List.of(), "result", Map.of()));

        assertEquals(FeedResult.Status.ERROR, feed().next().status());
    }

    @Test
    void pollsEverySixtySeconds() {
        assertEquals(Duration.ofSeconds(60), feed().pollInterval());
    }
}
