package com.kraken.trading.feed;

import com.kraken.trading.broker.KrakenClient;
import com.kraken.trading.model.Candle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Polls the public ticker and turns each sample into a single-price candle
 * (last trade price as OHLC, last trade lot volume as volume).
 */
public class KrakenTickerFeed implements MarketDataSource {

    private static final Logger log = LoggerFactory.getLogger(KrakenTickerFeed.class);

    private final KrakenClient kraken;
    private final String pair;
    private final Duration pollInterval;
    private final Clock clock;

    public KrakenTickerFeed(KrakenClient kraken, String pair, Duration pollInterval, Clock clock) {
        this.kraken = kraken;
        this.pair = pair;
        this.pollInterval = pollInterval;
        this.clock = clock;
    }

    @Override
    public FeedResult next() {
        Map<String, Object> body = kraken.ticker(pair);
        List<String> errors = KrakenClient.errors(body);
        if (!errors.isEmpty()) {
            return FeedResult.error("Kraken ticker error: " + errors);
        }
        return KrakenClient.parseTicker(body, pair)
                .map(t -> {
                    log.debug("{} last={} bid={} ask={}", pair, t.last(), t.bid(), t.ask());
                    return FeedResult.of(Candle.ofPrice(clock.instant(), t.last(), t.lastVolume()));
                })
                .orElseGet(() -> FeedResult.error("Malformed ticker response for " + pair));
    }

    @Override
    public Duration pollInterval() {
        return pollInterval;
    }
}
