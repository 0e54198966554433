package com.kraken.trading.feed;

import com.kraken.trading.broker.KrakenClient;
import com.kraken.trading.model.Candle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Polls Kraken OHLC bars. A poll may return several bars; they are queued and
 * handed out one per {@link #next()} call, oldest first. Kraken always repeats
 * the still-forming bar, which therefore shows up again with the same timestamp.
 *
 * <p>The first poll returns up to 720 historical bars. Only the newest is handed out
 * as live; the older ones are offered through {@link #backfill()}.
 */
public class KrakenOhlcFeed implements MarketDataSource {

    private static final Logger log = LoggerFactory.getLogger(KrakenOhlcFeed.class);

    private final KrakenClient kraken;
    private final String pair;
    private final int intervalMinutes;
    private final Duration pollInterval;
    private final Deque<Candle> pending = new ArrayDeque<>();
    private final List<Candle> history = new ArrayList<>();

    private Long since;
    private Instant lastEmitted;

    public KrakenOhlcFeed(KrakenClient kraken, String pair, int intervalMinutes, Duration pollInterval) {
        this.kraken = kraken;
        this.pair = pair;
        this.intervalMinutes = intervalMinutes;
        this.pollInterval = pollInterval;
    }

    @Override
    public FeedResult next() {
        if (pending.isEmpty()) {
            FeedResult polled = poll();
            if (polled != null) return polled;
        }
        Candle candle = pending.pollFirst();
        if (candle == null) return FeedResult.timeout();
        lastEmitted = candle.timestamp();
        return FeedResult.of(candle);
    }

    /** Refills the queue; returns a result only when the poll failed or produced nothing. */
    private FeedResult poll() {
        Map<String, Object> body = kraken.ohlc(pair, intervalMinutes, since);
        List<String> errors = KrakenClient.errors(body);
        if (!errors.isEmpty()) {
            return FeedResult.error("Kraken OHLC error: " + errors);
        }
        List<Candle> candles = KrakenClient.parseOhlc(body, pair);
        boolean initial = since == null && lastEmitted == null;
        KrakenClient.ohlcCursor(body).ifPresent(c -> since = c);
        if (initial && candles.size() > 1) {
            history.addAll(candles.subList(0, candles.size() - 1));
            candles = candles.subList(candles.size() - 1, candles.size());
            log.info("OHLC backfill for {}: {} historical bars", pair, history.size());
        }
        for (Candle c : candles) {
            if (lastEmitted == null || !c.timestamp().isBefore(lastEmitted)) {
                pending.addLast(c);
            }
        }
        log.debug("OHLC poll for {} returned {} bars, {} queued", pair, candles.size(), pending.size());
        return pending.isEmpty() ? FeedResult.timeout() : null;
    }

    @Override
    public List<Candle> backfill() {
        List<Candle> drained = List.copyOf(history);
        history.clear();
        return drained;
    }

    @Override
    public Duration pollInterval() {
        return pending.isEmpty() ? pollInterval : Duration.ZERO;
    }
}
