package com.kraken.trading.feed;

import com.kraken.trading.model.Candle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Adapter for push feeds (WebSocket style): the transport calls {@link #accept}
 * from its own thread and the trading loop drains candles one at a time in
 * arrival order.
 */
public class StreamingMarketDataSource implements MarketDataSource, Consumer<Candle> {

    private static final Logger log = LoggerFactory.getLogger(StreamingMarketDataSource.class);

    private final BlockingQueue<FeedResult> queue;
    private final Duration readTimeout;
    private volatile boolean closed;

    public StreamingMarketDataSource(int capacity, Duration readTimeout) {
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.readTimeout = readTimeout;
    }

    @Override
    public void accept(Candle candle) {
        offer(FeedResult.of(candle));
    }

    /** Reports a transport problem (malformed frame, disconnect) to the consumer. */
    public void fail(String error) {
        offer(FeedResult.error(error));
    }

    private void offer(FeedResult result) {
        if (closed) return;
        if (!queue.offer(result)) {
            log.warn("Stream buffer full ({}), dropping {}", queue.size(), result.status());
        }
    }

    @Override
    public FeedResult next() throws InterruptedException {
        FeedResult result = queue.poll(readTimeout.toMillis(), TimeUnit.MILLISECONDS);
        return result != null ? result : FeedResult.timeout();
    }

    public int pending() {
        return queue.size();
    }

    @Override
    public void close() {
        closed = true;
        queue.clear();
    }
}
