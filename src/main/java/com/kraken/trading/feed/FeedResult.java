package com.kraken.trading.feed;

import com.kraken.trading.model.Candle;

/** One read from a {@link MarketDataSource}. */
public record FeedResult(Status status, Candle candle, String error) {

    public enum Status { CANDLE, TIMEOUT, ERROR }

    public static FeedResult of(Candle candle) {
        return new FeedResult(Status.CANDLE, candle, null);
    }

    public static FeedResult timeout() {
        return new FeedResult(Status.TIMEOUT, null, null);
    }

    public static FeedResult error(String error) {
        return new FeedResult(Status.ERROR, null, error);
    }
}
