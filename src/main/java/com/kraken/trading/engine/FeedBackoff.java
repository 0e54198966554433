package com.kraken.trading.engine;

import java.time.Duration;

/**
 * Backoff state of the trading loop after feed errors. A fixed delay, no growth:
 * the next read after the delay is the retry.
 */
public class FeedBackoff {

    private final Duration backoff;

    private int consecutiveErrors;

    public FeedBackoff(Duration backoff) {
        this.backoff = backoff;
    }

    /** Records an error and returns how long to wait before the next read. */
    public Duration onError() {
        consecutiveErrors++;
        return backoff;
    }

    public void onSuccess() {
        consecutiveErrors = 0;
    }

    public int consecutiveErrors() {
        return consecutiveErrors;
    }
}
