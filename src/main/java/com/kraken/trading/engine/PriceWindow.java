package com.kraken.trading.engine;

import com.kraken.trading.model.Candle;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-capacity, time-ordered FIFO of candles. Not thread-safe: owned by the trading loop.
 */
public class PriceWindow {

    public enum AddResult { APPENDED, REPLACED, OUT_OF_ORDER }

    private final int capacity;
    private final Deque<Candle> candles;

    public PriceWindow(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
        this.capacity = capacity;
        this.candles = new ArrayDeque<>(capacity + 1);
    }

    /**
     * Appends a candle, evicting the oldest beyond capacity. A candle carrying the
     * newest timestamp replaces the newest candle; an older one is not accepted.
     */
    public AddResult add(Candle candle) {
        Candle newest = candles.peekLast();
        if (newest != null) {
            int cmp = candle.timestamp().compareTo(newest.timestamp());
            if (cmp < 0) return AddResult.OUT_OF_ORDER;
            if (cmp == 0) {
                candles.pollLast();
                candles.addLast(candle);
                return AddResult.REPLACED;
            }
        }
        candles.addLast(candle);
        while (candles.size() > capacity) {
            candles.pollFirst();
        }
        return AddResult.APPENDED;
    }

    public int size() {
        return candles.size();
    }

    public Candle latest() {
        return candles.peekLast();
    }

    /** Oldest-first copy of the whole window. */
    public List<Candle> toList() {
        return new ArrayList<>(candles);
    }

    /** Oldest-first copy of the newest {@code n} candles (fewer if the window is shorter). */
    public List<Candle> last(int n) {
        List<Candle> all = toList();
        return all.subList(Math.max(0, all.size() - n), all.size());
    }
}
