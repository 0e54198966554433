package com.kraken.trading.store;

import com.kraken.trading.model.Trade;

import java.util.*;

public class InMemoryTradeHistory implements TradeHistory {
    private final List<Trade> trades = new ArrayList<>();

    public void append(Trade trade) { trades.add(Objects.requireNonNull(trade, "trade")); }
    public List<Trade> all() { return List.copyOf(trades); }
    public List<Trade> recent(int limit) {
        if (limit <= 0) return List.of();
        return List.copyOf(trades.subList(Math.max(0, trades.size() - limit), trades.size()));
    }
    public int size() { return trades.size(); }
}
