package com.kraken.trading.store;

import com.kraken.trading.model.Trade;

import java.util.List;

/** Append-only record of closed trades. */
public interface TradeHistory {
    void append(Trade trade);
    List<Trade> all();
    List<Trade> recent(int limit);
    int size();
}
