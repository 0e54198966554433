package com.kraken.trading.telegram;

/** Fire-and-forget outbound messages about opened and closed positions. */
public interface TradeNotifier {
    void send(String text);
}
