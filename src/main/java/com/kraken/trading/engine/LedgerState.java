package com.kraken.trading.engine;

public enum LedgerState {
    FLAT,
    LONG,
    SHORT
}
