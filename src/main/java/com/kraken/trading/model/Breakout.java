package com.kraken.trading.model;

public enum Breakout {
    UP,
    DOWN,
    NONE
}
