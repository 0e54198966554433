package com.kraken.trading.model;

public enum SignalType {
    NONE,
    ENTER_LONG,
    ENTER_SHORT,
    EXIT_LONG,
    EXIT_SHORT;

    public boolean isEntry() {
        return this == ENTER_LONG || this == ENTER_SHORT;
    }

    public boolean isExit() {
        return this == EXIT_LONG || this == EXIT_SHORT;
    }

    /** Position side this signal opens or closes; null for NONE. */
    public PositionSide side() {
        return switch (this) {
            case ENTER_LONG, EXIT_LONG -> PositionSide.LONG;
            case ENTER_SHORT, EXIT_SHORT -> PositionSide.SHORT;
            case NONE -> null;
        };
    }
}
