package com.kraken.trading.engine;

import com.kraken.trading.model.Position;
import com.kraken.trading.model.Trade;

/**
 * Outcome of asking the ledger to act on a signal.
 *
 * @param position the opened position (OPENED) or the one that was closed (CLOSED)
 * @param trade    the recorded trade (CLOSED only)
 * @param error    why nothing changed (GATEWAY_FAILED, REJECTED)
 */
public record TransitionResult(Outcome outcome, Position position, Trade trade, String error) {

    public enum Outcome { OPENED, CLOSED, GATEWAY_FAILED, REJECTED, NO_OP }

    static TransitionResult opened(Position position) {
        return new TransitionResult(Outcome.OPENED, position, null, null);
    }

    static TransitionResult closed(Position position, Trade trade) {
        return new TransitionResult(Outcome.CLOSED, position, trade, null);
    }

    static TransitionResult gatewayFailed(String error) {
        return new TransitionResult(Outcome.GATEWAY_FAILED, null, null, error);
    }

    static TransitionResult rejected(String error) {
        return new TransitionResult(Outcome.REJECTED, null, null, error);
    }

    static TransitionResult noOp() {
        return new TransitionResult(Outcome.NO_OP, null, null, null);
    }

    /** True when the ledger state changed. */
    public boolean applied() {
        return outcome == Outcome.OPENED || outcome == Outcome.CLOSED;
    }
}
