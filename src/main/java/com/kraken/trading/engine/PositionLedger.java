package com.kraken.trading.engine;

import com.kraken.trading.broker.OrderGateway;
import com.kraken.trading.model.*;
import com.kraken.trading.store.TradeHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Owns the single open position and the closed-trade history.
 *
 * <p>Legal walks are FLAT → LONG → FLAT and FLAT → SHORT → FLAT. Anything else is
 * rejected before the gateway is called. A failed order leaves the state untouched.
 * Not thread-safe: driven only by the trading loop.
 */
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private final OrderGateway gateway;
    private final TradeHistory history;
    private final double quantity;

    private Position position;
    private double totalPnl;

    public PositionLedger(OrderGateway gateway, TradeHistory history, double quantity) {
        this.gateway = gateway;
        this.history = history;
        this.quantity = quantity;
    }

    /** Dispatches an accepted signal to {@link #open} or {@link #close}. */
    public TransitionResult apply(TradeSignal signal) {
        SignalType type = signal.type();
        if (type == SignalType.NONE) return TransitionResult.noOp();
        if (type.isEntry()) return open(type.side(), signal.price(), signal.at());
        return close(type.side(), signal.price(), signal.at(), signal.reason());
    }

    public TransitionResult open(PositionSide side, double price, Instant at) {
        if (position != null) {
            return reject("Open " + side + " requested while " + position.side() + " is open");
        }
        OrderSide orderSide = side.openingOrder();
        OrderResult result = gateway.placeOrder(orderSide, quantity);
        if (!result.success()) {
            log.warn("Open {} failed, staying FLAT: {}", side, result.error());
            return TransitionResult.gatewayFailed(result.error());
        }
        position = new Position(side, price, at, quantity, result.orderId());
        log.info("Position opened: {} {} @ {} (order {})", side, quantity, price, result.orderId());
        return TransitionResult.opened(position);
    }

    public TransitionResult close(PositionSide side, double price, Instant at, String reason) {
        if (position == null) {
            return reject("Close " + side + " requested while FLAT");
        }
        if (position.side() != side) {
            return reject("Close " + side + " requested while " + position.side() + " is open");
        }
        OrderResult result = gateway.placeOrder(side.closingOrder(), position.quantity());
        if (!result.success()) {
            log.warn("Close {} failed, position kept: {}", side, result.error());
            return TransitionResult.gatewayFailed(result.error());
        }
        Position closed = position;
        double pnl = closed.pnlAt(price);
        Trade trade = new Trade(closed.entryTime(), at, closed.entryPrice(), price,
                closed.side(), closed.quantity(), pnl, reason);
        history.append(trade);
        totalPnl += pnl;
        position = null;
        log.info("Trade closed: {} PnL {}, total PnL {}", side, String.format("%.2f", pnl), String.format("%.2f", totalPnl));
        return TransitionResult.closed(closed, trade);
    }

    private TransitionResult reject(String reason) {
        log.error("Invariant violation, transition dropped: {}", reason);
        return TransitionResult.rejected(reason);
    }

    public LedgerState state() {
        if (position == null) return LedgerState.FLAT;
        return position.side() == PositionSide.LONG ? LedgerState.LONG : LedgerState.SHORT;
    }

    public Optional<Position> position() {
        return Optional.ofNullable(position);
    }

    /** Side of the open position, or null when flat. */
    public PositionSide openSide() {
        return position == null ? null : position.side();
    }

    public double totalPnl() {
        return totalPnl;
    }

    public List<Trade> trades() {
        return history.all();
    }

    public List<Trade> recentTrades(int limit) {
        return history.recent(limit);
    }

    public int tradeCount() {
        return history.size();
    }

    public PerformanceSummary summary() {
        return PerformanceSummary.of(history.all());
    }
}
