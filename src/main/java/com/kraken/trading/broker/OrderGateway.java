package com.kraken.trading.broker;

import com.kraken.trading.model.OrderResult;
import com.kraken.trading.model.OrderSide;

/**
 * Places market orders for the traded pair. Implementations report failures
 * through {@link OrderResult}, they do not throw.
 */
public interface OrderGateway {
    OrderResult placeOrder(OrderSide side, double quantity);

    /** True when orders never reach an exchange. */
    boolean isSandbox();
}
