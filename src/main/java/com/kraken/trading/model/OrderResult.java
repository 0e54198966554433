package com.kraken.trading.model;

/** Outcome of an order placement. Exactly one of orderId / error is set. */
public record OrderResult(boolean success, String orderId, String error) {

    public static OrderResult filled(String orderId) {
        return new OrderResult(true, orderId, null);
    }

    public static OrderResult failed(String error) {
        return new OrderResult(false, null, error);
    }
}
