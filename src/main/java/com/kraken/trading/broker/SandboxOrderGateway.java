package com.kraken.trading.broker;

import com.kraken.trading.model.OrderResult;
import com.kraken.trading.model.OrderSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/** Simulated fills: no network call, never fails. */
public class SandboxOrderGateway implements OrderGateway {

    private static final Logger log = LoggerFactory.getLogger(SandboxOrderGateway.class);

    private final String pair;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public SandboxOrderGateway(String pair) {
        this(pair, Clock.systemUTC());
    }

    public SandboxOrderGateway(String pair, Clock clock) {
        this.pair = pair;
        this.clock = clock;
    }

    @Override
    public OrderResult placeOrder(OrderSide side, double quantity) {
        String orderId = "sandbox_" + clock.instant().getEpochSecond() + "_" + sequence.incrementAndGet();
        log.info("SANDBOX: {} {} {} -> {}", side.wireValue(), quantity, pair, orderId);
        return OrderResult.filled(orderId);
    }

    @Override
    public boolean isSandbox() {
        return true;
    }
}
