package com.kraken.trading.broker;

import com.kraken.trading.model.OrderResult;
import com.kraken.trading.model.OrderSide;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/** Live market orders through Kraken's AddOrder endpoint. */
public class KrakenOrderGateway implements OrderGateway {

    private static final Logger log = LoggerFactory.getLogger(KrakenOrderGateway.class);

    private final KrakenClient kraken;
    private final String pair;

    public KrakenOrderGateway(KrakenClient kraken, String pair) {
        this.kraken = kraken;
        this.pair = pair;
    }

    @Override
    public OrderResult placeOrder(OrderSide side, double quantity) {
        Map<String, Object> resp = kraken.addMarketOrder(pair, side, quantity);
        List<String> errors = KrakenClient.errors(resp);
        if (!errors.isEmpty()) {
            log.warn("Kraken rejected {} {} {}: {}", side.wireValue(), quantity, pair, errors);
            return OrderResult.failed(String.join("; ", errors));
        }
        return KrakenClient.parseTxid(resp)
                .map(OrderResult::filled)
                .orElseGet(() -> OrderResult.failed("no txid in response: " + resp));
    }

    @Override
    public boolean isSandbox() {
        return false;
    }
}
