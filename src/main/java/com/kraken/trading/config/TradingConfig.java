package com.kraken.trading.config;

import com.kraken.trading.broker.KrakenClient;
import com.kraken.trading.broker.KrakenOrderGateway;
import com.kraken.trading.broker.OrderGateway;
import com.kraken.trading.broker.SandboxOrderGateway;
import com.kraken.trading.engine.PositionLedger;
import com.kraken.trading.engine.TradingEngine;
import com.kraken.trading.feed.KrakenOhlcFeed;
import com.kraken.trading.feed.KrakenTickerFeed;
import com.kraken.trading.feed.MarketDataSource;
import com.kraken.trading.store.InMemoryTradeHistory;
import com.kraken.trading.store.TradeHistory;
import com.kraken.trading.telegram.TelegramNotifier;
import com.kraken.trading.telegram.TradeNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

@Configuration
public class TradingConfig {

    private static final Logger log = LoggerFactory.getLogger(TradingConfig.class);

    @Bean
    AppConfig appConfig() {
        return new AppConfig();
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    StrategyConfig strategyConfig(
            @Value("${trading.window-capacity:100}") int windowCapacity,
            @Value("${trading.rsi-period:14}") int rsiPeriod,
            @Value("${trading.overbought:70}") double overbought,
            @Value("${trading.oversold:30}") double oversold,
            @Value("${trading.trauma-period:20}") int traumaPeriod,
            @Value("${trading.breakout-lookback:20}") int breakoutLookback,
            @Value("${trading.volume-surge:1.2}") double volumeSurge,
            @Value("${trading.min-signal-interval-sec:300}") long minSignalIntervalSec,
            @Value("${trading.debounce-exits:false}") boolean debounceExits,
            @Value("${trading.quantity:0.01}") double quantity
    ) {
        StrategyConfig config = new StrategyConfig(windowCapacity, rsiPeriod, overbought, oversold, traumaPeriod,
                breakoutLookback, volumeSurge, Duration.ofSeconds(minSignalIntervalSec), debounceExits, quantity);
        log.info("Strategy params => {}", config);
        return config;
    }

    @Bean
    OrderGateway orderGateway(
            @Value("${trading.pair:XBTUSD}") String pair,
            @Value("${trading.sandbox:true}") boolean sandbox,
            KrakenClient kraken,
            AppConfig appConfig,
            Clock clock
    ) {
        if (sandbox) {
            log.info("Order gateway: SANDBOX (no orders are sent)");
            return new SandboxOrderGateway(pair, clock);
        }
        if (!appConfig.hasKrakenCredentials()) {
            throw new IllegalStateException("Live trading requires KRAKEN_API_KEY and KRAKEN_API_SECRET");
        }
        log.warn("Order gateway: LIVE Kraken orders for {}", pair);
        return new KrakenOrderGateway(kraken, pair);
    }

    @Bean
    MarketDataSource marketDataSource(
            @Value("${trading.pair:XBTUSD}") String pair,
            @Value("${trading.feed:ticker}") String feed,
            @Value("${trading.poll-interval-sec:60}") long pollIntervalSec,
            @Value("${trading.ohlc-interval-min:1}") int ohlcIntervalMin,
            KrakenClient kraken,
            Clock clock
    ) {
        Duration poll = Duration.ofSeconds(pollIntervalSec);
        return switch (feed.trim().toLowerCase(Locale.ROOT)) {
            case "ticker" -> new KrakenTickerFeed(kraken, pair, poll, clock);
            case "ohlc" -> new KrakenOhlcFeed(kraken, pair, ohlcIntervalMin, poll);
            default -> throw new IllegalArgumentException("Unknown trading.feed '" + feed + "' (expected ticker|ohlc)");
        };
    }

    @Bean
    TradeNotifier tradeNotifier(
            @Value("${telegram.base-url:https://api.telegram.org}") String baseUrl,
            AppConfig appConfig
    ) {
        return new TelegramNotifier(baseUrl, appConfig.telegramToken(), appConfig.telegramChatId());
    }

    @Bean
    TradeHistory tradeHistory() {
        return new InMemoryTradeHistory();
    }

    @Bean
    TradingEngine tradingEngine(
            @Value("${trading.pair:XBTUSD}") String pair,
            @Value("${trading.error-backoff-sec:30}") long errorBackoffSec,
            StrategyConfig strategy,
            MarketDataSource source,
            OrderGateway gateway,
            TradeHistory history,
            TradeNotifier notifier,
            Clock clock
    ) {
        PositionLedger ledger = new PositionLedger(gateway, history, strategy.quantity());
        return new TradingEngine(pair, strategy, source, ledger, notifier, Duration.ofSeconds(errorBackoffSec), clock);
    }
}
