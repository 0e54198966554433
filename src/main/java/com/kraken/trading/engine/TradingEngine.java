package com.kraken.trading.engine;

import com.kraken.trading.config.StrategyConfig;
import com.kraken.trading.feed.FeedResult;
import com.kraken.trading.feed.MarketDataSource;
import com.kraken.trading.model.*;
import com.kraken.trading.telegram.TradeNotifier;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the feed → indicators → policy → ledger loop on a single consumer thread.
 *
 * <p>Indicator, policy and ledger state are touched only by that thread. After every
 * step an immutable {@link EngineStatus} is swapped in, and {@link #status()} reads it
 * without locking. {@link #start()} and {@link #stop()} return immediately; stopping is
 * cooperative and lets an in-flight order call finish.
 */
public class TradingEngine {

    private static final Logger log = LoggerFactory.getLogger(TradingEngine.class);

    static final int RECENT_TRADES = 10;

    private final String pair;
    private final MarketDataSource source;
    private final IndicatorEngine indicators;
    private final SignalPolicy policy;
    private final PositionLedger ledger;
    private final TradeNotifier notifier;
    private final FeedBackoff backoff;
    private final Clock clock;

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "trading-loop");
        t.setDaemon(true);
        return t;
    });
    private final Object controlLock = new Object();
    private final AtomicReference<EngineStatus> snapshot;

    private RunToken token;
    private Future<?> loop;

    // consumer-thread state
    private TradeSignal lastSignal;
    private String lastError;

    public TradingEngine(String pair,
                         StrategyConfig config,
                         MarketDataSource source,
                         PositionLedger ledger,
                         TradeNotifier notifier,
                         Duration errorBackoff,
                         Clock clock) {
        this.pair = pair;
        this.source = source;
        this.indicators = new IndicatorEngine(config);
        this.policy = new SignalPolicy(config);
        this.ledger = ledger;
        this.notifier = notifier;
        this.backoff = new FeedBackoff(errorBackoff);
        this.clock = clock;
        this.snapshot = new AtomicReference<>(EngineStatus.initial(pair, clock.instant()));
    }

    /* ========================= Control ============================ */

    /** Starts the loop. Returns false when it is already running. */
    public boolean start() {
        synchronized (controlLock) {
            if (isRunning()) {
                log.info("Trading loop already running");
                return false;
            }
            RunToken next = new RunToken();
            token = next;
            loop = executor.submit(() -> run(next));
            log.info("Trading loop for {} started", pair);
            return true;
        }
    }

    /** Signals the loop to stop. Returns false when it was not running. */
    public boolean stop() {
        synchronized (controlLock) {
            if (!isRunning()) return false;
            token.cancel();
            log.info("Trading loop for {} stopping", pair);
            return true;
        }
    }

    /** Waits for the current loop task to exit. */
    public boolean awaitStop(Duration timeout) throws InterruptedException {
        Future<?> current;
        synchronized (controlLock) {
            current = loop;
        }
        if (current == null) return true;
        try {
            current.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (CancellationException | ExecutionException e) {
            log.warn("Trading loop ended abnormally: {}", e.toString());
            return true;
        }
    }

    public boolean isRunning() {
        synchronized (controlLock) {
            return token != null && !token.isCancelled();
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
        executor.shutdown();
        source.close();
    }

    /* ========================== Status ============================ */

    public EngineStatus status() {
        return snapshot.get().withRunning(isRunning(), clock.instant());
    }

    /* =========================== Loop ============================= */

    private void run(RunToken runToken) {
        while (!runToken.isCancelled()) {
            Duration wait;
            try {
                wait = handle(source.next());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Error in trading loop", e);
                wait = recordError(e.toString());
            }
            try {
                if (runToken.await(wait)) break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Trading loop for {} exited", pair);
    }

    private Duration handle(FeedResult result) {
        return switch (result.status()) {
            case CANDLE -> {
                backoff.onSuccess();
                warmUp(source.backfill());
                step(result.candle());
                yield source.pollInterval();
            }
            case TIMEOUT -> source.pollInterval();
            case ERROR -> {
                log.warn("Feed error: {}", result.error());
                yield recordError(result.error());
            }
        };
    }

    private Duration recordError(String error) {
        Duration wait = backoff.onError();
        log.warn("{} consecutive feed error(s), next read in {}s", backoff.consecutiveErrors(), wait.toSeconds());
        lastError = error;
        publish();
        return wait;
    }

    /** Feeds historical bars to the indicators without evaluating or trading on them. */
    void warmUp(List<Candle> history) {
        if (history.isEmpty()) return;
        for (Candle candle : history) {
            indicators.ingest(candle);
        }
        log.info("Indicators warmed up with {} historical bars for {}", history.size(), pair);
    }

    /**
     * One ingest → evaluate → transition cycle. Runs on the loop thread; callers may
     * also replay candles through it directly, but only while the loop is stopped.
     */
    public TransitionResult step(Candle candle) {
        log.info("Current {} price: {}", pair, candle.close());
        Optional<IndicatorSnapshot> reading = indicators.ingest(candle);
        TransitionResult result = TransitionResult.noOp();
        if (reading.isPresent()) {
            TradeSignal signal = policy.evaluate(reading.get(), ledger.openSide());
            lastSignal = signal;
            if (signal.isActionable()) {
                log.info("{} SIGNAL: {}", signal.type(), signal.reason());
                result = ledger.apply(signal);
                if (result.applied()) {
                    policy.recordAccepted(signal);
                    announce(result);
                } else if (result.outcome() == TransitionResult.Outcome.GATEWAY_FAILED) {
                    lastError = "Order failed for " + signal.type() + ": " + result.error();
                } else if (result.outcome() == TransitionResult.Outcome.REJECTED) {
                    lastError = "Rejected " + signal.type() + ": " + result.error();
                }
            } else {
                log.debug(signal.reason());
            }
        }
        publish();
        return result;
    }

    private void announce(TransitionResult result) {
        String text;
        Position p = result.position();
        if (result.outcome() == TransitionResult.Outcome.OPENED) {
            text = String.format("🟢 Opened %s %s %s @ %.2f (order %s)",
                    p.side(), p.quantity(), pair, p.entryPrice(), p.orderId());
        } else {
            Trade t = result.trade();
            text = String.format("🔴 Closed %s %s %s @ %.2f, PnL %.2f, total PnL %.2f (%s)",
                    t.side(), t.quantity(), pair, t.exitPrice(), t.pnl(), ledger.totalPnl(), t.reason());
        }
        try {
            notifier.send(text);
        } catch (RuntimeException e) {
            log.warn("Notification failed: {}", e.toString());
        }
    }

    private void publish() {
        PerformanceSummary summary = ledger.summary();
        snapshot.set(new EngineStatus(
                false,
                pair,
                indicators.latestClose(),
                ledger.position().orElse(null),
                ledger.recentTrades(RECENT_TRADES),
                ledger.tradeCount(),
                ledger.totalPnl(),
                summary.winRate(),
                summary,
                lastSignal,
                lastError,
                clock.instant()
        ));
    }

    LedgerState ledgerState() {
        return ledger.state();
    }

    /** Cancellation token of one loop run; {@link #await} doubles as an interruptible sleep. */
    static final class RunToken {
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private final CountDownLatch latch = new CountDownLatch(1);

        void cancel() {
            if (cancelled.compareAndSet(false, true)) latch.countDown();
        }

        boolean isCancelled() {
            return cancelled.get();
        }

        /** Waits up to {@code d}; returns true if cancelled meanwhile. */
        boolean await(Duration d) throws InterruptedException {
            if (d.isZero() || d.isNegative()) return isCancelled();
            return latch.await(d.toMillis(), TimeUnit.MILLISECONDS);
        }
    }
}
