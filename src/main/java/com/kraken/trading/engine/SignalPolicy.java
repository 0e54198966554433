package com.kraken.trading.engine;

import com.kraken.trading.config.StrategyConfig;
import com.kraken.trading.model.Breakout;
import com.kraken.trading.model.IndicatorSnapshot;
import com.kraken.trading.model.PositionSide;
import com.kraken.trading.model.SignalType;
import com.kraken.trading.model.TradeSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Turns an indicator snapshot plus the current position into a trading signal.
 *
 * <p>{@link #evaluate} has no side effects. The debounce state only moves when the
 * caller confirms a signal with {@link #recordAccepted}, i.e. after the order went through.
 */
public class SignalPolicy {

    private static final Logger log = LoggerFactory.getLogger(SignalPolicy.class);

    private final StrategyConfig config;

    private PositionSide lastSignalSide;
    private Instant lastSignalTime;

    public SignalPolicy(StrategyConfig config) {
        this.config = config;
    }

    /**
     * @param snapshot indicators of the newest candle
     * @param open     side of the open position, or null when flat
     */
    public TradeSignal evaluate(IndicatorSnapshot snapshot, PositionSide open) {
        TradeSignal candidate = candidate(snapshot, open);
        if (!candidate.isActionable()) return candidate;

        boolean debounced = candidate.type().isEntry() || config.debounceExits();
        if (debounced && withinInterval(snapshot.timestamp())) {
            log.info("Suppressing {} at {}: last signal at {} is within {}s",
                    candidate.type(), snapshot.timestamp(), lastSignalTime, config.minSignalInterval().toSeconds());
            return TradeSignal.none(snapshot.close(), snapshot.timestamp(),
                    "Debounced " + candidate.type() + ": " + candidate.reason());
        }
        return candidate;
    }

    private TradeSignal candidate(IndicatorSnapshot s, PositionSide open) {
        double close = s.close();
        Instant at = s.timestamp();
        if (open == null) {
            if (close > s.trauma() && s.breakout() == Breakout.UP) {
                return new TradeSignal(SignalType.ENTER_LONG, close, at,
                        String.format("Upward breakout: close %.2f > trauma %.2f with volume surge", close, s.trauma()));
            }
            if (close < s.trauma() && s.breakout() == Breakout.DOWN) {
                return new TradeSignal(SignalType.ENTER_SHORT, close, at,
                        String.format("Downward breakout: close %.2f < trauma %.2f with volume surge", close, s.trauma()));
            }
        } else if (open == PositionSide.LONG && s.rsi() > config.overbought()) {
            return new TradeSignal(SignalType.EXIT_LONG, close, at,
                    String.format("RSI overbought: %.1f", s.rsi()));
        } else if (open == PositionSide.SHORT && s.rsi() < config.oversold()) {
            return new TradeSignal(SignalType.EXIT_SHORT, close, at,
                    String.format("RSI oversold: %.1f", s.rsi()));
        }
        return TradeSignal.none(close, at,
                String.format("No signal. Close: %.2f, trauma: %.2f, RSI: %.1f, breakout: %s",
                        close, s.trauma(), s.rsi(), s.breakout()));
    }

    private boolean withinInterval(Instant now) {
        if (lastSignalTime == null) return false;
        return Duration.between(lastSignalTime, now).compareTo(config.minSignalInterval()) < 0;
    }

    /** Confirms that a signal was acted upon. Entries arm the debounce; exits clear it. */
    public void recordAccepted(TradeSignal signal) {
        if (signal.type().isEntry()) {
            lastSignalSide = signal.type().side();
            lastSignalTime = signal.at();
        } else if (signal.type().isExit()) {
            lastSignalSide = null;
            lastSignalTime = null;
        }
    }

    public Optional<PositionSide> lastSignalSide() {
        return Optional.ofNullable(lastSignalSide);
    }

    public Optional<Instant> lastSignalTime() {
        return Optional.ofNullable(lastSignalTime);
    }
}
