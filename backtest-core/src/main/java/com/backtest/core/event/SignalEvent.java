package com.backtest.core.event;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Trade intent emitted by a strategy and consumed by the portfolio.
 *
 * @param strategyId identifier of the emitting strategy
 * @param symbol     instrument the signal refers to
 * @param timestamp  bar timestamp the signal was generated on
 * @param signalType LONG, SHORT or EXIT
 * @param strength   advisory sizing hint, not applied by the portfolio
 * @param quantity   requested quantity (ignored for EXIT, which closes the current position)
 */
public record SignalEvent(
    String strategyId,
    String symbol,
    LocalDateTime timestamp,
    SignalType signalType,
    double strength,
    double quantity
) implements Event {

    public static final double DEFAULT_QUANTITY = 100.0;

    public SignalEvent {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(signalType, "signalType");
    }

    public SignalEvent(String strategyId, String symbol, LocalDateTime timestamp, SignalType signalType, double strength) {
        this(strategyId, symbol, timestamp, signalType, strength, DEFAULT_QUANTITY);
    }

    @Override
    public EventType type() {
        return EventType.SIGNAL;
    }
}
