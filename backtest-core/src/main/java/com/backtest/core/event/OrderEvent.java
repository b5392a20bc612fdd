package com.backtest.core.event;

import com.backtest.core.exception.InvalidOrderException;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Order sent from the portfolio to the execution simulator.
 * Quantity must be strictly positive; fractional quantities are allowed so that
 * smoothing slices of odd sizes stay exact.
 */
public record OrderEvent(
    LocalDateTime timestamp,
    String symbol,
    OrderType orderType,
    double quantity,
    OrderDirection direction
) implements Event {

    public OrderEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(orderType, "orderType");
        Objects.requireNonNull(direction, "direction");
        if (!(quantity > 0.0) || Double.isInfinite(quantity)) {
            throw new InvalidOrderException(
                "Order quantity must be positive, got " + quantity + " for " + symbol);
        }
    }

    @Override
    public EventType type() {
        return EventType.ORDER;
    }

    @Override
    public String toString() {
        return String.format("Order[%s %s %s qty=%s @ %s]", symbol, orderType, direction, quantity, timestamp);
    }
}
