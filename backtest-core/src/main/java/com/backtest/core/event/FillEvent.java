package com.backtest.core.event;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Simulated execution outcome of an {@link OrderEvent}.
 *
 * @param fillCost   per-unit execution price
 * @param commission total commission charged for the fill
 */
public record FillEvent(
    LocalDateTime timestamp,
    String symbol,
    String exchange,
    double quantity,
    OrderDirection direction,
    double fillCost,
    double commission
) implements Event {

    public FillEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(direction, "direction");
    }

    /** Quantity with the direction's sign applied. */
    public double signedQuantity() {
        return direction.sign() * quantity;
    }

    @Override
    public EventType type() {
        return EventType.FILL;
    }
}
