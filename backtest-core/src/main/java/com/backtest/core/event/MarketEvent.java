package com.backtest.core.event;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * New bars are available for every instrument. Carries only the tick timestamp.
 */
public record MarketEvent(LocalDateTime timestamp) implements Event {

    public MarketEvent {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    @Override
    public EventType type() {
        return EventType.MARKET;
    }
}
