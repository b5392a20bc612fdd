package com.backtest.core.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Immutable OHLCV bar with an adjustment factor and the derived adjusted close
 * and period return.
 */
public record Bar(
    LocalDateTime timestamp,
    double open,
    double high,
    double low,
    double close,
    long volume,
    double adjFactor,
    double adjClose,
    double returns
) {
    public Bar {
        Objects.requireNonNull(timestamp, "timestamp");
        if (close <= 0) {
            throw new IllegalArgumentException("Close price must be positive");
        }
    }

    /**
     * Raw bar as read from a feed. Adjusted close is derived, the return is 0
     * until the bar is placed on a calendar.
     */
    public static Bar of(LocalDateTime timestamp, double open, double high, double low,
                         double close, long volume, double adjFactor) {
        return new Bar(timestamp, open, high, low, close, volume, adjFactor, close * adjFactor, 0.0);
    }

    /** Copy stamped onto another calendar slot, used when forward-filling. */
    public Bar atTimestamp(LocalDateTime newTimestamp) {
        return new Bar(newTimestamp, open, high, low, close, volume, adjFactor, adjClose, returns);
    }

    /** Copy whose return is measured against the previous adjusted close. */
    public Bar withReturnFrom(double previousAdjClose) {
        double r = previousAdjClose > 0 ? adjClose / previousAdjClose - 1.0 : 0.0;
        return new Bar(timestamp, open, high, low, close, volume, adjFactor, adjClose, r);
    }
}
