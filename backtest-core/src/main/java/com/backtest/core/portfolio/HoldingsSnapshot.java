package com.backtest.core.portfolio;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Holdings row for one tick.
 *
 * <p>{@code marketValues} and {@code total} follow the reporting convention of
 * clamping negative market values to 0, which hides short exposure.
 * {@code rawMarketValues} and {@code rawTotal} keep the signed values.
 */
public record HoldingsSnapshot(
    LocalDateTime timestamp,
    Map<String, Double> marketValues,
    Map<String, Double> rawMarketValues,
    double cash,
    double commission,
    double total,
    double rawTotal
) {
    public HoldingsSnapshot {
        marketValues = Map.copyOf(marketValues);
        rawMarketValues = Map.copyOf(rawMarketValues);
    }

    public double marketValue(String symbol) {
        return marketValues.getOrDefault(symbol, 0.0);
    }
}
