package com.backtest.core.portfolio;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Positions row for one tick.
 *
 * @param positions    per-instrument quantity with negative values clamped to 0
 * @param rawPositions signed per-instrument quantity
 */
public record PositionSnapshot(
    LocalDateTime timestamp,
    Map<String, Double> positions,
    Map<String, Double> rawPositions
) {
    public PositionSnapshot {
        positions = Map.copyOf(positions);
        rawPositions = Map.copyOf(rawPositions);
    }
}
