package com.backtest.core.performance;

import java.time.LocalDateTime;

/**
 * One row of the equity curve table.
 */
public record EquityCurvePoint(
    LocalDateTime timestamp,
    double cash,
    double commission,
    double total,
    double returns,
    double equityCurve,
    double drawdown
) {}
