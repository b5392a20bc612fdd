package com.backtest.core.performance;

/**
 * Summary statistics of a run.
 *
 * @param totalReturnPct    total return in percent
 * @param sharpeRatio       annualized Sharpe ratio, risk-free rate 0
 * @param maxDrawdownPct    largest decline from peak equity in percent
 * @param drawdownDuration  longest run of consecutive ticks below the running peak
 * @param complete          false when the run was aborted
 */
public record PerformanceSummary(
    double totalReturnPct,
    double sharpeRatio,
    double maxDrawdownPct,
    int drawdownDuration,
    boolean complete
) {
    public String format() {
        return String.format("Total Return: %.2f%% | Sharpe Ratio: %.2f | Max Drawdown: %.2f%% | Drawdown Duration: %d%s",
            totalReturnPct, sharpeRatio, maxDrawdownPct, drawdownDuration, complete ? "" : " | INCOMPLETE");
    }
}
