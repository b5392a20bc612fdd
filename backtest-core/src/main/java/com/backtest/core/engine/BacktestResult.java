package com.backtest.core.engine;

import com.backtest.core.exception.BacktestException;
import com.backtest.core.portfolio.HoldingsSnapshot;
import com.backtest.core.portfolio.PositionSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Output of a single run. An aborted run keeps the snapshots taken before the
 * failure and is flagged incomplete.
 *
 * @param error the failure that aborted the run, null when complete
 */
public record BacktestResult(
    List<HoldingsSnapshot> holdings,
    List<PositionSnapshot> positions,
    int ticks,
    boolean complete,
    BacktestException error
) {
    public BacktestResult {
        holdings = List.copyOf(holdings);
        positions = List.copyOf(positions);
    }

    public Optional<BacktestException> failure() {
        return Optional.ofNullable(error);
    }

    public HoldingsSnapshot finalHoldings() {
        return holdings.get(holdings.size() - 1);
    }
}
