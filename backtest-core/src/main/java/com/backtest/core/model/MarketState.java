package com.backtest.core.model;

/**
 * Per-instrument exposure state tracked by strategies and the portfolio.
 */
public enum MarketState {
    OUT, LONG, SHORT;

    public static MarketState ofPosition(double quantity) {
        if (quantity > 0) return LONG;
        if (quantity < 0) return SHORT;
        return OUT;
    }
}
