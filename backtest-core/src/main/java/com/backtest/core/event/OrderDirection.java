package com.backtest.core.event;

public enum OrderDirection {
    BUY(1), SELL(-1);

    private final int sign;

    OrderDirection(int sign) {
        this.sign = sign;
    }

    /** +1 for BUY, -1 for SELL. */
    public int sign() {
        return sign;
    }
}
