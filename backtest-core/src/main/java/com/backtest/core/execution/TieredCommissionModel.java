package com.backtest.core.execution;

/**
 * Two-tier per-share schedule with a minimum ticket charge, modelled on
 * Interactive Brokers' API directed-order fees (exchange and ECN fees excluded).
 *
 * <pre>
 *   qty &lt;= 500 : max(1.30, 0.013 * qty)
 *   qty  &gt; 500 : max(1.30, 0.008 * qty)
 * </pre>
 */
public final class TieredCommissionModel implements CommissionModel {

    public static final double MINIMUM = 1.30;
    public static final double SMALL_ORDER_RATE = 0.013;
    public static final double LARGE_ORDER_RATE = 0.008;
    public static final double TIER_BOUNDARY = 500.0;

    @Override
    public double commission(double quantity) {
        double rate = quantity <= TIER_BOUNDARY ? SMALL_ORDER_RATE : LARGE_ORDER_RATE;
        return Math.max(MINIMUM, rate * quantity);
    }
}
