package com.backtest.core.execution;

/**
 * Commission charged for a fill of a given quantity, in portfolio currency.
 */
@FunctionalInterface
public interface CommissionModel {

    double commission(double quantity);

    static CommissionModel free() {
        return quantity -> 0.0;
    }
}
