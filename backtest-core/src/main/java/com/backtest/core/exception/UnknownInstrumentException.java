package com.backtest.core.exception;

/**
 * Thrown when a component is asked about an instrument outside the run universe.
 */
public class UnknownInstrumentException extends BacktestException {

    private final String symbol;

    public UnknownInstrumentException(String symbol) {
        super("That symbol is not available in the historical data set: " + symbol);
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
