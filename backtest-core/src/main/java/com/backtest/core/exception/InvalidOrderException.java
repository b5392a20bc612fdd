package com.backtest.core.exception;

/**
 * Thrown when an order cannot be constructed, e.g. a non-positive quantity.
 */
public class InvalidOrderException extends BacktestException {

    public InvalidOrderException(String message) {
        super(message);
    }
}
