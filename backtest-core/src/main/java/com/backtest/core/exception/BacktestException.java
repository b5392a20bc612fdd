package com.backtest.core.exception;

/**
 * Root of the errors that abort a simulation run.
 */
public class BacktestException extends RuntimeException {

    public BacktestException(String message) {
        super(message);
    }

    public BacktestException(String message, Throwable cause) {
        super(message, cause);
    }
}
