package com.backtest.core.event;

public enum SignalType {
    LONG, SHORT, EXIT
}
