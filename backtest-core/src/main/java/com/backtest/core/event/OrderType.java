package com.backtest.core.event;

public enum OrderType {
    MARKET, LIMIT
}
