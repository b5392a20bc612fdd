package com.backtest.core.event;

/**
 * Tag carried by every event on the channel.
 */
public enum EventType {
    MARKET, SIGNAL, ORDER, FILL
}
