package com.backtest.core.event;

/**
 * Sealed interface for everything that travels over the {@link EventChannel}.
 * Each variant is an immutable record; construction validates its invariants.
 */
public sealed interface Event permits MarketEvent, SignalEvent, OrderEvent, FillEvent {

    EventType type();
}
