package com.backtest.core.strategy;

import com.backtest.core.event.Event;

/**
 * Base interface for trading strategies.
 *
 * <p>A strategy reacts only to market events, reads bar history from its data
 * source and puts zero or more signal events on the shared channel. It must be a
 * deterministic function of the event stream and the history it queries, and
 * must not emit a signal for an instrument it has no opinion on.
 */
public interface Strategy {

    /**
     * Handle one event from the channel. Non-market events are ignored.
     */
    void onEvent(Event event);

    /** Identifier stamped on emitted signals. */
    String id();
}
