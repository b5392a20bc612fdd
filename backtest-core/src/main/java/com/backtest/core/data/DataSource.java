package com.backtest.core.data;

import com.backtest.core.model.Bar;
import com.backtest.core.model.BarField;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Supplies time-ordered bars per instrument to the rest of the engine.
 *
 * <p>Implementations align every series onto a shared calendar before the run
 * starts, so each successful {@link #advance()} yields one synchronized bar per
 * instrument and puts exactly one {@code MarketEvent} on the channel.
 *
 * <p>All query methods throw {@code UnknownInstrumentException} for a symbol
 * outside {@link #symbols()} and {@code IllegalStateException} before the first
 * successful {@code advance()}.
 */
public interface DataSource {

    /** Instruments of the run, in declaration order. */
    List<String> symbols();

    Bar latestBar(String symbol);

    /**
     * Most recent {@code n} bars, oldest first, or fewer if history is shorter.
     */
    List<Bar> latestBars(String symbol, int n);

    LocalDateTime latestBarTimestamp(String symbol);

    double latestBarValue(String symbol, BarField field);

    /**
     * Last {@code n} values of one field, oldest first, or fewer if history is shorter.
     */
    double[] latestBarsValues(String symbol, BarField field, int n);

    /**
     * Pulls the next bar of every instrument into the latest view.
     *
     * @return false once the shared calendar is exhausted; no event is emitted then
     */
    boolean advance();

    /** False after {@link #advance()} has reported exhaustion. */
    boolean continueBacktest();
}
