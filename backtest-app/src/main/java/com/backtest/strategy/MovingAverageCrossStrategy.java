package com.backtest.strategy;

import com.backtest.core.data.DataSource;
import com.backtest.core.event.Event;
import com.backtest.core.event.EventChannel;
import com.backtest.core.event.MarketEvent;
import com.backtest.core.event.SignalEvent;
import com.backtest.core.event.SignalType;
import com.backtest.core.model.BarField;
import com.backtest.core.model.MarketState;
import com.backtest.core.strategy.Strategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Long-only moving average crossover on adjusted close.
 *
 * <p>Goes LONG when the short simple moving average rises above the long one
 * and EXITs when it falls back below. Both averages lag the market by one bar:
 * on tick t they run over the bars before t, so the first tick never trades.
 * While fewer bars than a window are available the average runs over the
 * bars seen so far.
 */
public final class MovingAverageCrossStrategy implements Strategy {
    private static final Logger logger = LoggerFactory.getLogger(MovingAverageCrossStrategy.class);

    public static final String ID = "MAC";

    private final DataSource bars;
    private final EventChannel events;
    private final int shortWindow;
    private final int longWindow;
    private final double quantity;
    private final Map<String, MarketState> states = new HashMap<>();

    public MovingAverageCrossStrategy(DataSource bars, EventChannel events,
                                      int shortWindow, int longWindow, double quantity) {
        if (shortWindow < 1 || longWindow <= shortWindow) {
            throw new IllegalArgumentException(
                "Windows must satisfy 1 <= short < long, got " + shortWindow + "/" + longWindow);
        }
        this.bars = bars;
        this.events = events;
        this.shortWindow = shortWindow;
        this.longWindow = longWindow;
        this.quantity = quantity;
        bars.symbols().forEach(symbol -> states.put(symbol, MarketState.OUT));
    }

    @Override
    public void onEvent(Event event) {
        if (!(event instanceof MarketEvent)) {
            return;
        }
        for (var symbol : bars.symbols()) {
            var closes = bars.latestBarsValues(symbol, BarField.ADJ_CLOSE, longWindow + 1);
            if (closes.length < 2) {
                continue;
            }
            var prior = Arrays.copyOf(closes, closes.length - 1);
            double shortSma = mean(prior, shortWindow);
            double longSma = mean(prior, longWindow);
            var state = states.get(symbol);

            if (shortSma > longSma && state == MarketState.OUT) {
                emit(symbol, SignalType.LONG);
                states.put(symbol, MarketState.LONG);
            } else if (shortSma < longSma && state == MarketState.LONG) {
                emit(symbol, SignalType.EXIT);
                states.put(symbol, MarketState.OUT);
            }
        }
    }

    private void emit(String symbol, SignalType type) {
        var timestamp = bars.latestBarTimestamp(symbol);
        logger.debug("{} {} at {}", type, symbol, timestamp);
        events.put(new SignalEvent(ID, symbol, timestamp, type, 1.0, quantity));
    }

    /** Mean of the last {@code window} values, or of all of them when fewer are available. */
    static double mean(double[] values, int window) {
        int from = Math.max(0, values.length - window);
        double sum = 0.0;
        for (int i = from; i < values.length; i++) {
            sum += values[i];
        }
        return sum / (values.length - from);
    }

    @Override
    public String id() {
        return ID;
    }

    public MarketState stateOf(String symbol) {
        return states.getOrDefault(symbol, MarketState.OUT);
    }
}
