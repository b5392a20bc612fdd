package com.backtest.core.strategy;

import com.backtest.core.data.DataSource;
import com.backtest.core.event.Event;
import com.backtest.core.event.EventChannel;
import com.backtest.core.event.MarketEvent;
import com.backtest.core.event.SignalEvent;
import com.backtest.core.event.SignalType;
import com.backtest.core.exception.UnknownInstrumentException;
import com.backtest.core.model.MarketState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reference strategy that replays a fixed script of signals keyed by tick number
 * (1 = first market event). Useful for driving the engine deterministically.
 */
public final class ScriptedStrategy implements Strategy {
    private static final Logger logger = LoggerFactory.getLogger(ScriptedStrategy.class);

    private final String id;
    private final DataSource bars;
    private final EventChannel events;
    private final Map<Integer, List<Step>> script = new TreeMap<>();
    private final Map<String, MarketState> states = new HashMap<>();

    private int tick;

    public ScriptedStrategy(String id, DataSource bars, EventChannel events) {
        this.id = id;
        this.bars = bars;
        this.events = events;
        bars.symbols().forEach(symbol -> states.put(symbol, MarketState.OUT));
    }

    /**
     * Schedule a signal for the given tick.
     */
    public ScriptedStrategy on(int tickNumber, String symbol, SignalType type, double quantity) {
        if (!states.containsKey(symbol)) {
            throw new UnknownInstrumentException(symbol);
        }
        if (tickNumber < 1) {
            throw new IllegalArgumentException("Tick numbers start at 1");
        }
        script.computeIfAbsent(tickNumber, t -> new ArrayList<>()).add(new Step(symbol, type, quantity));
        return this;
    }

    @Override
    public void onEvent(Event event) {
        if (!(event instanceof MarketEvent)) {
            return;
        }
        tick++;
        for (var step : script.getOrDefault(tick, List.of())) {
            var timestamp = bars.latestBarTimestamp(step.symbol());
            events.put(new SignalEvent(id, step.symbol(), timestamp, step.type(), 1.0, step.quantity()));
            states.put(step.symbol(), step.type() == SignalType.EXIT ? MarketState.OUT
                : step.type() == SignalType.LONG ? MarketState.LONG : MarketState.SHORT);
            logger.debug("{}: {} {} at tick {}", id, step.type(), step.symbol(), tick);
        }
    }

    @Override
    public String id() {
        return id;
    }

    public MarketState stateOf(String symbol) {
        var state = states.get(symbol);
        if (state == null) {
            throw new UnknownInstrumentException(symbol);
        }
        return state;
    }

    private record Step(String symbol, SignalType type, double quantity) {}
}
