package com.backtest.core.data;

import com.backtest.core.event.EventChannel;
import com.backtest.core.event.MarketEvent;
import com.backtest.core.exception.UnknownInstrumentException;
import com.backtest.core.model.Bar;
import com.backtest.core.model.BarField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays fully materialized bar series. The series are aligned once at
 * construction; {@link #advance()} then walks the shared calendar.
 */
public final class InMemoryDataSource implements DataSource {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryDataSource.class);

    private final EventChannel events;
    private final List<String> symbols;
    private final Map<String, List<Bar>> aligned;
    private final Map<String, List<Bar>> history = new HashMap<>();
    private final int length;

    private int cursor;
    private boolean continueBacktest = true;

    public InMemoryDataSource(EventChannel events, Map<String, List<Bar>> series) {
        this(events, series, BarSeriesAligner.unbounded());
    }

    public InMemoryDataSource(EventChannel events, Map<String, List<Bar>> series, BarSeriesAligner aligner) {
        if (series.isEmpty()) {
            throw new IllegalArgumentException("At least one instrument series is required");
        }
        this.events = events;
        this.symbols = List.copyOf(series.keySet());
        this.aligned = aligner.align(new LinkedHashMap<>(series));
        this.length = aligned.get(symbols.get(0)).size();
        symbols.forEach(symbol -> history.put(symbol, new ArrayList<>()));

        logger.info("Data source ready: {} instruments, {} bars each", symbols.size(), length);
    }

    @Override
    public List<String> symbols() {
        return symbols;
    }

    @Override
    public Bar latestBar(String symbol) {
        var bars = historyOf(symbol);
        return bars.get(bars.size() - 1);
    }

    @Override
    public List<Bar> latestBars(String symbol, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must not be negative");
        }
        var bars = historyOf(symbol);
        return List.copyOf(bars.subList(Math.max(0, bars.size() - n), bars.size()));
    }

    @Override
    public LocalDateTime latestBarTimestamp(String symbol) {
        return latestBar(symbol).timestamp();
    }

    @Override
    public double latestBarValue(String symbol, BarField field) {
        return field.valueOf(latestBar(symbol));
    }

    @Override
    public double[] latestBarsValues(String symbol, BarField field, int n) {
        return latestBars(symbol, n).stream().mapToDouble(field::valueOf).toArray();
    }

    @Override
    public boolean advance() {
        if (cursor >= length) {
            if (continueBacktest) {
                logger.debug("Calendar exhausted after {} bars", length);
            }
            continueBacktest = false;
            return false;
        }
        for (var symbol : symbols) {
            history.get(symbol).add(aligned.get(symbol).get(cursor));
        }
        var timestamp = aligned.get(symbols.get(0)).get(cursor).timestamp();
        cursor++;
        events.put(new MarketEvent(timestamp));
        return true;
    }

    @Override
    public boolean continueBacktest() {
        return continueBacktest;
    }

    /** Number of calendar slots in the aligned feed. */
    public int length() {
        return length;
    }

    private List<Bar> historyOf(String symbol) {
        var bars = history.get(symbol);
        if (bars == null) {
            throw new UnknownInstrumentException(symbol);
        }
        if (bars.isEmpty()) {
            throw new IllegalStateException("No bar has been replayed yet for " + symbol);
        }
        return bars;
    }
}
