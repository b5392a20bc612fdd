package com.backtest.core.data;

import com.backtest.core.model.Bar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Puts several instrument series on one trading calendar.
 *
 * <p>The calendar is the union of every series' timestamps inside the optional
 * [start, end] range. Gaps are forward-filled with the previous bar. Calendar
 * slots before every instrument has printed its first bar are dropped, so all
 * aligned series have the same length and identical timestamps. Period returns
 * are recomputed on the aligned series; the first bar's return is 0.
 */
public final class BarSeriesAligner {
    private static final Logger logger = LoggerFactory.getLogger(BarSeriesAligner.class);

    private final LocalDateTime start;
    private final LocalDateTime end;

    public BarSeriesAligner(LocalDateTime start, LocalDateTime end) {
        this.start = start;
        this.end = end;
    }

    public static BarSeriesAligner unbounded() {
        return new BarSeriesAligner(null, null);
    }

    public Map<String, List<Bar>> align(Map<String, List<Bar>> raw) {
        Map<String, List<Bar>> sorted = new LinkedHashMap<>();
        TreeSet<LocalDateTime> calendar = new TreeSet<>();

        for (var entry : raw.entrySet()) {
            var bars = entry.getValue().stream()
                .filter(this::inRange)
                .sorted(Comparator.comparing(Bar::timestamp))
                .toList();
            sorted.put(entry.getKey(), bars);
            bars.forEach(bar -> calendar.add(bar.timestamp()));
        }

        // First slot on which every instrument has data
        LocalDateTime firstCommon = null;
        for (var bars : sorted.values()) {
            if (bars.isEmpty()) {
                logger.warn("Empty series in universe, aligned calendar is empty");
                return emptyResult(sorted);
            }
            var first = bars.get(0).timestamp();
            if (firstCommon == null || first.isAfter(firstCommon)) {
                firstCommon = first;
            }
        }
        if (firstCommon == null) {
            return emptyResult(sorted);
        }
        var tradingDays = calendar.tailSet(firstCommon, true);
        int dropped = calendar.size() - tradingDays.size();
        if (dropped > 0) {
            logger.warn("Dropped {} leading calendar slots before {} where not every instrument had data",
                dropped, firstCommon);
        }

        Map<String, List<Bar>> aligned = new LinkedHashMap<>();
        for (var entry : sorted.entrySet()) {
            aligned.put(entry.getKey(), fill(entry.getValue(), tradingDays));
        }
        logger.debug("Aligned {} instruments onto {} calendar slots", aligned.size(), tradingDays.size());
        return aligned;
    }

    private List<Bar> fill(List<Bar> bars, NavigableSet<LocalDateTime> tradingDays) {
        List<Bar> out = new ArrayList<>(tradingDays.size());
        int idx = 0;
        Bar last = null;
        Bar previous = null;
        for (var day : tradingDays) {
            while (idx < bars.size() && !bars.get(idx).timestamp().isAfter(day)) {
                last = bars.get(idx++);
            }
            var slot = last.timestamp().equals(day) ? last : last.atTimestamp(day);
            slot = previous == null ? slot.withReturnFrom(slot.adjClose()) : slot.withReturnFrom(previous.adjClose());
            out.add(slot);
            previous = slot;
        }
        return out;
    }

    private boolean inRange(Bar bar) {
        var ts = bar.timestamp();
        return (start == null || !ts.isBefore(start)) && (end == null || !ts.isAfter(end));
    }

    private static Map<String, List<Bar>> emptyResult(Map<String, List<Bar>> sorted) {
        Map<String, List<Bar>> empty = new LinkedHashMap<>();
        sorted.keySet().forEach(symbol -> empty.put(symbol, List.of()));
        return empty;
    }
}
