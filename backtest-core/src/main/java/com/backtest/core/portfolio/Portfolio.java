package com.backtest.core.portfolio;

import com.backtest.core.data.DataSource;
import com.backtest.core.event.EventChannel;
import com.backtest.core.event.FillEvent;
import com.backtest.core.event.MarketEvent;
import com.backtest.core.event.OrderDirection;
import com.backtest.core.event.SignalEvent;
import com.backtest.core.exception.UnknownInstrumentException;
import com.backtest.core.model.BarField;
import com.backtest.core.model.MarketState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks positions and holdings of every instrument at bar resolution and turns
 * signals into smoothed orders.
 *
 * <p>Signals are split by the {@link OrderSmoother} into slices queued per
 * instrument. When a new signal arrives for an instrument with pending slices,
 * the existing slices are deferred one tick before the new ones are appended;
 * due slices (delay 0) are then released and the rest counted down. Every market
 * event releases due slices and counts down the others, so a single signal is
 * executed over {@code window} consecutive ticks, FIFO per instrument.
 *
 * <p>The portfolio is the only mutator of positions, holdings and order queues.
 * Not thread-safe.
 */
public final class Portfolio {
    private static final Logger logger = LoggerFactory.getLogger(Portfolio.class);

    /** Positions closer to zero than this are residue of slice rounding and count as flat. */
    static final double FLAT_TOLERANCE = 1e-9;

    private final DataSource bars;
    private final EventChannel events;
    private final List<String> symbols;
    private final OrderSmoother smoother;

    private final Map<String, List<PendingOrder>> orderQueues = new LinkedHashMap<>();
    private final Map<String, Double> currentPositions = new LinkedHashMap<>();
    private final Map<String, Double> bookValues = new LinkedHashMap<>();
    private double cash;
    private double commission;

    private final List<PositionSnapshot> allPositions = new ArrayList<>();
    private final List<HoldingsSnapshot> allHoldings = new ArrayList<>();

    public Portfolio(DataSource bars, EventChannel events, LocalDateTime startDate, double initialCapital) {
        this(bars, events, startDate, initialCapital, new OrderSmoother());
    }

    public Portfolio(DataSource bars, EventChannel events, LocalDateTime startDate,
                     double initialCapital, OrderSmoother smoother) {
        this.bars = bars;
        this.events = events;
        this.symbols = List.copyOf(bars.symbols());
        this.smoother = smoother;
        this.cash = initialCapital;

        for (var symbol : symbols) {
            orderQueues.put(symbol, new ArrayList<>());
            currentPositions.put(symbol, 0.0);
            bookValues.put(symbol, 0.0);
        }

        var zeros = zeroRow();
        allPositions.add(new PositionSnapshot(startDate, zeros, zeros));
        allHoldings.add(new HoldingsSnapshot(startDate, zeros, zeros, initialCapital, 0.0,
            initialCapital, initialCapital));

        logger.info("Portfolio initialized with {} symbols, capital {}, smoothing window {}",
            symbols.size(), String.format("%.2f", initialCapital), smoother.window());
    }

    // ========================================================================
    // SIGNALS
    // ========================================================================

    /**
     * Converts a signal into smoothed order slices and releases the ones due now.
     *
     * @throws com.backtest.core.exception.InvalidOrderException for a non-positive requested quantity
     */
    public void onSignal(SignalEvent signal) {
        var symbol = signal.symbol();
        var queue = queueOf(symbol);
        var slices = slicesFor(signal);

        // Pending slices keep their schedule: +1 here, -1 in the release pass below
        queue.forEach(PendingOrder::defer);
        queue.addAll(slices);

        var iterator = queue.iterator();
        while (iterator.hasNext()) {
            var pending = iterator.next();
            if (pending.isDue()) {
                release(pending);
                iterator.remove();
            } else {
                pending.countDown();
            }
        }
    }

    private List<PendingOrder> slicesFor(SignalEvent signal) {
        var symbol = signal.symbol();
        double current = currentPositions.get(symbol);
        var timestamp = signal.timestamp();

        return switch (signal.signalType()) {
            case LONG -> smoother.slice(timestamp, symbol, signal.quantity(), OrderDirection.BUY);
            case SHORT -> {
                if (current == 0.0) {
                    yield smoother.slice(timestamp, symbol, signal.quantity(), OrderDirection.SELL);
                }
                logger.debug("Ignoring SHORT for {} with open position {}", symbol, current);
                yield List.of();
            }
            case EXIT -> {
                if (current != 0.0) {
                    var direction = current > 0 ? OrderDirection.SELL : OrderDirection.BUY;
                    yield smoother.slice(timestamp, symbol, Math.abs(current), direction);
                }
                logger.debug("Ignoring EXIT for {} with no position", symbol);
                yield List.of();
            }
        };
    }

    // ========================================================================
    // MARKET
    // ========================================================================

    /**
     * Works through every instrument queue once: due slices are released,
     * the others move one tick closer.
     */
    public void onMarket(MarketEvent event) {
        for (var entry : orderQueues.entrySet()) {
            var iterator = entry.getValue().iterator();
            while (iterator.hasNext()) {
                var pending = iterator.next();
                if (pending.isDue()) {
                    release(pending);
                    iterator.remove();
                } else {
                    pending.countDown();
                    logger.debug("{} slice moves to delay {}", entry.getKey(), pending.delay());
                }
            }
        }
    }

    private void release(PendingOrder pending) {
        logger.debug("Releasing {}", pending.order());
        events.put(pending.order());
    }

    // ========================================================================
    // FILLS
    // ========================================================================

    /**
     * Applies a fill to positions, cash, commission and book value.
     */
    public void onFill(FillEvent fill) {
        var symbol = fill.symbol();
        if (!currentPositions.containsKey(symbol)) {
            throw new UnknownInstrumentException(symbol);
        }
        double cost = fill.direction().sign() * fill.fillCost() * fill.quantity();

        double position = currentPositions.get(symbol) + fill.signedQuantity();
        currentPositions.put(symbol, Math.abs(position) < FLAT_TOLERANCE ? 0.0 : position);
        bookValues.merge(symbol, cost, Double::sum);
        commission += fill.commission();
        cash -= cost + fill.commission();

        logger.debug("Fill {} {} {} @ {} (commission {}), position now {}",
            fill.direction(), fill.quantity(), symbol, fill.fillCost(), fill.commission(),
            currentPositions.get(symbol));
    }

    // ========================================================================
    // SNAPSHOTS
    // ========================================================================

    /**
     * Appends a positions row and a holdings row for the latest bar. Instrument
     * market value is position times latest adjusted close; negative entries are
     * clamped to 0 in the reported row and kept signed in the raw view.
     */
    public void updateTimeIndex() {
        var timestamp = bars.latestBarTimestamp(symbols.get(0));

        Map<String, Double> positions = new HashMap<>();
        Map<String, Double> values = new HashMap<>();
        Map<String, Double> rawValues = new HashMap<>();
        double total = cash;
        double rawTotal = cash;

        for (var symbol : symbols) {
            double qty = currentPositions.get(symbol);
            positions.put(symbol, qty >= 0.0 ? qty : 0.0);

            double marketValue = qty * bars.latestBarValue(symbol, BarField.ADJ_CLOSE);
            double clamped = marketValue >= 0.0 ? marketValue : 0.0;
            values.put(symbol, clamped);
            rawValues.put(symbol, marketValue);
            total += clamped;
            rawTotal += marketValue;
        }

        allPositions.add(new PositionSnapshot(timestamp, positions, currentPositions));
        allHoldings.add(new HoldingsSnapshot(timestamp, values, rawValues, cash, commission, total, rawTotal));
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    public List<String> symbols() {
        return symbols;
    }

    public double position(String symbol) {
        var qty = currentPositions.get(symbol);
        if (qty == null) {
            throw new UnknownInstrumentException(symbol);
        }
        return qty;
    }

    public MarketState stateOf(String symbol) {
        return MarketState.ofPosition(position(symbol));
    }

    /** Net cash spent on an instrument at fill prices. */
    public double bookValue(String symbol) {
        position(symbol);
        return bookValues.get(symbol);
    }

    public double cash() {
        return cash;
    }

    public double commission() {
        return commission;
    }

    public List<PendingOrder> pendingOrders(String symbol) {
        return Collections.unmodifiableList(queueOf(symbol));
    }

    public boolean hasPendingOrders() {
        return orderQueues.values().stream().anyMatch(queue -> !queue.isEmpty());
    }

    public List<PositionSnapshot> positionsHistory() {
        return Collections.unmodifiableList(allPositions);
    }

    public List<HoldingsSnapshot> holdingsHistory() {
        return Collections.unmodifiableList(allHoldings);
    }

    private List<PendingOrder> queueOf(String symbol) {
        var queue = orderQueues.get(symbol);
        if (queue == null) {
            throw new UnknownInstrumentException(symbol);
        }
        return queue;
    }

    private Map<String, Double> zeroRow() {
        Map<String, Double> row = new HashMap<>();
        symbols.forEach(symbol -> row.put(symbol, 0.0));
        return row;
    }
}
