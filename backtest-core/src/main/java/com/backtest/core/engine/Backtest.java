package com.backtest.core.engine;

import com.backtest.core.data.DataSource;
import com.backtest.core.event.Event;
import com.backtest.core.event.EventChannel;
import com.backtest.core.event.EventType;
import com.backtest.core.event.FillEvent;
import com.backtest.core.event.MarketEvent;
import com.backtest.core.event.OrderEvent;
import com.backtest.core.event.SignalEvent;
import com.backtest.core.exception.BacktestException;
import com.backtest.core.execution.ExecutionHandler;
import com.backtest.core.portfolio.Portfolio;
import com.backtest.core.strategy.Strategy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tick-by-tick event loop of one simulation.
 *
 * <p>Each iteration pulls one tick from the data source and drains the channel
 * in FIFO order until it is empty: market events go to the strategy and then to
 * the portfolio's order queues, signals to the portfolio, orders to the
 * execution handler and fills back to the portfolio. Once the tick is quiescent
 * the portfolio records its snapshot. The loop ends when the data source is
 * exhausted.
 *
 * <p>A {@link BacktestException} aborts the run: no further snapshot is taken and
 * the result is flagged incomplete. A run is single-threaded; independent runs
 * need independent channel, data source and portfolio instances.
 */
public final class Backtest {
    private static final Logger logger = LoggerFactory.getLogger(Backtest.class);

    private final DataSource bars;
    private final EventChannel events;
    private final Strategy strategy;
    private final Portfolio portfolio;
    private final ExecutionHandler execution;
    private final EventMetrics metrics;

    private int ticks;
    private boolean started;

    public Backtest(DataSource bars, EventChannel events, Strategy strategy,
                    Portfolio portfolio, ExecutionHandler execution) {
        this(bars, events, strategy, portfolio, execution, new SimpleMeterRegistry());
    }

    public Backtest(DataSource bars, EventChannel events, Strategy strategy,
                    Portfolio portfolio, ExecutionHandler execution, MeterRegistry registry) {
        this.bars = bars;
        this.events = events;
        this.strategy = strategy;
        this.portfolio = portfolio;
        this.execution = execution;
        this.metrics = new EventMetrics(registry, strategy.id());
    }

    /**
     * Runs the simulation to data exhaustion or to the first fatal error.
     */
    public BacktestResult run() {
        if (started) {
            throw new IllegalStateException("A backtest instance can only be run once");
        }
        started = true;
        logger.info("Starting backtest of {} over {}", strategy.id(), bars.symbols());

        try {
            while (bars.advance()) {
                ticks++;
                metrics.recordTick();
                drain();
                portfolio.updateTimeIndex();
            }
        } catch (BacktestException e) {
            logger.error("Backtest aborted at tick {}: {}", ticks, e.getMessage());
            events.clear();
            return result(false, e);
        }

        logger.info("Backtest finished after {} ticks ({} signals, {} orders, {} fills)",
            ticks,
            metrics.dispatchedCount(EventType.SIGNAL),
            metrics.dispatchedCount(EventType.ORDER),
            metrics.dispatchedCount(EventType.FILL));
        if (portfolio.hasPendingOrders()) {
            logger.warn("Data exhausted with smoothed orders still queued");
        }
        return result(true, null);
    }

    private void drain() {
        while (!events.isEmpty()) {
            var event = events.poll().orElseThrow();
            dispatch(event);
        }
    }

    private void dispatch(Event event) {
        metrics.recordDispatch(event.type());
        if (event instanceof MarketEvent market) {
            strategy.onEvent(market);
            portfolio.onMarket(market);
        } else if (event instanceof SignalEvent signal) {
            portfolio.onSignal(signal);
        } else if (event instanceof OrderEvent order) {
            execution.execute(order);
        } else if (event instanceof FillEvent fill) {
            metrics.recordFill(fill);
            portfolio.onFill(fill);
        }
    }

    private BacktestResult result(boolean complete, BacktestException error) {
        return new BacktestResult(portfolio.holdingsHistory(), portfolio.positionsHistory(), ticks, complete, error);
    }

    public EventMetrics metrics() {
        return metrics;
    }

    public Portfolio portfolio() {
        return portfolio;
    }
}
