package com.backtest.core.execution;

import com.backtest.core.data.DataSource;
import com.backtest.core.event.EventChannel;
import com.backtest.core.event.FillEvent;
import com.backtest.core.event.OrderEvent;
import com.backtest.core.model.BarField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills every order in full at the instrument's latest close. No latency,
 * slippage or partial fills; commission comes from the {@link CommissionModel}.
 * The fill is stamped with the latest bar timestamp, never the wall clock.
 */
public final class SimulatedExecutionHandler implements ExecutionHandler {
    private static final Logger logger = LoggerFactory.getLogger(SimulatedExecutionHandler.class);

    public static final String DEFAULT_EXCHANGE = "ARCA";

    private final DataSource bars;
    private final EventChannel events;
    private final CommissionModel commissionModel;
    private final String exchange;

    public SimulatedExecutionHandler(DataSource bars, EventChannel events) {
        this(bars, events, new TieredCommissionModel(), DEFAULT_EXCHANGE);
    }

    public SimulatedExecutionHandler(DataSource bars, EventChannel events,
                                     CommissionModel commissionModel, String exchange) {
        this.bars = bars;
        this.events = events;
        this.commissionModel = commissionModel;
        this.exchange = exchange;
    }

    @Override
    public FillEvent execute(OrderEvent order) {
        var symbol = order.symbol();
        double price = bars.latestBarValue(symbol, BarField.CLOSE);
        double commission = commissionModel.commission(order.quantity());

        var fill = new FillEvent(
            bars.latestBarTimestamp(symbol),
            symbol,
            exchange,
            order.quantity(),
            order.direction(),
            price,
            commission
        );
        events.put(fill);

        logger.debug("Executed {} {} {} @ {} on {}", order.direction(), order.quantity(), symbol, price, exchange);
        return fill;
    }
}
