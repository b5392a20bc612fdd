package com.backtest.core.execution;

import com.backtest.core.event.FillEvent;
import com.backtest.core.event.OrderEvent;

/**
 * Turns orders into fills. Implementations put exactly one fill event on the
 * channel per order they execute.
 */
public interface ExecutionHandler {

    FillEvent execute(OrderEvent order);
}
