package com.backtest.core.portfolio;

import com.backtest.core.event.OrderDirection;
import com.backtest.core.event.OrderEvent;
import com.backtest.core.event.OrderType;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits one trade intent into equal market-order slices with delays
 * 0..window-1. Each slice is the step between cumulative targets
 * quantity·i/window, so the last slice absorbs the rounding remainder.
 */
public final class OrderSmoother {

    public static final int DEFAULT_WINDOW = 5;

    private final int window;

    public OrderSmoother() {
        this(DEFAULT_WINDOW);
    }

    public OrderSmoother(int window) {
        if (window < 1) {
            throw new IllegalArgumentException("Smoothing window must be at least 1, got " + window);
        }
        this.window = window;
    }

    public int window() {
        return window;
    }

    /**
     * @throws com.backtest.core.exception.InvalidOrderException if the quantity is not positive
     */
    public List<PendingOrder> slice(LocalDateTime timestamp, String symbol, double quantity, OrderDirection direction) {
        List<PendingOrder> slices = new ArrayList<>(window);
        for (int i = 0; i < window; i++) {
            // difference of cumulative targets, so the last slice lands exactly on quantity
            double from = quantity * i / window;
            double to = i == window - 1 ? quantity : quantity * (i + 1) / window;
            double qty = to - from;
            slices.add(new PendingOrder(new OrderEvent(timestamp, symbol, OrderType.MARKET, qty, direction), i));
        }
        return slices;
    }
}
