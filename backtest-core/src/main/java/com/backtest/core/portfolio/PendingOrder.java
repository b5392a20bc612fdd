package com.backtest.core.portfolio;

import com.backtest.core.event.OrderEvent;

/**
 * Smoothed order slice waiting in an instrument queue.
 * The delay counts the market ticks left before release; 0 means due.
 */
public final class PendingOrder {
    private final OrderEvent order;
    private int delay;

    public PendingOrder(OrderEvent order, int delay) {
        if (delay < 0) {
            throw new IllegalArgumentException("Delay must not be negative");
        }
        this.order = order;
        this.delay = delay;
    }

    public OrderEvent order() {
        return order;
    }

    public int delay() {
        return delay;
    }

    public boolean isDue() {
        return delay == 0;
    }

    /** Push release back by one tick. */
    void defer() {
        delay++;
    }

    void countDown() {
        if (delay > 0) {
            delay--;
        }
    }

    @Override
    public String toString() {
        return order + " delay=" + delay;
    }
}
