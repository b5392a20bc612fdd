package com.backtest.core.model;

import java.util.function.ToDoubleFunction;

/**
 * Numeric fields of a {@link Bar} addressable by name.
 */
public enum BarField {
    OPEN(Bar::open),
    HIGH(Bar::high),
    LOW(Bar::low),
    CLOSE(Bar::close),
    VOLUME(bar -> (double) bar.volume()),
    ADJ_FACTOR(Bar::adjFactor),
    ADJ_CLOSE(Bar::adjClose),
    RETURNS(Bar::returns);

    private final ToDoubleFunction<Bar> accessor;

    BarField(ToDoubleFunction<Bar> accessor) {
        this.accessor = accessor;
    }

    public double valueOf(Bar bar) {
        return accessor.applyAsDouble(bar);
    }
}
