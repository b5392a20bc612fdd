package com.backtest.core.engine;

import com.backtest.core.event.EventType;
import com.backtest.core.event.FillEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer counters for one run: events dispatched per type, ticks and
 * commission paid.
 */
public final class EventMetrics {

    private final MeterRegistry registry;
    private final Map<EventType, Counter> dispatched = new EnumMap<>(EventType.class);
    private final Counter ticks;
    private final Counter commission;

    public EventMetrics(MeterRegistry registry, String runId) {
        this.registry = registry;
        for (var type : EventType.values()) {
            dispatched.put(type, registry.counter("backtest.events.dispatched",
                "run", runId,
                "type", type.name().toLowerCase()));
        }
        this.ticks = registry.counter("backtest.ticks", "run", runId);
        this.commission = registry.counter("backtest.commission", "run", runId);
    }

    public void recordDispatch(EventType type) {
        dispatched.get(type).increment();
    }

    public void recordTick() {
        ticks.increment();
    }

    public void recordFill(FillEvent fill) {
        commission.increment(fill.commission());
    }

    public long dispatchedCount(EventType type) {
        return (long) dispatched.get(type).count();
    }

    public long tickCount() {
        return (long) ticks.count();
    }

    public double commissionPaid() {
        return commission.count();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
