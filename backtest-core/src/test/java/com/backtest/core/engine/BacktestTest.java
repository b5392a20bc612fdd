package com.backtest.core.engine;

import com.backtest.core.data.InMemoryDataSource;
import com.backtest.core.event.Event;
import com.backtest.core.event.EventChannel;
import com.backtest.core.event.EventType;
import com.backtest.core.event.FillEvent;
import com.backtest.core.event.MarketEvent;
import com.backtest.core.event.SignalEvent;
import com.backtest.core.event.SignalType;
import com.backtest.core.exception.InvalidOrderException;
import com.backtest.core.exception.UnknownInstrumentException;
import com.backtest.core.execution.ExecutionHandler;
import com.backtest.core.execution.SimulatedExecutionHandler;
import com.backtest.core.model.Bar;
import com.backtest.core.model.MarketState;
import com.backtest.core.portfolio.HoldingsSnapshot;
import com.backtest.core.portfolio.Portfolio;
import com.backtest.core.portfolio.PositionSnapshot;
import com.backtest.core.strategy.ScriptedStrategy;
import com.backtest.core.strategy.Strategy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static com.backtest.core.BarFixtures.*;
import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end runs of the event loop on constant-price series, where every
 * number can be worked out by hand.
 */
@DisplayName("Backtest Tests")
class BacktestTest {

    private static final double CAPITAL = 1_000_000.0;
    private static final double DELTA = 1e-6;

    /** Wires a fresh engine over the given series and lets the caller script signals. */
    private static Backtest backtest(Map<String, List<Bar>> series, Consumer<ScriptedStrategy> script) {
        return backtest(series, script, new ArrayList<>());
    }

    /** Same wiring, collecting every fill the execution handler produces. */
    private static Backtest backtest(Map<String, List<Bar>> series, Consumer<ScriptedStrategy> script,
                                     List<FillEvent> fills) {
        var events = new EventChannel();
        var bars = new InMemoryDataSource(events, series);
        var strategy = new ScriptedStrategy("scripted", bars, events);
        script.accept(strategy);
        var portfolio = new Portfolio(bars, events, START, CAPITAL);
        var simulated = new SimulatedExecutionHandler(bars, events);
        ExecutionHandler recording = order -> {
            var fill = simulated.execute(order);
            fills.add(fill);
            return fill;
        };
        return new Backtest(bars, events, strategy, portfolio, recording, new SimpleMeterRegistry());
    }

    private static double position(PositionSnapshot row, String symbol) {
        return row.rawPositions().get(symbol);
    }

    @Nested
    @DisplayName("Smoothed entry and exit")
    class ScenarioTests {

        @Test
        @DisplayName("LONG 500 should be filled as five 100-share slices on consecutive ticks")
        void longShouldBeSmoothed() {
            var backtest = backtest(Map.of("AAA", flat(10, 10.0)), s -> s.on(1, "AAA", SignalType.LONG, 500));

            var result = backtest.run();

            assertThat(result.complete()).isTrue();
            assertThat(result.ticks()).isEqualTo(10);
            assertThat(result.positions()).hasSize(11);
            assertThat(result.positions().subList(1, 7))
                .extracting(row -> position(row, "AAA"))
                .containsExactly(100.0, 200.0, 300.0, 400.0, 500.0, 500.0);

            var last = result.finalHoldings();
            assertThat(last.cash()).isCloseTo(994_993.5, within(DELTA));
            assertThat(last.commission()).isCloseTo(6.5, within(DELTA));
            assertThat(last.marketValue("AAA")).isCloseTo(5_000.0, within(DELTA));
            assertThat(last.total()).isCloseTo(999_993.5, within(DELTA));
        }

        @Test
        @DisplayName("EXIT should unwind the whole position over five ticks")
        void exitShouldUnwind() {
            var backtest = backtest(Map.of("AAA", flat(12, 10.0)), s -> s
                .on(1, "AAA", SignalType.LONG, 500)
                .on(7, "AAA", SignalType.EXIT, 0));

            var result = backtest.run();

            assertThat(result.positions().subList(7, 13))
                .extracting(row -> position(row, "AAA"))
                .containsExactly(400.0, 300.0, 200.0, 100.0, 0.0, 0.0);
            assertThat(result.finalHoldings().cash()).isCloseTo(999_987.0, within(DELTA));
            assertThat(result.finalHoldings().total()).isCloseTo(999_987.0, within(DELTA));
            assertThat(backtest.portfolio().hasPendingOrders()).isFalse();
        }

        @Test
        @DisplayName("Unwinding a quantity that does not split evenly should leave the position exactly flat")
        void unevenUnwindShouldEndFlat() {
            var backtest = backtest(Map.of("AAA", flat(20, 10.0)), s -> s
                .on(1, "AAA", SignalType.LONG, 77)
                .on(7, "AAA", SignalType.EXIT, 0)
                .on(13, "AAA", SignalType.SHORT, 100));

            var result = backtest.run();

            var unwound = result.positions().get(11);
            assertThat(position(unwound, "AAA")).isEqualTo(0.0);
            assertThat(position(result.positions().get(12), "AAA")).isEqualTo(0.0);
            assertThat(position(result.positions().get(17), "AAA")).isEqualTo(-100.0);
            assertThat(backtest.portfolio().stateOf("AAA")).isEqualTo(MarketState.SHORT);
            assertThat(backtest.metrics().dispatchedCount(EventType.FILL)).isEqualTo(15);
        }

        @Test
        @DisplayName("Slices still queued when data runs out should stay unfilled")
        void pendingSlicesShouldSurviveExhaustion() {
            var backtest = backtest(Map.of("AAA", flat(3, 10.0)), s -> s.on(1, "AAA", SignalType.LONG, 500));

            var result = backtest.run();

            assertThat(result.complete()).isTrue();
            assertThat(position(result.positions().get(3), "AAA")).isEqualTo(300.0);
            assertThat(backtest.portfolio().pendingOrders("AAA")).hasSize(2);
        }
    }

    @Nested
    @DisplayName("Accounting")
    class AccountingTests {

        @Test
        @DisplayName("Total should equal cash plus market values on every row")
        void totalShouldBeCashPlusValues() {
            var series = Map.of(
                "AAA", closes(10, 11, 12, 11, 10, 9, 10, 11),
                "BBB", closes(20, 19, 18, 19, 20, 21, 22, 23));
            var result = backtest(series, s -> s
                .on(1, "AAA", SignalType.LONG, 250)
                .on(2, "BBB", SignalType.LONG, 100)
                .on(5, "AAA", SignalType.EXIT, 0)).run();

            for (HoldingsSnapshot row : result.holdings()) {
                double values = row.marketValues().values().stream().mapToDouble(Double::doubleValue).sum();
                assertThat(row.total()).isCloseTo(row.cash() + values, within(DELTA));
            }
        }

        @Test
        @DisplayName("Position should equal the signed sum of fills")
        void positionShouldMatchFills() {
            var backtest = backtest(Map.of("AAA", flat(10, 10.0)), s -> s
                .on(1, "AAA", SignalType.LONG, 300)
                .on(2, "AAA", SignalType.LONG, 200));

            var result = backtest.run();

            assertThat(backtest.metrics().dispatchedCount(EventType.FILL)).isEqualTo(10);
            assertThat(position(result.positions().get(result.positions().size() - 1), "AAA"))
                .isCloseTo(500.0, within(DELTA));
            assertThat(backtest.portfolio().bookValue("AAA")).isCloseTo(5_000.0, within(DELTA));
        }

        @Test
        @DisplayName("Every positions row should equal the running sum of fills up to its tick")
        void everyRowShouldMatchRunningFills() {
            List<FillEvent> fills = new ArrayList<>();
            var backtest = backtest(Map.of("AAA", flat(10, 10.0), "BBB", flat(10, 20.0)), s -> s
                .on(1, "AAA", SignalType.LONG, 250)
                .on(2, "BBB", SignalType.SHORT, 100)
                .on(3, "AAA", SignalType.LONG, 130)
                .on(6, "AAA", SignalType.EXIT, 0)
                .on(7, "BBB", SignalType.EXIT, 0), fills);

            var result = backtest.run();

            assertThat(fills).isNotEmpty();
            for (PositionSnapshot row : result.positions()) {
                for (var symbol : List.of("AAA", "BBB")) {
                    double expected = fills.stream()
                        .filter(fill -> fill.symbol().equals(symbol))
                        .filter(fill -> !fill.timestamp().isAfter(row.timestamp()))
                        .mapToDouble(FillEvent::signedQuantity)
                        .sum();
                    assertThat(position(row, symbol))
                        .as("%s at %s", symbol, row.timestamp())
                        .isCloseTo(expected, within(DELTA));
                }
            }
        }

        @Test
        @DisplayName("Independent runs over the same inputs should produce identical histories")
        void runsShouldBeDeterministic() {
            var series = Map.of(
                "AAA", closes(10, 11, 12, 11, 10, 9, 10, 11),
                "BBB", closes(20, 19, 18, 19, 20, 21, 22, 23));
            Consumer<ScriptedStrategy> script = s -> s
                .on(1, "AAA", SignalType.LONG, 250)
                .on(3, "BBB", SignalType.SHORT, 100)
                .on(6, "AAA", SignalType.EXIT, 0);

            var first = backtest(series, script).run();
            var second = backtest(series, script).run();

            assertThat(second.holdings()).isEqualTo(first.holdings());
            assertThat(second.positions()).isEqualTo(first.positions());
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureTests {

        @Test
        @DisplayName("Invalid order should abort the run without further snapshots")
        void invalidOrderShouldAbort() {
            var backtest = backtest(Map.of("AAA", flat(10, 10.0)), s -> s.on(3, "AAA", SignalType.LONG, 0));

            var result = backtest.run();

            assertThat(result.complete()).isFalse();
            assertThat(result.failure()).containsInstanceOf(InvalidOrderException.class);
            assertThat(result.ticks()).isEqualTo(3);
            assertThat(result.holdings()).hasSize(3);
            assertThat(result.finalHoldings().timestamp()).isEqualTo(day(2));
        }

        @Test
        @DisplayName("Signal for an instrument outside the universe should abort the run")
        void unknownInstrumentShouldAbort() {
            var events = new EventChannel();
            var bars = new InMemoryDataSource(events, Map.of("AAA", flat(10, 10.0)));
            Strategy rogue = new Strategy() {
                private int tick;

                @Override
                public void onEvent(Event event) {
                    if (event instanceof MarketEvent && ++tick == 2) {
                        events.put(new SignalEvent("rogue", "ZZZ", bars.latestBarTimestamp("AAA"), SignalType.LONG, 1.0));
                    }
                }

                @Override
                public String id() {
                    return "rogue";
                }
            };
            var portfolio = new Portfolio(bars, events, START, CAPITAL);
            var backtest = new Backtest(bars, events, rogue, portfolio, new SimulatedExecutionHandler(bars, events));

            var result = backtest.run();

            assertThat(result.complete()).isFalse();
            assertThat(result.failure()).containsInstanceOf(UnknownInstrumentException.class);
            assertThat(result.ticks()).isEqualTo(2);
            assertThat(result.holdings()).hasSize(2);
            assertThat(events.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Should refuse to run twice")
        void shouldRunOnce() {
            var backtest = backtest(Map.of("AAA", flat(2, 10.0)), s -> {});
            backtest.run();

            assertThatThrownBy(backtest::run).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Metrics")
    class MetricsTests {

        @Test
        @DisplayName("Should count dispatched events per type, ticks and commission")
        void shouldCountEvents() {
            var backtest = backtest(Map.of("AAA", flat(10, 10.0)), s -> s.on(1, "AAA", SignalType.LONG, 500));

            backtest.run();

            var metrics = backtest.metrics();
            assertThat(metrics.tickCount()).isEqualTo(10);
            assertThat(metrics.dispatchedCount(EventType.MARKET)).isEqualTo(10);
            assertThat(metrics.dispatchedCount(EventType.SIGNAL)).isEqualTo(1);
            assertThat(metrics.dispatchedCount(EventType.ORDER)).isEqualTo(5);
            assertThat(metrics.dispatchedCount(EventType.FILL)).isEqualTo(5);
            assertThat(metrics.commissionPaid()).isCloseTo(6.5, within(DELTA));
            assertThat(metrics.getRegistry().find("backtest.events.dispatched")
                .tag("type", "fill").counter()).isNotNull();
        }
    }
}
