package com.backtest.core.performance;

import com.backtest.core.engine.BacktestResult;
import com.backtest.core.portfolio.HoldingsSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

import static com.backtest.core.BarFixtures.day;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PerformanceAnalyzer.
 */
@DisplayName("PerformanceAnalyzer Tests")
class PerformanceAnalyzerTest {

    private static final double DELTA = 1e-9;

    private final PerformanceAnalyzer analyzer = new PerformanceAnalyzer();

    private static List<HoldingsSnapshot> totals(double... totals) {
        List<HoldingsSnapshot> rows = new ArrayList<>();
        for (int i = 0; i < totals.length; i++) {
            rows.add(new HoldingsSnapshot(day(i), Map.of(), Map.of(), totals[i], 0.0, totals[i], totals[i]));
        }
        return rows;
    }

    private static double[] column(List<EquityCurvePoint> curve, ToDoubleFunction<EquityCurvePoint> field) {
        return curve.stream().mapToDouble(field).toArray();
    }

    @Nested
    @DisplayName("Equity curve")
    class EquityCurveTests {

        @Test
        @DisplayName("First return should be zero and equity should compound")
        void shouldCompoundReturns() {
            var curve = analyzer.equityCurve(totals(100, 110, 99));

            assertThat(column(curve, EquityCurvePoint::returns))
                .containsExactly(new double[] {0.0, 0.1, -0.1}, within(DELTA));
            assertThat(column(curve, EquityCurvePoint::equityCurve))
                .containsExactly(new double[] {1.0, 1.1, 0.99}, within(DELTA));
            assertThat(curve.get(2).timestamp()).isEqualTo(day(2));
        }

        @Test
        @DisplayName("Drawdown should be measured from the running peak")
        void drawdownShouldUseRunningPeak() {
            var curve = analyzer.equityCurve(totals(100, 110, 99, 121));

            assertThat(column(curve, EquityCurvePoint::drawdown))
                .containsExactly(new double[] {0.0, 0.0, 0.1, 0.0}, within(DELTA));
        }

        @Test
        @DisplayName("Should reject an empty holdings history")
        void shouldRejectEmptyHistory() {
            assertThatThrownBy(() -> analyzer.equityCurve(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Summary statistics")
    class SummaryTests {

        @Test
        @DisplayName("Sharpe ratio should annualize mean over population deviation")
        void shouldComputeSharpe() {
            var curve = analyzer.equityCurve(totals(100, 110, 121));

            // returns 0, 0.1, 0.1: mean / stdev = sqrt(2)
            assertThat(analyzer.sharpeRatio(curve)).isCloseTo(Math.sqrt(252 * 2.0), within(1e-6));
        }

        @Test
        @DisplayName("Sharpe ratio should be zero for a flat curve")
        void flatCurveShouldHaveZeroSharpe() {
            var curve = analyzer.equityCurve(totals(100, 100, 100, 100));

            assertThat(analyzer.sharpeRatio(curve)).isZero();
        }

        @Test
        @DisplayName("Should respect a custom annualization period")
        void shouldUseCustomPeriods() {
            var curve = analyzer.equityCurve(totals(100, 110, 121));

            assertThat(new PerformanceAnalyzer(12).sharpeRatio(curve)).isCloseTo(Math.sqrt(24.0), within(1e-6));
            assertThatThrownBy(() -> new PerformanceAnalyzer(0)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Drawdown duration should count the longest run below the peak")
        void shouldMeasureDrawdownDuration() {
            double[] totals = new double[14];
            totals[0] = 100;
            totals[1] = 110;
            for (int i = 2; i < 12; i++) {
                totals[i] = 109 - (i - 2);
            }
            totals[12] = 115;
            totals[13] = 114;

            var summary = analyzer.summarize(analyzer.equityCurve(totals(totals)), true);

            assertThat(summary.drawdownDuration()).isEqualTo(10);
            assertThat(summary.maxDrawdownPct()).isCloseTo((110.0 - 100.0) / 110.0 * 100.0, within(1e-6));
            assertThat(summary.totalReturnPct()).isCloseTo(14.0, within(1e-6));
            assertThat(summary.complete()).isTrue();
        }

        @Test
        @DisplayName("Summary of a result should carry its completeness")
        void shouldCarryCompleteness() {
            var result = new BacktestResult(totals(100, 95, 105), List.of(), 2, false, null);

            var summary = analyzer.summarize(result);

            assertThat(summary.complete()).isFalse();
            assertThat(summary.totalReturnPct()).isCloseTo(5.0, within(1e-6));
            assertThat(summary.format()).contains("Total Return:").contains("INCOMPLETE");
        }
    }
}
