package com.backtest.core.performance;

import com.backtest.core.engine.BacktestResult;
import com.backtest.core.portfolio.HoldingsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Equity curve and summary statistics computed from a holdings history.
 *
 * <ul>
 *   <li>return[t] = total[t] / total[t-1] - 1, return[0] = 0</li>
 *   <li>equity[t] = cumulative product of (1 + return)</li>
 *   <li>Sharpe = sqrt(periods) * mean(returns) / stdev(returns), population stdev</li>
 *   <li>drawdown[t] = (peak equity so far - equity[t]) / peak</li>
 * </ul>
 */
public final class PerformanceAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(PerformanceAnalyzer.class);

    public static final int TRADING_DAYS_PER_YEAR = 252;
    private static final double EPSILON = 1e-12;

    private final int periods;

    public PerformanceAnalyzer() {
        this(TRADING_DAYS_PER_YEAR);
    }

    /**
     * @param periods bars per year used to annualize the Sharpe ratio
     */
    public PerformanceAnalyzer(int periods) {
        if (periods <= 0) {
            throw new IllegalArgumentException("Periods must be positive");
        }
        this.periods = periods;
    }

    public List<EquityCurvePoint> equityCurve(List<HoldingsSnapshot> holdings) {
        if (holdings.isEmpty()) {
            throw new IllegalArgumentException("Holdings history is empty");
        }
        List<EquityCurvePoint> curve = new ArrayList<>(holdings.size());
        double equity = 1.0;
        double peak = 1.0;
        double previousTotal = holdings.get(0).total();

        for (int i = 0; i < holdings.size(); i++) {
            var row = holdings.get(i);
            double r = i == 0 ? 0.0 : periodReturn(previousTotal, row.total());
            equity *= 1.0 + r;
            peak = Math.max(peak, equity);
            double drawdown = peak > 0 ? (peak - equity) / peak : 0.0;

            curve.add(new EquityCurvePoint(row.timestamp(), row.cash(), row.commission(), row.total(),
                r, equity, drawdown));
            previousTotal = row.total();
        }
        return curve;
    }

    public PerformanceSummary summarize(BacktestResult result) {
        return summarize(equityCurve(result.holdings()), result.complete());
    }

    public PerformanceSummary summarize(List<EquityCurvePoint> curve, boolean complete) {
        double totalReturn = curve.get(curve.size() - 1).equityCurve() - 1.0;
        double maxDrawdown = curve.stream().mapToDouble(EquityCurvePoint::drawdown).max().orElse(0.0);

        var summary = new PerformanceSummary(
            totalReturn * 100.0,
            sharpeRatio(curve),
            maxDrawdown * 100.0,
            drawdownDuration(curve),
            complete
        );
        logger.info("Performance: {}", summary.format());
        return summary;
    }

    double sharpeRatio(List<EquityCurvePoint> curve) {
        var returns = curve.stream().mapToDouble(EquityCurvePoint::returns).toArray();
        if (returns.length < 2) return 0.0;

        double mean = 0.0;
        for (double r : returns) mean += r;
        mean /= returns.length;

        double variance = 0.0;
        for (double r : returns) variance += (r - mean) * (r - mean);
        variance /= returns.length;

        double stdDev = Math.sqrt(variance);
        if (stdDev == 0) return 0.0;

        return Math.sqrt(periods) * mean / stdDev;
    }

    static int drawdownDuration(List<EquityCurvePoint> curve) {
        int longest = 0;
        int current = 0;
        for (var point : curve) {
            if (point.drawdown() > EPSILON) {
                current++;
                longest = Math.max(longest, current);
            } else {
                current = 0;
            }
        }
        return longest;
    }

    private static double periodReturn(double previous, double current) {
        return previous != 0.0 ? current / previous - 1.0 : 0.0;
    }
}
