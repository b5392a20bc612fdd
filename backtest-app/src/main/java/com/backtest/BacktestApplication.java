package com.backtest;

import com.backtest.config.BacktestConfig;
import com.backtest.core.data.BarSeriesAligner;
import com.backtest.core.data.InMemoryDataSource;
import com.backtest.core.engine.Backtest;
import com.backtest.core.engine.BacktestResult;
import com.backtest.core.event.EventChannel;
import com.backtest.core.execution.SimulatedExecutionHandler;
import com.backtest.core.execution.TieredCommissionModel;
import com.backtest.core.model.Bar;
import com.backtest.core.performance.PerformanceAnalyzer;
import com.backtest.core.performance.PerformanceSummary;
import com.backtest.core.portfolio.OrderSmoother;
import com.backtest.core.portfolio.Portfolio;
import com.backtest.data.CsvBarLoader;
import com.backtest.report.ReportWriter;
import com.backtest.strategy.MovingAverageCrossStrategy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

/**
 * Command-line runner: loads the configured CSV bars, runs the moving average
 * cross strategy through the event loop and writes the reports.
 *
 * <p>Usage: {@code BacktestApplication [config-path]}. Without an argument the
 * configuration is read from {@code backtest.properties}.
 */
public final class BacktestApplication {
    private static final Logger logger = LoggerFactory.getLogger(BacktestApplication.class);

    private final BacktestConfig config;
    private final MeterRegistry registry;

    public BacktestApplication(BacktestConfig config) {
        this(config, new SimpleMeterRegistry());
    }

    public BacktestApplication(BacktestConfig config, MeterRegistry registry) {
        this.config = config;
        this.registry = registry;
    }

    public static void main(String[] args) {
        var config = args.length > 0 ? BacktestConfig.load(Path.of(args[0])) : BacktestConfig.load();
        var summary = new BacktestApplication(config).run();
        System.out.println(summary.format());
        if (!summary.complete()) {
            System.exit(1);
        }
    }

    /**
     * Runs one backtest end to end and writes {@code equity.csv} and
     * {@code summary.json} to the output directory.
     */
    public PerformanceSummary run() {
        logger.info("Running backtest with {}", config);

        var series = new CsvBarLoader(config.dataDir()).load(config.symbols());
        var start = config.startDate().map(date -> date.atStartOfDay()).orElse(null);
        var end = config.endDate().map(date -> date.atTime(LocalTime.MAX)).orElse(null);

        var events = new EventChannel();
        var bars = new InMemoryDataSource(events, series, new BarSeriesAligner(start, end));
        var strategy = new MovingAverageCrossStrategy(bars, events,
            config.shortWindow(), config.longWindow(), config.signalQuantity());
        var portfolio = new Portfolio(bars, events, start != null ? start : firstTimestamp(series),
            config.initialCapital(), new OrderSmoother(config.smoothingWindow()));
        var execution = new SimulatedExecutionHandler(bars, events, new TieredCommissionModel(), config.exchange());

        BacktestResult result = new Backtest(bars, events, strategy, portfolio, execution, registry).run();
        result.failure().ifPresent(e -> logger.error("Run incomplete: {}", e.getMessage()));

        var analyzer = new PerformanceAnalyzer(config.frequency());
        var curve = analyzer.equityCurve(result.holdings());
        var summary = analyzer.summarize(curve, result.complete());

        var reports = new ReportWriter(config.outputDir());
        reports.writeEquityCurve(curve, result.complete());
        reports.writeSummary(summary);
        return summary;
    }

    private static LocalDateTime firstTimestamp(Map<String, List<Bar>> series) {
        return series.values().stream()
            .filter(bars -> !bars.isEmpty())
            .map(bars -> bars.get(0).timestamp())
            .min(LocalDateTime::compareTo)
            .orElseThrow(() -> new IllegalStateException("No bars loaded for " + series.keySet()));
    }
}
