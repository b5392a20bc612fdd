package com.backtest.report;

import com.backtest.core.performance.EquityCurvePoint;
import com.backtest.core.performance.PerformanceSummary;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Writes the equity curve as CSV and the summary statistics as JSON into an
 * output directory.
 */
public final class ReportWriter {
    private static final Logger logger = LoggerFactory.getLogger(ReportWriter.class);

    public static final String EQUITY_FILE = "equity.csv";
    public static final String PARTIAL_EQUITY_FILE = "equity.partial.csv";
    public static final String SUMMARY_FILE = "summary.json";

    private final Path directory;
    private final CsvMapper csvMapper;
    private final ObjectMapper objectMapper;

    public ReportWriter(Path directory) {
        this.directory = directory;
        this.csvMapper = CsvMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
        this.objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @JsonPropertyOrder({"timestamp", "cash", "commission", "total", "returns", "equity_curve", "drawdown"})
    record EquityRow(
        @JsonProperty("timestamp") LocalDateTime timestamp,
        @JsonProperty("cash") double cash,
        @JsonProperty("commission") double commission,
        @JsonProperty("total") double total,
        @JsonProperty("returns") double returns,
        @JsonProperty("equity_curve") double equityCurve,
        @JsonProperty("drawdown") double drawdown
    ) {
        static EquityRow of(EquityCurvePoint point) {
            return new EquityRow(point.timestamp(), point.cash(), point.commission(), point.total(),
                point.returns(), point.equityCurve(), point.drawdown());
        }
    }

    record SummaryDocument(
        @JsonProperty("total_return_pct") double totalReturnPct,
        @JsonProperty("sharpe_ratio") double sharpeRatio,
        @JsonProperty("max_drawdown_pct") double maxDrawdownPct,
        @JsonProperty("drawdown_duration") int drawdownDuration,
        @JsonProperty("complete") boolean complete
    ) {
        static SummaryDocument of(PerformanceSummary summary) {
            return new SummaryDocument(summary.totalReturnPct(), summary.sharpeRatio(),
                summary.maxDrawdownPct(), summary.drawdownDuration(), summary.complete());
        }
    }

    /**
     * Writes the curve to {@code equity.csv}, or to {@code equity.partial.csv}
     * when the run was aborted and the curve stops at the failing tick.
     */
    public Path writeEquityCurve(List<EquityCurvePoint> curve, boolean complete) {
        var file = prepare(complete ? EQUITY_FILE : PARTIAL_EQUITY_FILE);
        var rows = curve.stream().map(EquityRow::of).toList();
        var schema = csvMapper.schemaFor(EquityRow.class).withHeader();
        try (var writer = Files.newBufferedWriter(file)) {
            csvMapper.writer(schema).writeValue(writer, rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
        if (complete) {
            logger.info("Wrote {} equity rows to {}", rows.size(), file);
        } else {
            logger.warn("Run incomplete, wrote {} equity rows to {}", rows.size(), file);
        }
        return file;
    }

    public Path writeSummary(PerformanceSummary summary) {
        var file = prepare(SUMMARY_FILE);
        try {
            objectMapper.writeValue(file.toFile(), SummaryDocument.of(summary));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
        logger.info("Wrote summary to {}", file);
        return file;
    }

    private Path prepare(String name) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory " + directory, e);
        }
        return directory.resolve(name);
    }
}
