package com.backtest.data;

import com.backtest.core.model.Bar;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads daily bars from one {@code <symbol>.csv} file per instrument.
 *
 * <p>Files carry a header row
 * {@code price_date,ticker,open_price,high_price,low_price,close_price,volume,adj_factor}.
 * Dates are ISO ({@code 2020-01-02}) or ISO date-time with a space or {@code T}
 * separator. A missing adjustment factor counts as 1. Rows are sorted by date
 * after loading. A row that does not make a valid bar fails the whole file.
 */
public final class CsvBarLoader {
    private static final Logger logger = LoggerFactory.getLogger(CsvBarLoader.class);
    private static final CsvMapper csvMapper = new CsvMapper();
    private static final CsvSchema schema = CsvSchema.emptySchema().withHeader();

    private final Path directory;

    public CsvBarLoader(Path directory) {
        this.directory = directory;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PriceRow(
        @JsonProperty("price_date") String priceDate,
        @JsonProperty("ticker") String ticker,
        @JsonProperty("open_price") double open,
        @JsonProperty("high_price") double high,
        @JsonProperty("low_price") double low,
        @JsonProperty("close_price") double close,
        @JsonProperty("volume") double volume,
        @JsonProperty("adj_factor") Double adjFactor
    ) {
        Bar toBar() {
            return Bar.of(parseTimestamp(priceDate), open, high, low, close, (long) volume,
                adjFactor != null ? adjFactor : 1.0);
        }
    }

    /**
     * Load every symbol, keyed in the given order.
     *
     * @throws UncheckedIOException if a file is missing, malformed or holds an invalid bar
     */
    public Map<String, List<Bar>> load(List<String> symbols) {
        Map<String, List<Bar>> series = new LinkedHashMap<>();
        for (var symbol : symbols) {
            series.put(symbol, load(symbol));
        }
        return series;
    }

    public List<Bar> load(String symbol) {
        Path file = directory.resolve(symbol + ".csv");
        try (var reader = Files.newBufferedReader(file);
             MappingIterator<PriceRow> rows = csvMapper.readerFor(PriceRow.class).with(schema).readValues(reader)) {
            var bars = rows.readAll().stream()
                .map(PriceRow::toBar)
                .sorted(Comparator.comparing(Bar::timestamp))
                .toList();
            logger.info("Loaded {} bars for {} from {}", bars.size(), symbol, file);
            return bars;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bars from " + file, e);
        } catch (IllegalArgumentException e) {
            throw new UncheckedIOException("Invalid bar in " + file + ": " + e.getMessage(),
                new IOException(e.getMessage(), e));
        }
    }

    static LocalDateTime parseTimestamp(String value) {
        var text = value.trim();
        if (text.length() == 10) {
            return LocalDate.parse(text).atStartOfDay();
        }
        return LocalDateTime.parse(text.replace(' ', 'T'));
    }
}
