package com.backtest.config;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

/**
 * Run configuration loaded from {@code backtest.properties}.
 *
 * <p>Every key has a default except {@code SYMBOLS} and {@code DATA_DIR}.
 * Malformed numbers and dates fall back to the default with a warning; values
 * that parse but make no sense (negative capital, long window not above the
 * short one) fail bean validation when the instance is built.
 */
public final class BacktestConfig {
    private static final Logger logger = LoggerFactory.getLogger(BacktestConfig.class);
    public static final String CONFIG_FILE = "backtest.properties";

    @NotEmpty(message = "SYMBOLS must list at least one instrument")
    private final List<String> symbols;

    @NotBlank(message = "DATA_DIR is required")
    private final String dataDir;

    @NotBlank(message = "OUTPUT_DIR must not be blank")
    private final String outputDir;

    private final LocalDate startDate;
    private final LocalDate endDate;

    @Positive(message = "INITIAL_CAPITAL must be positive")
    private final double initialCapital;

    @Positive(message = "FREQUENCY must be positive")
    private final int frequency;

    @Min(value = 1, message = "SMOOTHING_WINDOW must be at least 1")
    @Max(value = 50, message = "SMOOTHING_WINDOW must be at most 50")
    private final int smoothingWindow;

    @Positive(message = "SIGNAL_QUANTITY must be positive")
    private final double signalQuantity;

    @Positive(message = "SHORT_WINDOW must be positive")
    private final int shortWindow;

    @Positive(message = "LONG_WINDOW must be positive")
    private final int longWindow;

    @NotBlank(message = "EXCHANGE must not be blank")
    private final String exchange;

    private BacktestConfig(Properties properties) {
        this.symbols = parseList(properties, "SYMBOLS");
        this.dataDir = properties.getProperty("DATA_DIR", "").trim();
        this.outputDir = properties.getProperty("OUTPUT_DIR", ".").trim();
        this.startDate = parseDate(properties, "START_DATE");
        this.endDate = parseDate(properties, "END_DATE");
        this.initialCapital = parseDouble(properties, "INITIAL_CAPITAL", 100_000.0);
        this.frequency = parseInt(properties, "FREQUENCY", 252);
        this.smoothingWindow = parseInt(properties, "SMOOTHING_WINDOW", 5);
        this.signalQuantity = parseDouble(properties, "SIGNAL_QUANTITY", 500.0);
        this.shortWindow = parseInt(properties, "SHORT_WINDOW", 30);
        this.longWindow = parseInt(properties, "LONG_WINDOW", 120);
        this.exchange = properties.getProperty("EXCHANGE", "ARCA").trim();

        validate();
    }

    // ========== Loading ==========

    /**
     * Load from {@code backtest.properties} in the working directory, falling
     * back to the classpath.
     */
    public static BacktestConfig load() {
        Path configPath = Path.of(CONFIG_FILE);
        if (Files.exists(configPath)) {
            return load(configPath);
        }

        var props = new Properties();
        try (InputStream is = BacktestConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded config from classpath");
            } else {
                logger.warn("No {} found, using defaults", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.warn("Failed to load {} from classpath: {}", CONFIG_FILE, e.getMessage());
        }
        return new BacktestConfig(props);
    }

    /**
     * Load from an explicit file.
     *
     * @throws IllegalStateException if the file cannot be read or the values are invalid
     */
    public static BacktestConfig load(Path configPath) {
        var props = new Properties();
        try (InputStream is = Files.newInputStream(configPath)) {
            props.load(is);
            logger.info("Loaded config from: {}", configPath.toAbsolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read configuration file " + configPath, e);
        }
        return new BacktestConfig(props);
    }

    /**
     * Create a test instance with custom properties.
     */
    public static BacktestConfig forTest(Properties testProps) {
        return new BacktestConfig(testProps);
    }

    /**
     * Validate configuration using Bean Validation.
     * Throws IllegalStateException if validation fails.
     */
    private void validate() {
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        var violations = validator.validate(this);

        if (!violations.isEmpty()) {
            var errorMessages = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .toList();

            throw new IllegalStateException(
                "Configuration validation failed: " + String.join(", ", errorMessages)
            );
        }
    }

    @AssertTrue(message = "LONG_WINDOW must be greater than SHORT_WINDOW")
    public boolean isWindowOrderValid() {
        return longWindow > shortWindow;
    }

    @AssertTrue(message = "START_DATE must not be after END_DATE")
    public boolean isDateRangeValid() {
        return startDate == null || endDate == null || !startDate.isAfter(endDate);
    }

    // ========== Parsing ==========

    private static List<String> parseList(Properties properties, String key) {
        String value = properties.getProperty(key, "");
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static double parseDouble(Properties properties, String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static int parseInt(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static LocalDate parseDate(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            logger.warn("Invalid {} value '{}', ignoring it", key, value);
            return null;
        }
    }

    // ========== Getters ==========

    public List<String> symbols() {
        return symbols;
    }

    public Path dataDir() {
        return Path.of(dataDir);
    }

    public Path outputDir() {
        return Path.of(outputDir);
    }

    public Optional<LocalDate> startDate() {
        return Optional.ofNullable(startDate);
    }

    public Optional<LocalDate> endDate() {
        return Optional.ofNullable(endDate);
    }

    public double initialCapital() {
        return initialCapital;
    }

    /** Bars per year, used to annualize the Sharpe ratio. */
    public int frequency() {
        return frequency;
    }

    public int smoothingWindow() {
        return smoothingWindow;
    }

    public double signalQuantity() {
        return signalQuantity;
    }

    public int shortWindow() {
        return shortWindow;
    }

    public int longWindow() {
        return longWindow;
    }

    public String exchange() {
        return exchange;
    }

    @Override
    public String toString() {
        return String.format("BacktestConfig[symbols=%s, dataDir=%s, capital=%.2f, window=%d, sma=%d/%d, range=%s..%s]",
            symbols, dataDir, initialCapital, smoothingWindow, shortWindow, longWindow,
            startDate != null ? startDate : "*", endDate != null ? endDate : "*");
    }
}
