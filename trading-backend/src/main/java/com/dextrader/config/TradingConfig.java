package com.dextrader.config;

import com.dextrader.core.exchange.RetrySettings;
import com.dextrader.core.model.Timeframe;
import com.dextrader.core.orchestrator.EngineSettings;
import com.dextrader.core.risk.RiskLimits;
import com.dextrader.core.strategy.PositionRules;
import com.dextrader.core.strategy.StrategyKind;
import com.dextrader.core.strategy.StrategyParameters;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Agent configuration loaded once from {@code config.properties}.
 *
 * Lookup order per key: environment variable, then the properties file, then the default.
 * The instance is immutable and hands out the immutable engine records built from it.
 */
public final class TradingConfig {
    private static final Logger logger = LoggerFactory.getLogger(TradingConfig.class);
    private static final String CONFIG_FILE = "config.properties";

    private final Properties properties;
    private final Map<String, String> environment;

    @NotEmpty(message = "at least one strategy is required")
    private final List<String> strategies;

    @NotEmpty(message = "at least one symbol is required")
    private final List<String> symbols;

    private final Timeframe timeframe;

    @Positive
    private final double positionSizeUsd;
    @PositiveOrZero
    private final double takeProfitPercent;
    @PositiveOrZero
    private final double stopLossPercent;
    @DecimalMin("0.0")
    @DecimalMax(value = "1.0", inclusive = false)
    private final double signalThreshold;
    private final boolean allowShort;

    @Positive
    private final double maxLeverage;
    @Positive
    private final double maxPositionUsd;
    @Positive
    private final double maxDailyLossUsd;
    @Positive
    @DecimalMax("100.0")
    private final double maxDrawdownPercent;
    @PositiveOrZero
    private final double minOrderNotionalUsd;

    @Min(1)
    private final int retryMaxAttempts;
    @Min(1)
    private final long retryInitialBackoffMs;
    @DecimalMin("1.0")
    private final double retryBackoffMultiplier;
    @Min(1)
    private final int rateLimitRequestsPerSecond;

    @Min(1)
    private final long reconcileIntervalSeconds;
    @Min(1)
    private final long orderMaxAgeSeconds;
    @Min(1)
    private final int maxConsecutiveRejections;
    private final boolean flattenOnShutdown;
    @PositiveOrZero
    private final long candleSettleMillis;
    @Min(1)
    private final long shutdownTimeoutSeconds;
    @Min(1)
    private final int workerThreads;

    private final String stateDbPath;
    @Min(0)
    private final int metricsPort;
    @Positive
    private final double paperStartingEquity;
    private final String accountAddress;
    private final boolean useTestnet;

    private final StrategyParameters strategyParameters;

    private TradingConfig(Properties properties, Map<String, String> environment) {
        this.properties = properties;
        this.environment = environment;

        this.strategies = parseList("STRATEGIES", "simple_ma");
        this.symbols = parseList("SYMBOLS", "BTC");
        this.timeframe = Timeframe.fromCode(value("TIMEFRAME", "15m"));

        this.positionSizeUsd = parseDouble("POSITION_SIZE_USD", 100.0);
        this.takeProfitPercent = parseDouble("TAKE_PROFIT_PERCENT", 10.0);
        this.stopLossPercent = parseDouble("STOP_LOSS_PERCENT", 5.0);
        this.signalThreshold = parseDouble("SIGNAL_THRESHOLD", 0.5);
        this.allowShort = parseBoolean("ALLOW_SHORT", false);

        this.maxLeverage = parseDouble("MAX_LEVERAGE", 3.0);
        this.maxPositionUsd = parseDouble("MAX_POSITION_USD", 1000.0);
        this.maxDailyLossUsd = parseDouble("MAX_DAILY_LOSS_USD", 100.0);
        this.maxDrawdownPercent = parseDouble("MAX_DRAWDOWN_PERCENT", 20.0);
        this.minOrderNotionalUsd = parseDouble("MIN_ORDER_NOTIONAL_USD", 10.0);

        this.retryMaxAttempts = (int) parseLong("RETRY_MAX_ATTEMPTS", 3);
        this.retryInitialBackoffMs = parseLong("RETRY_INITIAL_BACKOFF_MS", 500);
        this.retryBackoffMultiplier = parseDouble("RETRY_BACKOFF_MULTIPLIER", 2.0);
        this.rateLimitRequestsPerSecond = (int) parseLong("RATE_LIMIT_REQUESTS_PER_SECOND", 10);

        this.reconcileIntervalSeconds = parseLong("RECONCILE_INTERVAL_SECONDS", 30);
        this.orderMaxAgeSeconds = parseLong("ORDER_MAX_AGE_SECONDS", 300);
        this.maxConsecutiveRejections = (int) parseLong("MAX_CONSECUTIVE_REJECTIONS", 3);
        this.flattenOnShutdown = parseBoolean("FLATTEN_ON_SHUTDOWN", false);
        this.candleSettleMillis = parseLong("CANDLE_SETTLE_MILLIS", 2000);
        this.shutdownTimeoutSeconds = parseLong("SHUTDOWN_TIMEOUT_SECONDS", 30);
        this.workerThreads = (int) parseLong("WORKER_THREADS", 4);

        this.stateDbPath = value("STATE_DB_PATH", "engine-state.db");
        this.metricsPort = (int) parseLong("METRICS_PORT", 9090);
        this.paperStartingEquity = parseDouble("PAPER_STARTING_EQUITY", 10_000.0);
        this.accountAddress = value("HYPERLIQUID_ACCOUNT_ADDRESS", "");
        this.useTestnet = parseBoolean("USE_TESTNET", false);

        this.strategyParameters = new StrategyParameters(
            new StrategyParameters.SimpleMa(
                (int) parseLong("SMA_FAST_PERIOD", 10),
                (int) parseLong("SMA_SLOW_PERIOD", 30)),
            new StrategyParameters.Rsi(
                (int) parseLong("RSI_PERIOD", 14),
                parseDouble("RSI_OVERSOLD", 30.0),
                parseDouble("RSI_OVERBOUGHT", 70.0)),
            new StrategyParameters.Bollinger(
                (int) parseLong("BB_PERIOD", 20),
                parseDouble("BB_STD_DEV", 2.0),
                parseDouble("BB_SQUEEZE_THRESHOLD", 0.02)),
            new StrategyParameters.Macd(
                (int) parseLong("MACD_FAST", 12),
                (int) parseLong("MACD_SLOW", 26),
                (int) parseLong("MACD_SIGNAL", 9),
                (int) parseLong("MACD_DIVERGENCE_LOOKBACK", 20)),
            new StrategyParameters.Grid(
                (int) parseLong("GRID_LEVELS", 10),
                parseDouble("GRID_SPACING_PERCENT", 0.5),
                (int) parseLong("GRID_RANGE_PERIOD", 100),
                (int) parseLong("GRID_RECALC_BARS", 20)),
            new StrategyParameters.Breakout(
                (int) parseLong("BREAKOUT_LOOKBACK", 20),
                parseDouble("BREAKOUT_VOLUME_MULTIPLIER", 1.5),
                (int) parseLong("BREAKOUT_CONFIRMATION_BARS", 2),
                (int) parseLong("BREAKOUT_ATR_PERIOD", 14)));

        validate();

        logger.info("Trading configuration loaded:");
        logger.info("   Strategies: {} on {}", strategies, symbols);
        logger.info("   Timeframe: {}", timeframe.code());
        logger.info("   Position size: ${} (TP {}%, SL {}%, threshold {})", positionSizeUsd,
            takeProfitPercent, stopLossPercent, signalThreshold);
        logger.info("   Limits: {}x leverage, ${} per position, ${} daily loss, {}% drawdown", maxLeverage,
            maxPositionUsd, maxDailyLossUsd, maxDrawdownPercent);
    }

    /**
     * Loads {@code config.properties} from the working directory, falling back to the classpath.
     */
    public static TradingConfig load() {
        Properties props = new Properties();

        Path configPath = Path.of(CONFIG_FILE);
        if (Files.exists(configPath)) {
            try (InputStream is = Files.newInputStream(configPath)) {
                props.load(is);
                logger.info("Loaded config from: {}", configPath.toAbsolutePath());
                return new TradingConfig(props, System.getenv());
            } catch (IOException e) {
                logger.warn("Failed to load config.properties from filesystem: {}", e.getMessage());
            }
        }

        try (InputStream is = TradingConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded config from classpath");
                return new TradingConfig(props, System.getenv());
            }
        } catch (IOException e) {
            logger.warn("Failed to load config.properties from classpath: {}", e.getMessage());
        }

        logger.warn("No config.properties found, using defaults");
        return new TradingConfig(props, System.getenv());
    }

    /**
     * Test instance that ignores the process environment.
     */
    public static TradingConfig forTest(Properties testProps) {
        return new TradingConfig(testProps, Map.of());
    }

    static TradingConfig of(Properties props, Map<String, String> environment) {
        return new TradingConfig(props, environment);
    }

    private void validate() {
        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            Validator validator = factory.getValidator();
            var violations = validator.validate(this);
            if (!violations.isEmpty()) {
                var errorMessages = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .toList();
                throw new IllegalStateException(
                    "Configuration validation failed: " + String.join(", ", errorMessages));
            }
        }
        strategyKinds();
    }

    private String value(String key, String defaultValue) {
        String env = environment.get(key);
        if (env != null && !env.isBlank()) {
            return env.trim();
        }
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    private double parseDouble(String key, double defaultValue) {
        String value = value(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for " + key + ": '" + value + "'", e);
        }
    }

    private long parseLong(String key, long defaultValue) {
        String value = value(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + ": '" + value + "'", e);
        }
    }

    private boolean parseBoolean(String key, boolean defaultValue) {
        String value = value(key, null);
        return value == null ? defaultValue : Boolean.parseBoolean(value);
    }

    private List<String> parseList(String key, String defaultValue) {
        return Arrays.stream(value(key, defaultValue).split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    public List<StrategyKind> strategyKinds() {
        return strategies.stream().map(StrategyKind::fromConfigName).distinct().toList();
    }

    public List<String> symbols() {
        return symbols;
    }

    public Timeframe timeframe() {
        return timeframe;
    }

    public StrategyParameters strategyParameters() {
        return strategyParameters;
    }

    public PositionRules positionRules() {
        return new PositionRules(positionSizeUsd, takeProfitPercent, stopLossPercent, signalThreshold,
            allowShort, 1, maxConsecutiveRejections);
    }

    public RiskLimits riskLimits() {
        return new RiskLimits(maxLeverage, maxPositionUsd, maxDailyLossUsd, maxDrawdownPercent, minOrderNotionalUsd);
    }

    public RetrySettings retrySettings() {
        return new RetrySettings(retryMaxAttempts, Duration.ofMillis(retryInitialBackoffMs), retryBackoffMultiplier);
    }

    public EngineSettings engineSettings() {
        return new EngineSettings(symbols, strategyKinds(), timeframe, strategyParameters, positionRules(),
            riskLimits(), Duration.ofMillis(candleSettleMillis), Duration.ofSeconds(reconcileIntervalSeconds),
            orderMaxAge(), flattenOnShutdown, Duration.ofSeconds(shutdownTimeoutSeconds), workerThreads);
    }

    public Duration orderMaxAge() {
        return Duration.ofSeconds(orderMaxAgeSeconds);
    }

    public int rateLimitRequestsPerSecond() {
        return rateLimitRequestsPerSecond;
    }

    public String stateDbPath() {
        return stateDbPath;
    }

    public int metricsPort() {
        return metricsPort;
    }

    public double paperStartingEquity() {
        return paperStartingEquity;
    }

    public String accountAddress() {
        return accountAddress;
    }

    public boolean useTestnet() {
        return useTestnet;
    }

    /** Base URL of the public info API. */
    public String apiUrl() {
        return useTestnet ? "https://api.hyperliquid-testnet.xyz" : "https://api.hyperliquid.xyz";
    }
}
