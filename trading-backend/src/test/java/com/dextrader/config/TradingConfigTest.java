package com.dextrader.config;

import com.dextrader.core.model.Timeframe;
import com.dextrader.core.strategy.StrategyKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TradingConfig")
class TradingConfigTest {

    @Test
    @DisplayName("Defaults apply when nothing is configured")
    void defaults() {
        TradingConfig config = TradingConfig.forTest(new Properties());

        assertThat(config.strategyKinds()).containsExactly(StrategyKind.SIMPLE_MA);
        assertThat(config.symbols()).containsExactly("BTC");
        assertThat(config.timeframe()).isEqualTo(Timeframe.M15);
        assertThat(config.positionRules().positionSizeUsd()).isEqualTo(100.0);
        assertThat(config.positionRules().takeProfitPercent()).isEqualTo(10.0);
        assertThat(config.positionRules().stopLossPercent()).isEqualTo(5.0);
        assertThat(config.positionRules().allowShort()).isFalse();
        assertThat(config.riskLimits().maxLeverage()).isEqualTo(3.0);
        assertThat(config.retrySettings().maxAttempts()).isEqualTo(3);
        assertThat(config.orderMaxAge()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.apiUrl()).isEqualTo("https://api.hyperliquid.xyz");
    }

    @Test
    @DisplayName("Properties override defaults and flow into the engine settings")
    void propertiesOverride() {
        Properties props = new Properties();
        props.setProperty("STRATEGIES", " rsi , macd,rsi ");
        props.setProperty("SYMBOLS", "ETH, SOL");
        props.setProperty("TIMEFRAME", "1h");
        props.setProperty("ALLOW_SHORT", "true");
        props.setProperty("MAX_DAILY_LOSS_USD", "55.5");
        props.setProperty("WORKER_THREADS", "2");
        props.setProperty("USE_TESTNET", "true");

        TradingConfig config = TradingConfig.forTest(props);

        assertThat(config.strategyKinds()).containsExactly(StrategyKind.RSI, StrategyKind.MACD);
        assertThat(config.symbols()).containsExactly("ETH", "SOL");
        assertThat(config.positionRules().allowShort()).isTrue();
        assertThat(config.riskLimits().maxDailyLossUsd()).isEqualTo(55.5);
        assertThat(config.engineSettings().workerThreads()).isEqualTo(2);
        assertThat(config.engineSettings().timeframe()).isEqualTo(Timeframe.H1);
        assertThat(config.apiUrl()).contains("testnet");
    }

    @Test
    @DisplayName("Environment variables win over the properties file")
    void environmentWins() {
        Properties props = new Properties();
        props.setProperty("SYMBOLS", "ETH");

        TradingConfig config = TradingConfig.of(props, Map.of("SYMBOLS", "AVAX,DOGE", "POSITION_SIZE_USD", " "));

        assertThat(config.symbols()).containsExactly("AVAX", "DOGE");
        assertThat(config.positionRules().positionSizeUsd()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Malformed numbers fail fast with the offending key")
    void malformedNumber() {
        Properties props = new Properties();
        props.setProperty("MAX_LEVERAGE", "three");

        assertThatThrownBy(() -> TradingConfig.forTest(props))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("MAX_LEVERAGE");
    }

    @Test
    @DisplayName("Constraint violations are reported together")
    void constraintViolations() {
        Properties props = new Properties();
        props.setProperty("POSITION_SIZE_USD", "-5");
        props.setProperty("SIGNAL_THRESHOLD", "1.5");

        assertThatThrownBy(() -> TradingConfig.forTest(props))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("positionSizeUsd")
            .hasMessageContaining("signalThreshold");
    }

    @Test
    @DisplayName("Unknown strategy names are rejected")
    void unknownStrategy() {
        Properties props = new Properties();
        props.setProperty("STRATEGIES", "simple_ma,martingale");

        assertThatThrownBy(() -> TradingConfig.forTest(props))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("martingale");
    }

    @Test
    @DisplayName("load() reads config.properties from the classpath")
    void loadFromClasspath() {
        TradingConfig config = TradingConfig.load();

        assertThat(config.strategyKinds()).containsExactly(StrategyKind.SIMPLE_MA, StrategyKind.BREAKOUT);
        assertThat(config.symbols()).containsExactly("BTC", "ETH", "SOL");
        assertThat(config.timeframe()).isEqualTo(Timeframe.H1);
        assertThat(config.positionRules().positionSizeUsd()).isEqualTo(250.0);
        assertThat(config.riskLimits().maxLeverage()).isEqualTo(2.0);
        assertThat(config.metricsPort()).isZero();
    }
}
