package com.dextrader.core.orchestrator;

import com.dextrader.core.model.Timeframe;
import com.dextrader.core.risk.RiskLimits;
import com.dextrader.core.strategy.PositionRules;
import com.dextrader.core.strategy.StrategyKind;
import com.dextrader.core.strategy.StrategyParameters;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Startup validator")
class StartupValidatorTest {

    private static EngineSettings settings(PositionRules rules, RiskLimits limits, List<String> symbols) {
        return new EngineSettings(symbols, List.of(StrategyKind.RSI), Timeframe.M15, StrategyParameters.defaults(),
            rules, limits, Duration.ofSeconds(5), Duration.ofMinutes(1), Duration.ofMinutes(5), false,
            Duration.ofSeconds(30), 2);
    }

    @Test
    @DisplayName("Consistent sizing produces no warnings")
    void clean() {
        assertThat(StartupValidator.validate(
            settings(PositionRules.defaults(), RiskLimits.defaults(), List.of("BTC")), 10_000)).isEmpty();
    }

    @Test
    @DisplayName("Position size below the exchange minimum is flagged")
    void belowMinimum() {
        PositionRules tiny = new PositionRules(5, 2, 1, 0.5, false, 1, 3);

        assertThat(StartupValidator.validate(settings(tiny, RiskLimits.defaults(), List.of("BTC")), 10_000))
            .singleElement(InstanceOfAssertFactories.STRING).contains("below the exchange minimum");
    }

    @Test
    @DisplayName("Weak signals sizing below the minimum is flagged")
    void weakSignals() {
        PositionRules small = new PositionRules(15, 2, 1, 0.5, false, 1, 3);

        assertThat(StartupValidator.validate(settings(small, RiskLimits.defaults(), List.of("BTC")), 10_000))
            .singleElement(InstanceOfAssertFactories.STRING).contains("Weak signals");
    }

    @Test
    @DisplayName("Position size above the cap and insufficient equity are flagged")
    void capAndEquity() {
        PositionRules large = new PositionRules(2000, 2, 1, 0.5, false, 1, 3);

        List<String> warnings = StartupValidator.validate(
            settings(large, RiskLimits.defaults(), List.of("BTC", "ETH")), 500);

        assertThat(warnings).hasSize(2);
        assertThat(warnings.get(0)).contains("exceeds the position cap");
        assertThat(warnings.get(1)).contains("supports $");
    }

    @Test
    @DisplayName("Non-positive equity is flagged")
    void noEquity() {
        assertThat(StartupValidator.validate(
            settings(PositionRules.defaults(), RiskLimits.defaults(), List.of("BTC")), 0))
            .singleElement(InstanceOfAssertFactories.STRING).contains("no entries can be approved");
    }
}
