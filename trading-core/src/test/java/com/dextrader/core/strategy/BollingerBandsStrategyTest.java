package com.dextrader.core.strategy;

import com.dextrader.core.CandleFixtures;
import com.dextrader.core.model.Direction;
import com.dextrader.core.model.Signal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Bollinger Bands strategy")
class BollingerBandsStrategyTest {

    private final BollingerBandsStrategy strategy =
        new BollingerBandsStrategy(new StrategyParameters.Bollinger(20, 2.0, 0.02));

    /** 24 closes alternating 98/102, followed by {@code last}. */
    private static double[] oscillatingThen(double last) {
        double[] closes = new double[25];
        for (int i = 0; i < 24; i++) {
            closes[i] = i % 2 == 0 ? 98 : 102;
        }
        closes[24] = last;
        return closes;
    }

    @Test
    @DisplayName("LONG 0.75 when the close crosses below the lower band outside a squeeze")
    void lowerBandCross() {
        Signal signal = strategy.evaluate(CandleFixtures.fromCloses(oscillatingThen(90)));

        assertThat(signal.direction()).isEqualTo(Direction.LONG);
        assertThat(signal.strength()).isEqualTo(0.75);
    }

    @Test
    @DisplayName("SHORT 0.8 when the close crosses above the upper band")
    void upperBandCross() {
        Signal signal = strategy.evaluate(CandleFixtures.fromCloses(oscillatingThen(110)));

        assertThat(signal.direction()).isEqualTo(Direction.SHORT);
        assertThat(signal.strength()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("FLAT while the close stays inside the bands")
    void insideBands() {
        Signal signal = strategy.evaluate(CandleFixtures.fromCloses(oscillatingThen(98)));

        assertThat(signal.isFlat()).isTrue();
    }

    @Test
    @DisplayName("Minimum history covers the band period and the width window")
    void minimumHistory() {
        assertThat(strategy.minimumHistory()).isEqualTo(24);
    }
}
