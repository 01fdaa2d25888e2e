package com.dextrader.core.strategy;

import com.dextrader.core.CandleFixtures;
import com.dextrader.core.model.Candle;
import com.dextrader.core.model.Direction;
import com.dextrader.core.model.Signal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Breakout strategy")
class BreakoutStrategyTest {

    private final BreakoutStrategy strategy = new BreakoutStrategy(new StrategyParameters.Breakout(20, 1.5, 2, 14));

    /** 40 candles in a 99..101 range, then {@code last}. */
    private static List<Candle> rangeThen(double open, double high, double low, double close, double volume) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            candles.add(CandleFixtures.candle(i, 100, 101, 99, 100, 1000));
        }
        candles.add(CandleFixtures.candle(40, open, high, low, close, volume));
        return candles;
    }

    @Test
    @DisplayName("Close above resistance and the strong pivot on high volume is a strong LONG")
    void strongBullishBreakout() {
        Signal signal = strategy.evaluate(rangeThen(100, 106, 100, 105, 3000));

        assertThat(signal.direction()).isEqualTo(Direction.LONG);
        assertThat(signal.strength()).isEqualTo(0.85);
        assertThat(signal.stopDistance()).isCloseTo(2.0 * 32.0 / 14.0, within(1e-9));
    }

    @Test
    @DisplayName("Close below support on high volume is a strong SHORT")
    void strongBearishBreakdown() {
        Signal signal = strategy.evaluate(rangeThen(100, 100, 93, 94, 3000));

        assertThat(signal.direction()).isEqualTo(Direction.SHORT);
        assertThat(signal.strength()).isEqualTo(0.9);
        assertThat(signal.hasStopDistance()).isTrue();
    }

    @Test
    @DisplayName("Breakout without volume confirmation is FLAT")
    void lowVolumeIsFlat() {
        Signal signal = strategy.evaluate(rangeThen(100, 106, 100, 105, 1000));

        assertThat(signal.isFlat()).isTrue();
        assertThat(signal.reason()).contains("Volume");
    }

    @Test
    @DisplayName("Levels come from the candles before the last one")
    void levelsExcludeCurrentCandle() {
        BreakoutStrategy.Levels levels = strategy.levels(rangeThen(100, 106, 100, 105, 3000));

        assertThat(levels.resistance()).isEqualTo(101.0);
        assertThat(levels.support()).isEqualTo(99.0);
        assertThat(levels.strongResistance()).isEqualTo(101.0);
        assertThat(strategy.minimumHistory()).isEqualTo(35);
    }
}
