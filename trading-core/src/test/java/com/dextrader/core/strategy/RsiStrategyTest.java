package com.dextrader.core.strategy;

import com.dextrader.core.CandleFixtures;
import com.dextrader.core.indicator.Indicators;
import com.dextrader.core.model.Candle;
import com.dextrader.core.model.Direction;
import com.dextrader.core.model.Signal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RSI strategy")
class RsiStrategyTest {
    private static final int CROSSING_LENGTH = 22;

    private final RsiStrategy strategy = new RsiStrategy(new StrategyParameters.Rsi(14, 30, 70));

    /**
     * 14 alternating changes put RSI at 50; a run of equal steps in {@code direction} then moves it
     * gradually, crossing 30 (or 70) on the 7th step, at candle 22.
     */
    private static double[] closes(int direction) {
        double[] closes = new double[25];
        closes[0] = 100;
        for (int i = 1; i <= 14; i++) {
            closes[i] = i % 2 == 1 ? 101 : 100;
        }
        for (int i = 15; i < closes.length; i++) {
            closes[i] = closes[i - 1] + direction;
        }
        return closes;
    }

    @Test
    @DisplayName("LONG only on the candle where RSI first drops below oversold")
    void oversoldCrossing() {
        double[] closes = closes(-1);
        List<Candle> candles = CandleFixtures.fromCloses(closes);
        double[] rsi = Indicators.rsi(closes, 14);
        assertThat(rsi[CROSSING_LENGTH - 2]).isBetween(30.0, 35.0);
        assertThat(rsi[CROSSING_LENGTH - 1]).isLessThan(30.0);

        for (int length = 15; length <= candles.size(); length++) {
            Signal signal = strategy.evaluate(candles.subList(0, length));
            if (length == CROSSING_LENGTH) {
                assertThat(signal.direction()).as("candle %d", length).isEqualTo(Direction.LONG);
                assertThat(signal.strength()).isEqualTo(0.8);
            } else {
                assertThat(signal.direction()).as("candle %d", length).isEqualTo(Direction.FLAT);
            }
        }
    }

    @Test
    @DisplayName("SHORT only on the candle where RSI first rises above overbought")
    void overboughtCrossing() {
        List<Candle> candles = CandleFixtures.fromCloses(closes(1));

        for (int length = 15; length <= candles.size(); length++) {
            Signal signal = strategy.evaluate(candles.subList(0, length));
            Direction expected = length == CROSSING_LENGTH ? Direction.SHORT : Direction.FLAT;
            assertThat(signal.direction()).as("candle %d", length).isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("First evaluable candle has no previous RSI and stays FLAT")
    void noPreviousValue() {
        Signal signal = strategy.evaluate(CandleFixtures.fromCloses(closes(-1)).subList(0, 15));

        assertThat(signal.isFlat()).isTrue();
        assertThat(signal.reason()).contains("no previous value");
    }
}
