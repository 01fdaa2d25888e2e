package com.dextrader.core.strategy;

import com.dextrader.core.indicator.CandleSeries;
import com.dextrader.core.indicator.IndicatorState;
import com.dextrader.core.indicator.Indicators;
import com.dextrader.core.model.Candle;
import com.dextrader.core.model.Direction;
import com.dextrader.core.model.Signal;

import java.time.Instant;
import java.util.List;

/**
 * Bollinger Bands mean reversion with a squeeze breakout.
 * - LONG when close crosses below the lower band while the bands are not squeezed
 * - LONG when close is more than 0.5% under the lower band
 * - SHORT when close crosses above the upper band
 * - LONG on a volatility expansion out of a squeeze with a rising close
 */
public final class BollingerBandsStrategy implements TradingStrategy {
    private static final double LOWER_CROSS_STRENGTH = 0.75;
    private static final double DEEP_BELOW_STRENGTH = 0.85;
    private static final double UPPER_CROSS_STRENGTH = 0.8;
    private static final double EXPANSION_STRENGTH = 0.7;
    private static final double DEEP_BELOW_FACTOR = 0.995;
    private static final double EXPANSION_FACTOR = 1.5;
    private static final int WIDTH_WINDOW = 5;

    private final StrategyParameters.Bollinger parameters;

    public BollingerBandsStrategy(StrategyParameters.Bollinger parameters) {
        this.parameters = parameters;
    }

    @Override
    public String id() {
        return kind().configName();
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.BOLLINGER_BANDS;
    }

    @Override
    public int minimumHistory() {
        return parameters.period() + WIDTH_WINDOW - 1;
    }

    @Override
    public Signal evaluate(List<Candle> candles) {
        StrategySupport.requireHistory(this, candles);
        double[] closes = CandleSeries.closes(candles);
        Indicators.Bands bands = Indicators.bollinger(closes, parameters.period(), parameters.stdDevMultiplier());
        Instant at = StrategySupport.lastOpenTime(candles);
        int last = closes.length - 1;

        double close = closes[last];
        double prevClose = closes[last - 1];
        double upper = bands.upper()[last];
        double lower = bands.lower()[last];
        double prevUpper = bands.upper()[last - 1];
        double prevLower = bands.lower()[last - 1];
        double width = bands.width(last);

        if (prevClose >= prevLower && close < lower) {
            if (width > parameters.squeezeThreshold()) {
                return Signal.of(Direction.LONG, LOWER_CROSS_STRENGTH, id(), at,
                    String.format("Close %.4f crossed below lower band %.4f", close, lower));
            }
        } else if (close < lower * DEEP_BELOW_FACTOR) {
            return Signal.of(Direction.LONG, DEEP_BELOW_STRENGTH, id(), at,
                String.format("Close %.4f well below lower band %.4f", close, lower));
        } else if (prevClose <= prevUpper && close > upper) {
            return Signal.of(Direction.SHORT, UPPER_CROSS_STRENGTH, id(), at,
                String.format("Close %.4f crossed above upper band %.4f", close, upper));
        }

        if (width < parameters.squeezeThreshold()) {
            double recentWidth = 0.0;
            for (int i = last - WIDTH_WINDOW + 1; i <= last; i++) {
                recentWidth += bands.width(i);
            }
            recentWidth /= WIDTH_WINDOW;
            if (width > recentWidth * EXPANSION_FACTOR && close > prevClose) {
                return Signal.of(Direction.LONG, EXPANSION_STRENGTH, id(), at,
                    String.format("Volatility expansion from squeeze, width %.4f vs %.4f", width, recentWidth));
            }
        }
        return Signal.flat(id(), at, String.format("Close %.4f inside bands [%.4f, %.4f]", close, lower, upper));
    }

    @Override
    public IndicatorState indicators(List<Candle> candles) {
        double[] closes = CandleSeries.closes(candles);
        Indicators.Bands bands = Indicators.bollinger(closes, parameters.period(), parameters.stdDevMultiplier());
        int last = closes.length - 1;
        return IndicatorState.builder(id(), StrategySupport.lastOpenTime(candles))
            .put("bb_middle", bands.middle()[last])
            .put("bb_upper", bands.upper()[last])
            .put("bb_lower", bands.lower()[last])
            .put("bb_width", bands.width(last))
            .build();
    }
}
