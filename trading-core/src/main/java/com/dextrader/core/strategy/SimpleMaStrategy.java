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
 * Simple moving average crossover.
 * - LONG when the fast SMA crosses above the slow SMA (golden cross)
 * - SHORT when it crosses below (death cross)
 */
public final class SimpleMaStrategy implements TradingStrategy {
    private static final double CROSS_STRENGTH = 1.0;

    private final StrategyParameters.SimpleMa parameters;

    public SimpleMaStrategy(StrategyParameters.SimpleMa parameters) {
        this.parameters = parameters;
    }

    @Override
    public String id() {
        return kind().configName();
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.SIMPLE_MA;
    }

    @Override
    public int minimumHistory() {
        return parameters.slowPeriod();
    }

    @Override
    public Signal evaluate(List<Candle> candles) {
        StrategySupport.requireHistory(this, candles);
        double[] closes = CandleSeries.closes(candles);
        double[] fast = Indicators.sma(closes, parameters.fastPeriod());
        double[] slow = Indicators.sma(closes, parameters.slowPeriod());
        Instant at = StrategySupport.lastOpenTime(candles);

        double fastNow = Indicators.last(fast);
        double slowNow = Indicators.last(slow);
        double fastPrev = Indicators.previous(fast);
        double slowPrev = Indicators.previous(slow);
        if (!StrategySupport.defined(fastPrev, slowPrev)) {
            return Signal.flat(id(), at, "No previous slow SMA to compare against");
        }

        if (StrategySupport.crossedAbove(fastPrev, slowPrev, fastNow, slowNow)) {
            return Signal.of(Direction.LONG, CROSS_STRENGTH, id(), at,
                String.format("Golden cross: SMA%d %.4f > SMA%d %.4f",
                    parameters.fastPeriod(), fastNow, parameters.slowPeriod(), slowNow));
        }
        if (StrategySupport.crossedBelow(fastPrev, slowPrev, fastNow, slowNow)) {
            return Signal.of(Direction.SHORT, CROSS_STRENGTH, id(), at,
                String.format("Death cross: SMA%d %.4f < SMA%d %.4f",
                    parameters.fastPeriod(), fastNow, parameters.slowPeriod(), slowNow));
        }
        return Signal.flat(id(), at, String.format("No crossover (fast %.4f, slow %.4f)", fastNow, slowNow));
    }

    @Override
    public IndicatorState indicators(List<Candle> candles) {
        double[] closes = CandleSeries.closes(candles);
        return IndicatorState.builder(id(), StrategySupport.lastOpenTime(candles))
            .put("sma_fast", Indicators.last(Indicators.sma(closes, parameters.fastPeriod())))
            .put("sma_slow", Indicators.last(Indicators.sma(closes, parameters.slowPeriod())))
            .build();
    }
}
