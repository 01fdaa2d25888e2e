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
 * Relative Strength Index (Wilder) threshold crossings.
 * - LONG on the candle where RSI first drops below the oversold level
 * - SHORT on the candle where RSI first rises above the overbought level
 */
public final class RsiStrategy implements TradingStrategy {
    private static final double SIGNAL_STRENGTH = 0.8;

    private final StrategyParameters.Rsi parameters;

    public RsiStrategy(StrategyParameters.Rsi parameters) {
        this.parameters = parameters;
    }

    @Override
    public String id() {
        return kind().configName();
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.RSI;
    }

    @Override
    public int minimumHistory() {
        return parameters.period() + 1;
    }

    @Override
    public Signal evaluate(List<Candle> candles) {
        StrategySupport.requireHistory(this, candles);
        double[] rsi = Indicators.rsi(CandleSeries.closes(candles), parameters.period());
        Instant at = StrategySupport.lastOpenTime(candles);
        double current = Indicators.last(rsi);
        double previous = Indicators.previous(rsi);
        if (!StrategySupport.defined(previous)) {
            return Signal.flat(id(), at, String.format("RSI=%.2f, no previous value", current));
        }

        if (previous >= parameters.oversold() && current < parameters.oversold()) {
            return Signal.of(Direction.LONG, SIGNAL_STRENGTH, id(), at,
                String.format("RSI crossed below %.0f: %.2f -> %.2f", parameters.oversold(), previous, current));
        }
        if (previous <= parameters.overbought() && current > parameters.overbought()) {
            return Signal.of(Direction.SHORT, SIGNAL_STRENGTH, id(), at,
                String.format("RSI crossed above %.0f: %.2f -> %.2f", parameters.overbought(), previous, current));
        }
        return Signal.flat(id(), at, String.format("RSI=%.2f", current));
    }

    @Override
    public IndicatorState indicators(List<Candle> candles) {
        double[] rsi = Indicators.rsi(CandleSeries.closes(candles), parameters.period());
        return IndicatorState.builder(id(), StrategySupport.lastOpenTime(candles))
            .put("rsi", Indicators.last(rsi))
            .build();
    }
}
