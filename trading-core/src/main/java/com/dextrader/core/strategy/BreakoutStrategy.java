package com.dextrader.core.strategy;

import com.dextrader.core.indicator.CandleSeries;
import com.dextrader.core.indicator.IndicatorState;
import com.dextrader.core.indicator.Indicators;
import com.dextrader.core.model.Candle;
import com.dextrader.core.model.Direction;
import com.dextrader.core.model.Signal;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Support/resistance breakout confirmed by volume.
 *
 * Resistance and support are the highest high and lowest low of the {@code lookback} candles before
 * the current one. A close beyond them with volume at least {@code volumeMultiplier} times the recent
 * average is a breakout; closing beyond the most frequently touched pivot level as well makes it strong.
 * The ATR-based stop distance travels with the signal. Multi-bar confirmation is counted by the caller.
 */
public final class BreakoutStrategy implements TradingStrategy {
    private static final double BULLISH_STRENGTH = 0.7;
    private static final double STRONG_BULLISH_STRENGTH = 0.85;
    private static final double BEARISH_STRENGTH = 0.75;
    private static final double STRONG_BEARISH_STRENGTH = 0.9;
    private static final double STOP_ATR_MULTIPLE = 2.0;
    private static final int VOLUME_WINDOW = 20;
    private static final int PIVOT_SPAN = 5;

    private final StrategyParameters.Breakout parameters;

    public BreakoutStrategy(StrategyParameters.Breakout parameters) {
        this.parameters = parameters;
    }

    @Override
    public String id() {
        return kind().configName();
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.BREAKOUT;
    }

    @Override
    public int minimumHistory() {
        return Math.max(parameters.lookback() + parameters.atrPeriod(), VOLUME_WINDOW) + 1;
    }

    @Override
    public Signal evaluate(List<Candle> candles) {
        StrategySupport.requireHistory(this, candles);
        Instant at = StrategySupport.lastOpenTime(candles);
        Levels levels = levels(candles);
        int last = candles.size() - 1;
        Candle current = candles.get(last);

        double[] volumes = CandleSeries.volumes(candles);
        double averageVolume = Indicators.mean(volumes, last + 1 - VOLUME_WINDOW, last + 1);
        if (current.volume() < averageVolume * parameters.volumeMultiplier()) {
            return Signal.flat(id(), at, String.format("Volume %.2f below %.2fx average %.2f",
                current.volume(), parameters.volumeMultiplier(), averageVolume));
        }

        double atr = Indicators.last(Indicators.atr(candles, parameters.atrPeriod()));
        double stopDistance = atr * STOP_ATR_MULTIPLE;
        double close = current.close();

        if (close > levels.resistance()) {
            boolean strong = !Double.isNaN(levels.strongResistance()) && close > levels.strongResistance();
            return Signal.of(Direction.LONG, strong ? STRONG_BULLISH_STRENGTH : BULLISH_STRENGTH, id(), at,
                    String.format("%s breakout above resistance %.4f", strong ? "Strong bullish" : "Bullish",
                        levels.resistance()))
                .withStopDistance(stopDistance);
        }
        if (close < levels.support()) {
            boolean strong = !Double.isNaN(levels.strongSupport()) && close < levels.strongSupport();
            return Signal.of(Direction.SHORT, strong ? STRONG_BEARISH_STRENGTH : BEARISH_STRENGTH, id(), at,
                    String.format("%s breakdown below support %.4f", strong ? "Strong bearish" : "Bearish",
                        levels.support()))
                .withStopDistance(stopDistance);
        }
        return Signal.flat(id(), at, String.format("Close %.4f inside [%.4f, %.4f]",
            close, levels.support(), levels.resistance()));
    }

    /**
     * Support and resistance from the candles preceding the last one.
     */
    Levels levels(List<Candle> candles) {
        int last = candles.size() - 1;
        double[] highs = CandleSeries.highs(candles);
        double[] lows = CandleSeries.lows(candles);
        double resistance = Indicators.highest(highs, last - parameters.lookback(), last);
        double support = Indicators.lowest(lows, last - parameters.lookback(), last);
        return new Levels(resistance, support, strongestPivot(highs, last, true), strongestPivot(lows, last, false));
    }

    /**
     * Most frequent pivot level (rounded to cents) among candles before {@code end}; NaN when there is none.
     */
    private static double strongestPivot(double[] values, int end, boolean high) {
        Map<Double, Integer> counts = new HashMap<>();
        for (int i = PIVOT_SPAN; i < end - PIVOT_SPAN; i++) {
            double extreme = high
                ? Indicators.highest(values, i - PIVOT_SPAN, i + PIVOT_SPAN)
                : Indicators.lowest(values, i - PIVOT_SPAN, i + PIVOT_SPAN);
            if (values[i] == extreme) {
                counts.merge(Math.round(values[i] * 100.0) / 100.0, 1, Integer::sum);
            }
        }
        double best = Double.NaN;
        int bestCount = 0;
        for (Map.Entry<Double, Integer> entry : counts.entrySet()) {
            int count = entry.getValue();
            double level = entry.getKey();
            // ties go to the lower level
            if (count > bestCount || (count == bestCount && level < best)) {
                best = level;
                bestCount = count;
            }
        }
        return best;
    }

    @Override
    public IndicatorState indicators(List<Candle> candles) {
        Levels levels = levels(candles);
        return IndicatorState.builder(id(), StrategySupport.lastOpenTime(candles))
            .put("resistance", levels.resistance())
            .put("support", levels.support())
            .put("strong_resistance", levels.strongResistance())
            .put("strong_support", levels.strongSupport())
            .put("atr", Indicators.last(Indicators.atr(candles, parameters.atrPeriod())))
            .build();
    }

    record Levels(double resistance, double support, double strongResistance, double strongSupport) {
    }
}
