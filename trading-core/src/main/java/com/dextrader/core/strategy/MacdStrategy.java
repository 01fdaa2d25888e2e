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
 * Moving Average Convergence Divergence with histogram divergence.
 * - LONG on a bullish crossover below the zero line (stronger with bullish divergence)
 * - LONG on bullish divergence while the histogram is rising
 * - SHORT on a bearish crossover (stronger with bearish divergence)
 *
 * Divergence compares the two most extreme lows (highs) of the trailing window with the
 * histogram at the same candles.
 */
public final class MacdStrategy implements TradingStrategy {
    private static final double CROSSOVER_STRENGTH = 0.7;
    private static final double CROSSOVER_DIVERGENCE_STRENGTH = 0.85;
    private static final double DIVERGENCE_STRENGTH = 0.75;
    private static final double BEARISH_STRENGTH = 0.75;
    private static final double BEARISH_DIVERGENCE_STRENGTH = 0.9;

    private final StrategyParameters.Macd parameters;

    public MacdStrategy(StrategyParameters.Macd parameters) {
        this.parameters = parameters;
    }

    @Override
    public String id() {
        return kind().configName();
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.MACD;
    }

    @Override
    public int minimumHistory() {
        return parameters.slowPeriod() + parameters.signalPeriod() + parameters.divergenceLookback();
    }

    @Override
    public Signal evaluate(List<Candle> candles) {
        StrategySupport.requireHistory(this, candles);
        Indicators.Macd macd = compute(candles);
        Instant at = StrategySupport.lastOpenTime(candles);

        double line = Indicators.last(macd.line());
        double signal = Indicators.last(macd.signal());
        double prevLine = Indicators.previous(macd.line());
        double prevSignal = Indicators.previous(macd.signal());
        double histogram = Indicators.last(macd.histogram());
        boolean histogramRising = histogram > Indicators.previous(macd.histogram());

        Divergence divergence = detectDivergence(candles, macd.histogram());

        if (StrategySupport.crossedAbove(prevLine, prevSignal, line, signal)) {
            if (line < 0) {
                double strength = divergence.bullish() ? CROSSOVER_DIVERGENCE_STRENGTH : CROSSOVER_STRENGTH;
                return Signal.of(Direction.LONG, strength, id(), at,
                    String.format("Bullish crossover below zero: MACD %.4f > signal %.4f%s",
                        line, signal, divergence.bullish() ? " with divergence" : ""));
            }
        } else if (divergence.bullish() && histogramRising) {
            return Signal.of(Direction.LONG, DIVERGENCE_STRENGTH, id(), at,
                String.format("Bullish divergence, histogram rising to %.4f", histogram));
        } else if (StrategySupport.crossedBelow(prevLine, prevSignal, line, signal)) {
            double strength = divergence.bearish() ? BEARISH_DIVERGENCE_STRENGTH : BEARISH_STRENGTH;
            return Signal.of(Direction.SHORT, strength, id(), at,
                String.format("Bearish crossover: MACD %.4f < signal %.4f%s",
                    line, signal, divergence.bearish() ? " with divergence" : ""));
        }
        return Signal.flat(id(), at, String.format("MACD=%.4f, signal=%.4f, histogram=%.4f (%s)",
            line, signal, histogram, histogram > 0 ? "bullish" : "bearish"));
    }

    Divergence detectDivergence(List<Candle> candles, double[] histogram) {
        int to = candles.size();
        int from = Math.max(0, to - parameters.divergenceLookback());
        double[] lows = CandleSeries.lows(candles);
        double[] highs = CandleSeries.highs(candles);

        boolean bullish = false;
        int[] lowest = extremes(lows, from, to, false);
        if (lowest != null) {
            int earlier = Math.min(lowest[0], lowest[1]);
            int later = Math.max(lowest[0], lowest[1]);
            bullish = lows[later] < lows[earlier] && histogram[later] > histogram[earlier];
        }

        boolean bearish = false;
        int[] highest = extremes(highs, from, to, true);
        if (highest != null) {
            int earlier = Math.min(highest[0], highest[1]);
            int later = Math.max(highest[0], highest[1]);
            bearish = highs[later] > highs[earlier] && histogram[later] < histogram[earlier];
        }
        return new Divergence(bullish, bearish);
    }

    /** Indices of the two largest (or smallest) values in {@code [from, to)}; earliest index wins ties. */
    private static int[] extremes(double[] values, int from, int to, boolean largest) {
        if (to - from < 2) {
            return null;
        }
        int first = -1;
        int second = -1;
        for (int i = from; i < to; i++) {
            if (first < 0 || better(values[i], values[first], largest)) {
                second = first;
                first = i;
            } else if (second < 0 || better(values[i], values[second], largest)) {
                second = i;
            }
        }
        return new int[] {first, second};
    }

    private static boolean better(double candidate, double current, boolean largest) {
        return largest ? candidate > current : candidate < current;
    }

    private Indicators.Macd compute(List<Candle> candles) {
        return Indicators.macd(CandleSeries.closes(candles),
            parameters.fastPeriod(), parameters.slowPeriod(), parameters.signalPeriod());
    }

    @Override
    public IndicatorState indicators(List<Candle> candles) {
        Indicators.Macd macd = compute(candles);
        return IndicatorState.builder(id(), StrategySupport.lastOpenTime(candles))
            .put("macd", Indicators.last(macd.line()))
            .put("macd_signal", Indicators.last(macd.signal()))
            .put("macd_histogram", Indicators.last(macd.histogram()))
            .build();
    }

    record Divergence(boolean bullish, boolean bearish) {
    }
}
