package com.dextrader.core.strategy;

import com.dextrader.core.indicator.CandleSeries;
import com.dextrader.core.indicator.IndicatorState;
import com.dextrader.core.indicator.Indicators;
import com.dextrader.core.model.Candle;
import com.dextrader.core.model.Direction;
import com.dextrader.core.model.Side;
import com.dextrader.core.model.Signal;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Grid trading inside a ranging market.
 *
 * Levels are spaced {@code spacingPercent} apart around the close of an anchor candle, half below
 * (buy levels) and half above (sell levels), and kept inside the anchor window's range. The anchor is
 * the latest candle whose open time is a multiple of {@code recalcBars} candle intervals, so the level
 * set only changes every {@code recalcBars} candles and is the same for any replay of the same candles.
 * The signal reports the grid level that was touched; tracking which levels were already traded is
 * left to the caller.
 */
public final class GridTradingStrategy implements TradingStrategy {
    private static final double GRID_STRENGTH = 0.6;
    private static final double MAX_RANGE_PERCENT = 10.0;
    private static final double MAX_VOLATILITY = 0.15;
    private static final double BUY_TOLERANCE = 1.001;
    private static final double SELL_TOLERANCE = 0.999;
    private static final double LOWER_BOUND_FACTOR = 0.98;
    private static final double UPPER_BOUND_FACTOR = 1.02;

    private final StrategyParameters.Grid parameters;

    public GridTradingStrategy(StrategyParameters.Grid parameters) {
        this.parameters = parameters;
    }

    @Override
    public String id() {
        return kind().configName();
    }

    @Override
    public StrategyKind kind() {
        return StrategyKind.GRID_TRADING;
    }

    @Override
    public int minimumHistory() {
        return parameters.rangePeriod() + parameters.recalcBars();
    }

    @Override
    public Signal evaluate(List<Candle> candles) {
        StrategySupport.requireHistory(this, candles);
        Instant at = StrategySupport.lastOpenTime(candles);
        double[] closes = CandleSeries.closes(candles);
        int n = candles.size();

        Range current = range(candles, n - parameters.rangePeriod(), n);
        if (!current.isRanging()) {
            return Signal.flat(id(), at, String.format("Not ranging: range %.2f%%, volatility %.4f",
                current.rangePercent(), current.volatility()));
        }

        int anchor = anchorIndex(candles);
        Instant anchorTime = candles.get(anchor).openTime();
        List<GridLevel> levels = levels(candles, anchor);
        double price = closes[n - 1];

        GridLevel buy = levels.stream()
            .filter(level -> level.side() == Side.BUY && price <= level.price() * BUY_TOLERANCE)
            .min(Comparator.comparingDouble(GridLevel::price))
            .orElse(null);
        if (buy != null) {
            return Signal.of(Direction.LONG, GRID_STRENGTH, id(), at,
                    String.format("Price %.4f at buy level %.4f", price, buy.price()))
                .withLevel(buy.price(), anchorTime);
        }

        GridLevel sell = levels.stream()
            .filter(level -> level.side() == Side.SELL && price >= level.price() * SELL_TOLERANCE)
            .max(Comparator.comparingDouble(GridLevel::price))
            .orElse(null);
        if (sell != null) {
            return Signal.of(Direction.SHORT, GRID_STRENGTH, id(), at,
                    String.format("Price %.4f at sell level %.4f", price, sell.price()))
                .withLevel(sell.price(), anchorTime);
        }
        return Signal.flat(id(), at, String.format("Price %.4f between grid levels", price));
    }

    /**
     * Grid levels anchored at {@code anchor}, sorted by price.
     */
    List<GridLevel> levels(List<Candle> candles, int anchor) {
        Range window = range(candles, anchor - parameters.rangePeriod() + 1, anchor + 1);
        double anchorClose = candles.get(anchor).close();
        double step = anchorClose * parameters.spacingPercent() / 100.0;

        List<GridLevel> levels = new ArrayList<>();
        for (int i = 1; i <= parameters.levels() / 2; i++) {
            double buyPrice = anchorClose - step * i;
            double sellPrice = anchorClose + step * i;
            if (buyPrice > window.low() * LOWER_BOUND_FACTOR) {
                levels.add(new GridLevel(Side.BUY, buyPrice));
            }
            if (sellPrice < window.high() * UPPER_BOUND_FACTOR) {
                levels.add(new GridLevel(Side.SELL, sellPrice));
            }
        }
        levels.sort(Comparator.comparingDouble(GridLevel::price));
        return levels;
    }

    /**
     * Index of the latest candle whose open time is a whole multiple of {@code recalcBars} intervals.
     */
    int anchorIndex(List<Candle> candles) {
        long intervalMillis = Duration.between(candles.get(0).openTime(), candles.get(1).openTime()).toMillis();
        for (int i = candles.size() - 1; i >= 0; i--) {
            long bar = Math.floorDiv(candles.get(i).openTime().toEpochMilli(), intervalMillis);
            if (Math.floorMod(bar, parameters.recalcBars()) == 0) {
                return i;
            }
        }
        return candles.size() - 1;
    }

    private static Range range(List<Candle> candles, int from, int to) {
        int start = Math.max(0, from);
        double[] highs = CandleSeries.highs(candles);
        double[] lows = CandleSeries.lows(candles);
        double[] closes = CandleSeries.closes(candles);
        double high = Indicators.highest(highs, start, to);
        double low = Indicators.lowest(lows, start, to);
        double close = closes[to - 1];

        int count = to - start - 1;
        double volatility = 0.0;
        if (count > 1) {
            double[] returns = new double[count];
            for (int i = 0; i < count; i++) {
                returns[i] = closes[start + i + 1] / closes[start + i] - 1.0;
            }
            double mean = Indicators.mean(returns, 0, count);
            double sumSq = 0.0;
            for (double r : returns) {
                sumSq += (r - mean) * (r - mean);
            }
            volatility = Math.sqrt(sumSq / (count - 1)) * Math.sqrt(to - start);
        }
        return new Range(high, low, (high - low) / close * 100.0, volatility);
    }

    @Override
    public IndicatorState indicators(List<Candle> candles) {
        int n = candles.size();
        Range current = range(candles, n - parameters.rangePeriod(), n);
        IndicatorState.Builder builder = IndicatorState.builder(id(), StrategySupport.lastOpenTime(candles))
            .put("range_high", current.high())
            .put("range_low", current.low())
            .put("range_pct", current.rangePercent())
            .put("volatility", current.volatility());
        if (n >= minimumHistory()) {
            int anchor = anchorIndex(candles);
            builder.put("anchor_close", candles.get(anchor).close())
                .put("levels", levels(candles, anchor).size());
        }
        return builder.build();
    }

    record GridLevel(Side side, double price) {
    }

    private record Range(double high, double low, double rangePercent, double volatility) {
        boolean isRanging() {
            return rangePercent < MAX_RANGE_PERCENT && volatility < MAX_VOLATILITY;
        }
    }
}
