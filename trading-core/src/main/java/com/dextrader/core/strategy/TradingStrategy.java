package com.dextrader.core.strategy;

import com.dextrader.core.indicator.IndicatorState;
import com.dextrader.core.model.Candle;
import com.dextrader.core.model.Signal;

import java.util.List;

/**
 * A pure signal computation over closed candles. Implementations hold only their parameters,
 * so identical candle input always yields an identical {@link Signal}.
 */
public sealed interface TradingStrategy
    permits SimpleMaStrategy, RsiStrategy, BollingerBandsStrategy, MacdStrategy, GridTradingStrategy, BreakoutStrategy {

    /** Stable identifier, used as the strategy half of a pair key. */
    String id();

    StrategyKind kind();

    /** Number of closed candles {@link #evaluate(List)} needs. */
    int minimumHistory();

    /**
     * Evaluates the last candle of an ordered, gap-free series.
     *
     * @throws com.dextrader.core.error.InsufficientHistoryException if fewer than {@link #minimumHistory()} candles
     * @throws com.dextrader.core.error.InvalidCandleSeriesException if the series is out of order or has gaps
     */
    Signal evaluate(List<Candle> candles);

    /**
     * Indicator readings at the last candle, for logging and state inspection.
     */
    IndicatorState indicators(List<Candle> candles);
}
