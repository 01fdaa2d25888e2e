package com.dextrader.core.strategy;

import com.dextrader.core.error.InsufficientHistoryException;
import com.dextrader.core.indicator.CandleSeries;
import com.dextrader.core.model.Candle;

import java.time.Instant;
import java.util.List;

final class StrategySupport {

    private StrategySupport() {
    }

    static void requireHistory(TradingStrategy strategy, List<Candle> candles) {
        if (candles.size() < strategy.minimumHistory()) {
            throw new InsufficientHistoryException(strategy.id(), strategy.minimumHistory(), candles.size());
        }
        CandleSeries.requireContiguous(candles, null);
    }

    static Instant lastOpenTime(List<Candle> candles) {
        return CandleSeries.last(candles).openTime();
    }

    static boolean crossedAbove(double prevA, double prevB, double a, double b) {
        return prevA <= prevB && a > b;
    }

    static boolean crossedBelow(double prevA, double prevB, double a, double b) {
        return prevA >= prevB && a < b;
    }

    static boolean defined(double... values) {
        for (double v : values) {
            if (Double.isNaN(v)) {
                return false;
            }
        }
        return true;
    }
}
