package com.dextrader.core.strategy;

/**
 * Builds strategy instances from their configured kind.
 */
public final class StrategyFactory {

    private StrategyFactory() {
    }

    public static TradingStrategy create(StrategyKind kind, StrategyParameters parameters) {
        return switch (kind) {
            case SIMPLE_MA -> new SimpleMaStrategy(parameters.simpleMa());
            case RSI -> new RsiStrategy(parameters.rsi());
            case BOLLINGER_BANDS -> new BollingerBandsStrategy(parameters.bollinger());
            case MACD -> new MacdStrategy(parameters.macd());
            case GRID_TRADING -> new GridTradingStrategy(parameters.grid());
            case BREAKOUT -> new BreakoutStrategy(parameters.breakout());
        };
    }
}
