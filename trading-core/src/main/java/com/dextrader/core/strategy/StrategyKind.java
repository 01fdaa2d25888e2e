package com.dextrader.core.strategy;

import java.util.Arrays;

/**
 * Strategy variants selectable by configuration.
 */
public enum StrategyKind {
    SIMPLE_MA("simple_ma"),
    RSI("rsi"),
    BOLLINGER_BANDS("bollinger_bands"),
    MACD("macd"),
    GRID_TRADING("grid_trading"),
    BREAKOUT("breakout");

    private final String configName;

    StrategyKind(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static StrategyKind fromConfigName(String name) {
        String normalized = name.trim().toLowerCase();
        return Arrays.stream(values())
            .filter(kind -> kind.configName.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown strategy: " + name
                + " (expected one of simple_ma, rsi, bollinger_bands, macd, grid_trading, breakout)"));
    }
}
