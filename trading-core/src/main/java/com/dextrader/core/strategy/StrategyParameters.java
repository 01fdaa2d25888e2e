package com.dextrader.core.strategy;

/**
 * Per-variant parameter sets. All periods are candle counts.
 */
public record StrategyParameters(
    SimpleMa simpleMa,
    Rsi rsi,
    Bollinger bollinger,
    Macd macd,
    Grid grid,
    Breakout breakout
) {
    public static StrategyParameters defaults() {
        return new StrategyParameters(
            new SimpleMa(10, 30),
            new Rsi(14, 30.0, 70.0),
            new Bollinger(20, 2.0, 0.02),
            new Macd(12, 26, 9, 20),
            new Grid(10, 0.5, 100, 20),
            new Breakout(20, 1.5, 2, 14));
    }

    public record SimpleMa(int fastPeriod, int slowPeriod) {
        public SimpleMa {
            requirePositive("fast period", fastPeriod);
            if (slowPeriod <= fastPeriod) {
                throw new IllegalArgumentException("Slow period must exceed fast period");
            }
        }
    }

    public record Rsi(int period, double oversold, double overbought) {
        public Rsi {
            requirePositive("RSI period", period);
            if (oversold <= 0 || overbought >= 100 || oversold >= overbought) {
                throw new IllegalArgumentException("Need 0 < oversold < overbought < 100");
            }
        }
    }

    /**
     * @param squeezeThreshold band width, relative to the middle band, below which the bands count as squeezed
     */
    public record Bollinger(int period, double stdDevMultiplier, double squeezeThreshold) {
        public Bollinger {
            requirePositive("Bollinger period", period);
        }
    }

    public record Macd(int fastPeriod, int slowPeriod, int signalPeriod, int divergenceLookback) {
        public Macd {
            requirePositive("MACD fast period", fastPeriod);
            requirePositive("MACD signal period", signalPeriod);
            requirePositive("divergence lookback", divergenceLookback);
            if (slowPeriod <= fastPeriod) {
                throw new IllegalArgumentException("MACD slow period must exceed fast period");
            }
        }
    }

    /**
     * @param recalcBars the level set is re-anchored every this many candles
     */
    public record Grid(int levels, double spacingPercent, int rangePeriod, int recalcBars) {
        public Grid {
            if (levels < 2) {
                throw new IllegalArgumentException("Grid needs at least 2 levels");
            }
            requirePositive("grid range period", rangePeriod);
            requirePositive("grid recalc bars", recalcBars);
            if (spacingPercent <= 0.0) {
                throw new IllegalArgumentException("Grid spacing must be positive");
            }
        }
    }

    public record Breakout(int lookback, double volumeMultiplier, int confirmationBars, int atrPeriod) {
        public Breakout {
            requirePositive("breakout lookback", lookback);
            requirePositive("confirmation bars", confirmationBars);
            requirePositive("ATR period", atrPeriod);
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
