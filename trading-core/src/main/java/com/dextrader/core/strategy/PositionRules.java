package com.dextrader.core.strategy;

/**
 * Common entry and exit parameters applied by {@link StrategyStateMachine}.
 *
 * @param positionSizeUsd quote notional of a full-strength entry; scaled by signal strength
 * @param signalThreshold a signal must be strictly stronger than this to act on it
 * @param confirmationBars consecutive same-direction signals required before entering
 * @param maxConsecutiveRejections order rejections in a row after which the pair falls back to FLAT
 */
public record PositionRules(
    double positionSizeUsd,
    double takeProfitPercent,
    double stopLossPercent,
    double signalThreshold,
    boolean allowShort,
    int confirmationBars,
    int maxConsecutiveRejections
) {
    public PositionRules {
        if (positionSizeUsd <= 0.0) {
            throw new IllegalArgumentException("Position size must be positive");
        }
        if (signalThreshold < 0.0 || signalThreshold >= 1.0) {
            throw new IllegalArgumentException("Signal threshold must be in [0,1)");
        }
        if (confirmationBars < 1 || maxConsecutiveRejections < 1) {
            throw new IllegalArgumentException("Confirmation bars and rejection limit must be at least 1");
        }
    }

    public static PositionRules defaults() {
        return new PositionRules(100.0, 10.0, 5.0, 0.5, false, 1, 3);
    }

    public PositionRules withConfirmationBars(int bars) {
        return new PositionRules(positionSizeUsd, takeProfitPercent, stopLossPercent, signalThreshold,
            allowShort, bars, maxConsecutiveRejections);
    }
}
