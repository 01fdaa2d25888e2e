package com.dextrader.core.risk;

/**
 * Account-level limits, read-only at runtime.
 *
 * @param maxDrawdownPercent drawdown from peak equity, in percent, at which new entries stop
 * @param minOrderNotionalUsd smallest order notional the exchange accepts
 */
public record RiskLimits(
    double maxLeverage,
    double maxPositionUsd,
    double maxDailyLossUsd,
    double maxDrawdownPercent,
    double minOrderNotionalUsd
) {
    public RiskLimits {
        if (maxLeverage <= 0.0 || maxPositionUsd <= 0.0 || maxDailyLossUsd <= 0.0) {
            throw new IllegalArgumentException("Leverage, position and daily loss limits must be positive");
        }
        if (maxDrawdownPercent <= 0.0 || maxDrawdownPercent > 100.0) {
            throw new IllegalArgumentException("Max drawdown must be in (0, 100]: " + maxDrawdownPercent);
        }
        if (minOrderNotionalUsd < 0.0) {
            throw new IllegalArgumentException("Minimum order notional cannot be negative");
        }
    }

    public static RiskLimits defaults() {
        return new RiskLimits(3.0, 1000.0, 100.0, 20.0, 10.0);
    }
}
