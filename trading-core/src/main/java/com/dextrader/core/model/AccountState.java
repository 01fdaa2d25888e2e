package com.dextrader.core.model;

/**
 * Account figures the risk manager evaluates against.
 *
 * @param openNotional absolute notional of all open positions at mark
 * @param peakEquity highest equity observed since the engine started
 * @param realizedPnlToday realized PnL since the start of the current UTC day
 */
public record AccountState(
    double equity,
    double marginUsed,
    double available,
    double openNotional,
    double peakEquity,
    double realizedPnlToday
) {
    public double leverage() {
        return equity > 0.0 ? openNotional / equity : 0.0;
    }

    public double drawdown() {
        return peakEquity > 0.0 ? Math.max(0.0, (peakEquity - equity) / peakEquity) : 0.0;
    }
}
