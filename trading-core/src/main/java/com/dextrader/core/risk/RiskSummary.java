package com.dextrader.core.risk;

/**
 * Snapshot of account risk figures against the configured limits.
 *
 * @param marginRatio margin used divided by equity
 * @param drawdownPercent decline from peak equity, in percent
 */
public record RiskSummary(
    double equity,
    double openNotional,
    double leverage,
    double marginRatio,
    double drawdownPercent,
    double realizedPnlToday,
    boolean leverageBreached,
    boolean dailyLossBreached,
    boolean drawdownBreached
) {
    /** Whether any limit currently blocks new entries. */
    public boolean entriesBlocked() {
        return leverageBreached || dailyLossBreached || drawdownBreached;
    }
}
