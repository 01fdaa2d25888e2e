package com.dextrader.core.risk;

/**
 * Highest equity observed since start-up, the reference point for drawdown.
 */
public final class EquityWatermark {
    private double peak;

    public EquityWatermark(double initialEquity) {
        this.peak = Math.max(0.0, initialEquity);
    }

    /**
     * Records an equity observation and returns the peak including it.
     */
    public synchronized double observe(double equity) {
        if (equity > peak) {
            peak = equity;
        }
        return peak;
    }

    public synchronized double peak() {
        return peak;
    }
}
