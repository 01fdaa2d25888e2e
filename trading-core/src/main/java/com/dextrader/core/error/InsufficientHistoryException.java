package com.dextrader.core.error;

/**
 * Fewer closed candles than a strategy's minimum period. The caller skips the cycle.
 */
public class InsufficientHistoryException extends TradingEngineException {
    private final int required;
    private final int available;

    public InsufficientHistoryException(String strategyId, int required, int available) {
        super(String.format("%s needs %d candles, got %d", strategyId, required, available));
        this.required = required;
        this.available = available;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}
