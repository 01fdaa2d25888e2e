package com.dextrader.core.error;

/**
 * Candle series violates the ordering or no-gap precondition of the indicator math.
 */
public class InvalidCandleSeriesException extends TradingEngineException {
    public InvalidCandleSeriesException(String message) {
        super(message);
    }
}
