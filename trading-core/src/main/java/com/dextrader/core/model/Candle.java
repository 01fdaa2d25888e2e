package com.dextrader.core.model;

import java.time.Instant;

/**
 * Immutable OHLCV bar. A candle is only handed to the engine once it has closed.
 */
public record Candle(
    Instant openTime,
    double open,
    double high,
    double low,
    double close,
    double volume
) {
    public Candle {
        if (openTime == null) {
            throw new IllegalArgumentException("Candle open time is required");
        }
        if (high < low) {
            throw new IllegalArgumentException("Candle high " + high + " below low " + low);
        }
    }
}
