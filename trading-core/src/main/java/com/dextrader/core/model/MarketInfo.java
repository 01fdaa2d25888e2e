package com.dextrader.core.model;

/**
 * Trading rules for a symbol.
 *
 * @param sizeDecimals number of decimals allowed in an order size
 */
public record MarketInfo(String symbol, int sizeDecimals) {
    public static final int DEFAULT_SIZE_DECIMALS = 3;

    public static MarketInfo defaults(String symbol) {
        return new MarketInfo(symbol, DEFAULT_SIZE_DECIMALS);
    }

    /** Rounds a size down to the allowed precision so sizing never exceeds the approved notional. */
    public double roundSizeDown(double size) {
        double factor = Math.pow(10, sizeDecimals);
        return Math.floor(size * factor + 1e-9) / factor;
    }
}
