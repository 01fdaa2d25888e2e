package com.dextrader.core.model;

import java.time.Instant;

/**
 * Top of book for a symbol.
 */
public record Ticker(String symbol, double bid, double ask, Instant timestamp) {
    public double mid() {
        return (bid + ask) / 2.0;
    }

    public double spread() {
        return ask - bid;
    }
}
