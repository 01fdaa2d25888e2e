package com.dextrader.core.model;

import java.time.Instant;

/**
 * Point-in-time view of exposure in one symbol. {@code netSize} is signed (negative for shorts).
 */
public record Position(
    String symbol,
    double netSize,
    double entryPrice,
    double unrealizedPnl,
    double realizedPnl,
    double markPrice,
    Instant reconciledAt
) {
    public static Position flat(String symbol) {
        return new Position(symbol, 0.0, 0.0, 0.0, 0.0, 0.0, null);
    }

    public boolean isFlat() {
        return netSize == 0.0;
    }

    public Direction direction() {
        if (netSize > 0.0) {
            return Direction.LONG;
        }
        return netSize < 0.0 ? Direction.SHORT : Direction.FLAT;
    }

    /** Absolute notional at the given price. */
    public double notionalAt(double price) {
        return Math.abs(netSize) * price;
    }
}
