package com.dextrader.core.model;

import java.time.Instant;

/**
 * A confirmed execution of {@code size} units at {@code price}. Only confirmed fills move a position.
 */
public record FillEvent(
    String clientOrderId,
    String symbol,
    Side side,
    double size,
    double price,
    Instant filledAt
) {
    public FillEvent {
        if (size <= 0.0 || price <= 0.0) {
            throw new IllegalArgumentException("Fill size and price must be positive");
        }
    }

    public double signedSize() {
        return side.sign() * size;
    }
}
