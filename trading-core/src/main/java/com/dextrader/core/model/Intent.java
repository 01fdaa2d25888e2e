package com.dextrader.core.model;

import java.time.Instant;

/**
 * A strategy's request to change its position, before any risk check.
 *
 * @param referencePrice price used to convert notional into size and to measure exposure
 */
public record Intent(
    String symbol,
    Side side,
    double requestedNotional,
    String reason,
    String strategyId,
    Instant createdAt,
    IntentPurpose purpose,
    double referencePrice
) {
    public boolean isExit() {
        return purpose == IntentPurpose.EXIT;
    }

    /** Signed notional change this intent asks for (buys positive). */
    public double signedNotional() {
        return side.sign() * requestedNotional;
    }
}
