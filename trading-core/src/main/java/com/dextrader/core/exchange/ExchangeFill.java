package com.dextrader.core.exchange;

import com.dextrader.core.model.Side;

import java.time.Instant;

/**
 * A single execution reported by the exchange.
 */
public record ExchangeFill(
    String fillId,
    String clientOrderId,
    String exchangeOrderId,
    String symbol,
    Side side,
    double size,
    double price,
    Instant time
) {
}
