package com.dextrader.core.exchange;

/**
 * Position as reported by the exchange; {@code netSize} is signed.
 */
public record ExchangePosition(
    String symbol,
    double netSize,
    double entryPrice,
    double realizedPnl,
    double markPrice
) {
}
