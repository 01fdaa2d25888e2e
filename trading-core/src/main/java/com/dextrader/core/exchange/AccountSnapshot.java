package com.dextrader.core.exchange;

/**
 * Margin account figures as reported by the exchange.
 */
public record AccountSnapshot(double equity, double marginUsed, double available) {
}
