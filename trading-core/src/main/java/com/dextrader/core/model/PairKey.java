package com.dextrader.core.model;

/**
 * (symbol, strategy id) pair. At most one live order and one evaluation cycle exist per pair at a time.
 */
public record PairKey(String symbol, String strategyId) {
    @Override
    public String toString() {
        return symbol + "/" + strategyId;
    }
}
