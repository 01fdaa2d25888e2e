package com.dextrader.core.strategy;

/**
 * Lifecycle of one (symbol, strategy) pair: FLAT -> ENTERING -> IN_POSITION -> EXITING -> FLAT.
 */
public enum StrategyState {
    FLAT,
    ENTERING,
    IN_POSITION,
    EXITING;

    /** True while an order for this pair is expected to be working. */
    public boolean awaitingOrder() {
        return this == ENTERING || this == EXITING;
    }
}
