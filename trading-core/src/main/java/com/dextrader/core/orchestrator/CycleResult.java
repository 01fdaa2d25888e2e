package com.dextrader.core.orchestrator;

/**
 * Outcome of one evaluation cycle for a pair.
 */
public enum CycleResult {
    CANCELLED,
    NO_NEW_CANDLE,
    INSUFFICIENT_HISTORY,
    STALE_POSITION,
    NO_ACTION,
    ORDER_BUSY,
    RISK_REJECTED,
    SUBMITTED,
    FAILED
}
