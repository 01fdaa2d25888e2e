package com.dextrader.core.strategy;

import java.time.Instant;
import java.util.Set;

/**
 * Persistable copy of a state machine's fields, used for crash recovery.
 */
public record StrategySnapshot(
    StrategyState state,
    double entryPrice,
    double entryStopDistance,
    String pendingClientOrderId,
    int consecutiveRejections,
    Instant gridAnchor,
    Set<Double> consumedGridLevels
) {
    public StrategySnapshot {
        consumedGridLevels = consumedGridLevels == null ? Set.of() : Set.copyOf(consumedGridLevels);
    }
}
