package com.dextrader.core.orchestrator;

import com.dextrader.core.model.Order;
import com.dextrader.core.model.PairKey;
import com.dextrader.core.model.Position;
import com.dextrader.core.strategy.StrategySnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Last known state of a (symbol, strategy) pair.
 */
public record PairSnapshot(
    PairKey pair,
    StrategySnapshot strategy,
    List<Order> liveOrders,
    Position position,
    Instant savedAt
) {
    public PairSnapshot {
        liveOrders = List.copyOf(liveOrders);
    }
}
