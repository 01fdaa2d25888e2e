package com.dextrader.core.orchestrator;

import com.dextrader.core.indicator.IndicatorState;
import com.dextrader.core.model.Order;
import com.dextrader.core.model.PairKey;
import com.dextrader.core.model.Position;
import com.dextrader.core.model.Signal;
import com.dextrader.core.strategy.StrategyState;

/**
 * Read-only view of a pair for status reporting. Nullable fields are absent until the first cycle.
 */
public record PairStatus(
    PairKey pair,
    StrategyState state,
    double entryPrice,
    Signal lastSignal,
    IndicatorState indicators,
    Position position,
    Order liveOrder
) {
}
