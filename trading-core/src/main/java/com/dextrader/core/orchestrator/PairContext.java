package com.dextrader.core.orchestrator;

import com.dextrader.core.indicator.IndicatorState;
import com.dextrader.core.model.PairKey;
import com.dextrader.core.model.Signal;
import com.dextrader.core.strategy.StrategyStateMachine;
import com.dextrader.core.strategy.TradingStrategy;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Everything the orchestrator keeps per (symbol, strategy) pair. {@link #lock} serializes cycles,
 * reconciliation sync and shutdown handling for the pair.
 */
final class PairContext {
    final PairKey pair;
    final TradingStrategy strategy;
    final StrategyStateMachine stateMachine;
    final ReentrantLock lock = new ReentrantLock();

    volatile Instant lastEvaluatedCandle;
    volatile Signal lastSignal;
    volatile IndicatorState lastIndicators;

    PairContext(PairKey pair, TradingStrategy strategy, StrategyStateMachine stateMachine) {
        this.pair = pair;
        this.strategy = strategy;
        this.stateMachine = stateMachine;
    }
}
