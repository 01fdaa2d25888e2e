package com.dextrader.core.orchestrator;

import com.dextrader.core.model.Timeframe;
import com.dextrader.core.risk.RiskLimits;
import com.dextrader.core.strategy.PositionRules;
import com.dextrader.core.strategy.StrategyKind;
import com.dextrader.core.strategy.StrategyParameters;

import java.time.Duration;
import java.util.List;

/**
 * Immutable engine configuration, built once at start-up and shared by reference.
 *
 * @param candleSettle delay after a candle boundary before fetching, so the closed candle is published
 * @param reconcileInterval period of the background reconciliation and stale order sweep
 * @param orderMaxAge working orders older than this are cancelled by the sweep
 */
public record EngineSettings(
    List<String> symbols,
    List<StrategyKind> strategies,
    Timeframe timeframe,
    StrategyParameters strategyParameters,
    PositionRules positionRules,
    RiskLimits riskLimits,
    Duration candleSettle,
    Duration reconcileInterval,
    Duration orderMaxAge,
    boolean flattenOnShutdown,
    Duration shutdownTimeout,
    int workerThreads
) {
    public EngineSettings {
        symbols = List.copyOf(symbols);
        strategies = List.copyOf(strategies);
        if (symbols.isEmpty() || strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one symbol and one strategy are required");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
    }
}
