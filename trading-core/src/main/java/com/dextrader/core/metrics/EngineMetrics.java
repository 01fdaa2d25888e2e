package com.dextrader.core.metrics;

import com.dextrader.core.execution.ReconciliationMismatch;
import com.dextrader.core.model.Direction;
import com.dextrader.core.model.OrderStatus;
import com.dextrader.core.model.PairKey;
import com.dextrader.core.model.RejectionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/**
 * Engine counters and timers. The registry is supplied by the caller so the backend can bind
 * it to Prometheus; tests use a {@link SimpleMeterRegistry}.
 */
public final class EngineMetrics {
    private final MeterRegistry registry;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public static EngineMetrics inMemory() {
        return new EngineMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void cycleCompleted(PairKey pair, Duration elapsed) {
        registry.timer("engine.cycle.duration", "symbol", pair.symbol(), "strategy", pair.strategyId())
            .record(elapsed);
    }

    public void cycleSkipped(PairKey pair, String reason) {
        registry.counter("engine.cycle.skipped",
            "symbol", pair.symbol(), "strategy", pair.strategyId(), "reason", reason).increment();
    }

    public void cycleFailed(PairKey pair, Throwable error) {
        registry.counter("engine.cycle.failed",
            "symbol", pair.symbol(), "strategy", pair.strategyId(),
            "error", error.getClass().getSimpleName()).increment();
    }

    public void signal(PairKey pair, Direction direction) {
        registry.counter("engine.signals",
            "symbol", pair.symbol(), "strategy", pair.strategyId(), "direction", direction.name()).increment();
    }

    public void riskRejected(PairKey pair, RejectionReason reason) {
        registry.counter("engine.risk.rejections",
            "symbol", pair.symbol(), "strategy", pair.strategyId(), "reason", reason.name()).increment();
    }

    public void orderSubmitted(PairKey pair) {
        registry.counter("engine.orders.submitted", "symbol", pair.symbol(), "strategy", pair.strategyId())
            .increment();
    }

    public void orderTerminal(PairKey pair, OrderStatus status) {
        registry.counter("engine.orders.terminal",
            "symbol", pair.symbol(), "strategy", pair.strategyId(), "status", status.name()).increment();
    }

    public void reconciliationMismatch(ReconciliationMismatch mismatch) {
        registry.counter("engine.reconciliation.mismatches", "kind", mismatch.kind().name()).increment();
    }

    /** Sum of all counters named {@code name} carrying the given tags. */
    public double count(String name, String... tags) {
        return registry.find(name).tags(tags).counters().stream()
            .mapToDouble(Counter::count)
            .sum();
    }
}
