package com.dextrader.core.orchestrator;

import com.dextrader.core.error.InsufficientHistoryException;
import com.dextrader.core.error.LiveOrderExistsException;
import com.dextrader.core.exchange.AccountSnapshot;
import com.dextrader.core.exchange.ExchangeClient;
import com.dextrader.core.execution.ClientOrderIds;
import com.dextrader.core.execution.OrderEventListener;
import com.dextrader.core.execution.OrderManager;
import com.dextrader.core.execution.ReconciliationReport;
import com.dextrader.core.indicator.CandleSeries;
import com.dextrader.core.metrics.EngineMetrics;
import com.dextrader.core.model.AccountState;
import com.dextrader.core.model.Candle;
import com.dextrader.core.model.FillEvent;
import com.dextrader.core.model.Intent;
import com.dextrader.core.model.MarketInfo;
import com.dextrader.core.model.Order;
import com.dextrader.core.model.OrderRequest;
import com.dextrader.core.model.PairKey;
import com.dextrader.core.model.Position;
import com.dextrader.core.model.RiskDecision;
import com.dextrader.core.model.Side;
import com.dextrader.core.model.Signal;
import com.dextrader.core.model.Ticker;
import com.dextrader.core.model.Timeframe;
import com.dextrader.core.position.PositionTracker;
import com.dextrader.core.risk.EquityWatermark;
import com.dextrader.core.risk.RiskManager;
import com.dextrader.core.risk.RiskSummary;
import com.dextrader.core.strategy.PositionRules;
import com.dextrader.core.strategy.StrategyFactory;
import com.dextrader.core.strategy.StrategyKind;
import com.dextrader.core.strategy.StrategyStateMachine;
import com.dextrader.core.strategy.TradingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one evaluation cycle per (symbol, strategy) pair at each candle close.
 *
 * Cycle: fetch closed candles -> validate -> make sure the position is freshly reconciled -> evaluate
 * the strategy -> state machine intent -> live order check -> risk -> submit. Pairs run concurrently on
 * a worker pool; a per-pair lock serializes everything that touches the same pair, and an exception in
 * one pair's cycle is logged and confined to that cycle.
 */
public final class TradingOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(TradingOrchestrator.class);
    private static final int LOOKBACK_BUFFER = 50;

    private final EngineSettings settings;
    private final ExchangeClient exchange;
    private final OrderManager orderManager;
    private final PositionTracker positions;
    private final RiskManager riskManager;
    private final EquityWatermark watermark;
    private final EngineMetrics metrics;
    private final EngineStateSink stateSink;
    private final Clock clock;

    private final Map<PairKey, PairContext> contexts = new LinkedHashMap<>();
    private final Map<String, MarketInfo> marketInfo = new ConcurrentHashMap<>();
    private final CancellationToken cancellation = new CancellationToken();
    private volatile ScheduledExecutorService scheduler;

    public TradingOrchestrator(EngineSettings settings,
                               ExchangeClient exchange,
                               OrderManager orderManager,
                               PositionTracker positions,
                               RiskManager riskManager,
                               EquityWatermark watermark,
                               EngineMetrics metrics,
                               EngineStateSink stateSink,
                               Clock clock) {
        this.settings = settings;
        this.exchange = exchange;
        this.orderManager = orderManager;
        this.positions = positions;
        this.riskManager = riskManager;
        this.watermark = watermark;
        this.metrics = metrics;
        this.stateSink = stateSink;
        this.clock = clock;

        for (String symbol : settings.symbols()) {
            for (StrategyKind kind : settings.strategies()) {
                TradingStrategy strategy = StrategyFactory.create(kind, settings.strategyParameters());
                PairKey pair = new PairKey(symbol, strategy.id());
                PositionRules rules = kind == StrategyKind.BREAKOUT
                    ? settings.positionRules().withConfirmationBars(settings.strategyParameters().breakout().confirmationBars())
                    : settings.positionRules();
                contexts.put(pair, new PairContext(pair, strategy, new StrategyStateMachine(pair, rules)));
            }
        }
        orderManager.addListener(new StateMachineFeedback());
    }

    /**
     * Restores persisted state, reconciles, and schedules every pair.
     */
    public synchronized void start() {
        if (scheduler != null) {
            throw new IllegalStateException("Orchestrator already started");
        }
        restoreState();
        reconcileAndSync();
        AccountSnapshot account = exchange.getAccountState();
        watermark.observe(account.equity());
        StartupValidator.validate(settings, account.equity()).forEach(w -> logger.warn("Startup check: {}", w));

        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(settings.workerThreads(),
            namedThreads("engine-worker"));
        // pending next-candle cycles are dropped on shutdown, running ones finish
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        scheduler = executor;
        for (PairContext context : contexts.values()) {
            scheduler.schedule(() -> runScheduled(context), 0, TimeUnit.MILLISECONDS);
        }
        long reconcileMillis = settings.reconcileInterval().toMillis();
        scheduler.scheduleWithFixedDelay(this::reconciliationSweep, reconcileMillis, reconcileMillis,
            TimeUnit.MILLISECONDS);
        logger.info("Trading orchestrator started: {} pairs on {} candles", contexts.size(),
            settings.timeframe().code());
    }

    private void runScheduled(PairContext context) {
        if (cancellation.isCancelled()) {
            return;
        }
        try {
            runCycle(context.pair);
        } finally {
            if (!cancellation.isCancelled()) {
                Instant now = clock.instant();
                Instant next = settings.timeframe().nextBoundary(now).plus(settings.candleSettle());
                long delay = Math.max(0, Duration.between(now, next).toMillis());
                try {
                    scheduler.schedule(() -> runScheduled(context), delay, TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    logger.debug("{}: scheduler shut down, not rescheduling", context.pair);
                }
            }
        }
    }

    /**
     * Runs one evaluation cycle for the pair now. Never throws; failures are logged and reported as
     * {@link CycleResult#FAILED}.
     */
    public CycleResult runCycle(PairKey pair) {
        PairContext context = context(pair);
        if (cancellation.isCancelled()) {
            return CycleResult.CANCELLED;
        }
        long started = System.nanoTime();
        context.lock.lock();
        try {
            CycleResult result = evaluate(context);
            logger.debug("{}: cycle finished with {}", pair, result);
            return result;
        } catch (RuntimeException e) {
            logger.error("{}: cycle failed, skipping this pair until the next candle", pair, e);
            metrics.cycleFailed(pair, e);
            return CycleResult.FAILED;
        } finally {
            context.lock.unlock();
            metrics.cycleCompleted(pair, Duration.ofNanos(System.nanoTime() - started));
        }
    }

    private CycleResult evaluate(PairContext context) {
        PairKey pair = context.pair;
        Instant now = clock.instant();
        Timeframe timeframe = settings.timeframe();

        List<Candle> candles = closedCandles(
            exchange.getCandles(pair.symbol(), timeframe, context.strategy.minimumHistory() + LOOKBACK_BUFFER),
            timeframe, now);
        if (candles.isEmpty()) {
            metrics.cycleSkipped(pair, "no_candles");
            return CycleResult.INSUFFICIENT_HISTORY;
        }
        CandleSeries.requireContiguous(candles, timeframe.duration());
        Instant latest = CandleSeries.last(candles).openTime();
        if (latest.equals(context.lastEvaluatedCandle)) {
            return CycleResult.NO_NEW_CANDLE;
        }

        if (!ensureFreshPosition(pair.symbol(), now)) {
            metrics.cycleSkipped(pair, "stale_position");
            return CycleResult.STALE_POSITION;
        }
        Ticker ticker = exchange.getTicker(pair.symbol());
        positions.updateMark(pair.symbol(), ticker.mid());
        Position position = positions.get(pair.symbol());
        StrategyStateMachine machine = context.stateMachine;
        machine.syncWithPosition(position, machine.pendingClientOrderId().flatMap(orderManager::get));

        Signal signal;
        try {
            signal = context.strategy.evaluate(candles);
        } catch (InsufficientHistoryException e) {
            logger.info("{}: {}", pair, e.getMessage());
            metrics.cycleSkipped(pair, "insufficient_history");
            return CycleResult.INSUFFICIENT_HISTORY;
        }
        context.lastEvaluatedCandle = latest;
        context.lastSignal = signal;
        context.lastIndicators = context.strategy.indicators(candles);
        metrics.signal(pair, signal.direction());
        logger.debug("{}: indicators {}", pair, context.lastIndicators.values());
        if (!signal.isFlat()) {
            logger.info("{}: {} signal strength {} - {}", pair, signal.direction(), signal.strength(), signal.reason());
        }

        Optional<Intent> intent = machine.onSignal(signal, position, ticker.mid(), now);
        if (intent.isEmpty()) {
            persist(context);
            return CycleResult.NO_ACTION;
        }
        CycleResult result = act(context, intent.get(), position, ticker, now);
        persist(context);
        return result;
    }

    private CycleResult act(PairContext context, Intent intent, Position position, Ticker ticker, Instant now) {
        PairKey pair = context.pair;
        StrategyStateMachine machine = context.stateMachine;
        boolean bound = false;
        try {
            Optional<Order> live = orderManager.liveOrder(pair);
            if (live.isPresent()) {
                logger.info("{}: live order {} still working, intent dropped", pair, live.get().clientOrderId());
                machine.abandonIntent("live order " + live.get().clientOrderId());
                return CycleResult.ORDER_BUSY;
            }

            RiskDecision decision = riskManager.evaluate(intent, position, accountState(now), settings.riskLimits());
            if (!decision.approved()) {
                metrics.riskRejected(pair, decision.rejectionReason());
                machine.abandonIntent(decision.rejectionReason() + ": " + decision.detail());
                return CycleResult.RISK_REJECTED;
            }

            Optional<OrderRequest> request = buildOrder(pair, intent, decision, position, ticker, now);
            if (request.isEmpty()) {
                machine.abandonIntent("order size rounds to zero");
                return CycleResult.RISK_REJECTED;
            }
            machine.awaitOrder(request.get().clientOrderId());
            bound = true;
            Order order = orderManager.submit(request.get());
            metrics.orderSubmitted(pair);
            logger.info("{}: {} order {} is {}", pair, intent.purpose(), order.clientOrderId(), order.status());
            return CycleResult.SUBMITTED;
        } catch (LiveOrderExistsException e) {
            logger.info("{}: {}", pair, e.getMessage());
            machine.abandonIntent(e.getMessage());
            return CycleResult.ORDER_BUSY;
        } catch (RuntimeException e) {
            if (!bound) {
                machine.abandonIntent(e.getClass().getSimpleName());
            }
            throw e;
        }
    }

    /**
     * Entries are post-only limits at the near side of the book; exits are reduce-only market orders for
     * the whole position.
     */
    private Optional<OrderRequest> buildOrder(PairKey pair, Intent intent, RiskDecision decision, Position position,
                                              Ticker ticker, Instant now) {
        String clientOrderId = ClientOrderIds.next(pair, now);
        if (intent.isExit()) {
            double size = info(pair.symbol()).roundSizeDown(Math.abs(position.netSize()));
            return size > 0.0
                ? Optional.of(OrderRequest.market(clientOrderId, pair.symbol(), pair.strategyId(), intent.side(), size, true))
                : Optional.empty();
        }
        double price = intent.side() == Side.BUY ? ticker.bid() : ticker.ask();
        if (!(price > 0.0)) {
            price = intent.referencePrice();
        }
        double size = info(pair.symbol()).roundSizeDown(decision.sizedNotional() / price);
        if (size <= 0.0) {
            return Optional.empty();
        }
        return Optional.of(OrderRequest.limit(clientOrderId, pair.symbol(), pair.strategyId(), intent.side(), price, size, true));
    }

    private MarketInfo info(String symbol) {
        return marketInfo.computeIfAbsent(symbol, exchange::getMarketInfo);
    }

    private AccountState accountState(Instant now) {
        AccountSnapshot snapshot = exchange.getAccountState();
        double peak = watermark.observe(snapshot.equity());
        return new AccountState(snapshot.equity(), snapshot.marginUsed(), snapshot.available(),
            positions.totalNotional(), peak, positions.realizedPnlToday(now));
    }

    /**
     * Reconciles when the last reconciliation is older than one cycle.
     */
    private boolean ensureFreshPosition(String symbol, Instant now) {
        Duration maxAge = settings.timeframe().duration().compareTo(settings.reconcileInterval()) < 0
            ? settings.timeframe().duration()
            : settings.reconcileInterval();
        Optional<Instant> last = positions.lastReconciledAt();
        if (last.isPresent() && !last.get().isBefore(now.minus(maxAge))) {
            return true;
        }
        Optional<ReconciliationReport> report = orderManager.reconcileNow();
        report.ifPresent(this::recordMismatches);
        last = positions.lastReconciledAt();
        // an empty report also means a concurrent, newer snapshot won
        boolean fresh = report.isPresent() || (last.isPresent() && !last.get().isBefore(now.minus(maxAge)));
        if (!fresh) {
            logger.warn("{}: position could not be reconciled, skipping cycle", symbol);
        }
        return fresh;
    }

    private static List<Candle> closedCandles(List<Candle> candles, Timeframe timeframe, Instant now) {
        List<Candle> closed = new ArrayList<>(candles.size());
        for (Candle candle : candles) {
            if (!candle.openTime().plus(timeframe.duration()).isAfter(now)) {
                closed.add(candle);
            }
        }
        return closed;
    }

    /**
     * Periodic reconciliation: exchange snapshot, stale order sweep, state machine sync, persistence and a
     * risk summary.
     */
    public void reconciliationSweep() {
        if (cancellation.isCancelled()) {
            return;
        }
        try {
            reconcileAndSync();
            int swept = orderManager.sweepStaleOrders();
            if (swept > 0) {
                logger.info("Stale order sweep handled {} orders", swept);
            }
            RiskSummary summary = riskManager.summarize(accountState(clock.instant()), settings.riskLimits());
            logger.info("Risk: equity={} exposure={} leverage={}x drawdown={}% pnlToday={}{}",
                String.format("%.2f", summary.equity()),
                String.format("%.2f", summary.openNotional()),
                String.format("%.2f", summary.leverage()),
                String.format("%.2f", summary.drawdownPercent()),
                String.format("%.2f", summary.realizedPnlToday()),
                summary.entriesBlocked() ? " (entries blocked)" : "");
        } catch (RuntimeException e) {
            logger.error("Reconciliation sweep failed", e);
        }
    }

    private void reconcileAndSync() {
        orderManager.reconcileNow().ifPresent(this::recordMismatches);
        for (PairContext context : contexts.values()) {
            context.lock.lock();
            try {
                StrategyStateMachine machine = context.stateMachine;
                machine.syncWithPosition(positions.get(context.pair.symbol()),
                    machine.pendingClientOrderId().flatMap(orderManager::get));
                persist(context);
            } finally {
                context.lock.unlock();
            }
        }
        persistAccountState();
    }

    private void recordMismatches(ReconciliationReport report) {
        report.mismatches().forEach(metrics::reconciliationMismatch);
    }

    private void restoreState() {
        Map<PairKey, PairSnapshot> saved = stateSink.loadAll();
        for (PairSnapshot snapshot : saved.values()) {
            PairContext context = contexts.get(snapshot.pair());
            if (context == null) {
                logger.info("{}: saved state for a pair that is no longer configured, ignoring", snapshot.pair());
                continue;
            }
            context.stateMachine.restore(snapshot.strategy());
            orderManager.restore(snapshot.liveOrders());
        }
        if (!saved.isEmpty()) {
            logger.info("Restored saved state for {} pairs", saved.size());
        }
        Instant now = clock.instant();
        stateSink.loadRealizedPnl(utcDay(now)).ifPresent(realized -> {
            positions.restoreRealizedToday(realized, now);
            logger.info("Restored realized PnL for today: {}", String.format("%.2f", realized));
        });
        stateSink.loadPeakEquity().ifPresent(peak -> {
            double restored = watermark.observe(peak);
            logger.info("Restored peak equity: {}", String.format("%.2f", restored));
        });
    }

    private void persistAccountState() {
        Instant now = clock.instant();
        try {
            stateSink.saveRealizedPnl(utcDay(now), positions.realizedPnlToday(now));
            stateSink.savePeakEquity(watermark.peak());
        } catch (RuntimeException e) {
            logger.error("Failed to persist realized PnL and peak equity", e);
        }
    }

    private static LocalDate utcDay(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }

    private void persist(PairContext context) {
        PairKey pair = context.pair;
        try {
            List<Order> live = orderManager.liveOrder(pair).map(List::of).orElse(List.of());
            stateSink.save(new PairSnapshot(pair, context.stateMachine.snapshot(), live,
                positions.get(pair.symbol()), clock.instant()));
        } catch (RuntimeException e) {
            logger.error("{}: failed to persist state", pair, e);
        }
    }

    /**
     * Stops scheduling, lets in-flight cycles and submissions finish, optionally flattens open positions,
     * then reconciles and persists a final time.
     */
    public void shutdown() {
        if (!cancellation.cancel()) {
            return;
        }
        logger.info("Shutting down orchestrator");
        ScheduledExecutorService running;
        synchronized (this) {
            running = scheduler;
        }
        if (running != null) {
            running.shutdown();
            try {
                if (!running.awaitTermination(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Cycles still running after {}s, interrupting", settings.shutdownTimeout().toSeconds());
                    running.shutdownNow();
                }
            } catch (InterruptedException e) {
                running.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (settings.flattenOnShutdown()) {
            flattenAll();
        }
        orderManager.reconcileNow().ifPresent(this::recordMismatches);
        contexts.values().forEach(this::persist);
        persistAccountState();
        logger.info("Orchestrator stopped");
    }

    private void flattenAll() {
        Set<String> flattened = new HashSet<>();
        for (PairContext context : contexts.values()) {
            String symbol = context.pair.symbol();
            if (flattened.contains(symbol)) {
                continue;
            }
            context.lock.lock();
            try {
                Position position = positions.get(symbol);
                if (position.isFlat()) {
                    continue;
                }
                double price = position.markPrice() > 0.0 ? position.markPrice() : position.entryPrice();
                Optional<Intent> exit = context.stateMachine.forceExit(position, price, clock.instant(), "flatten on shutdown");
                if (exit.isPresent()) {
                    logger.info("{}: flattening {} on shutdown", context.pair, position.netSize());
                    act(context, exit.get(), position, new Ticker(symbol, price, price, clock.instant()), clock.instant());
                    flattened.add(symbol);
                }
            } catch (RuntimeException e) {
                logger.error("{}: failed to flatten on shutdown", context.pair, e);
            } finally {
                context.lock.unlock();
            }
        }
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public List<PairKey> pairs() {
        return List.copyOf(contexts.keySet());
    }

    public StrategyStateMachine stateMachine(PairKey pair) {
        return context(pair).stateMachine;
    }

    public List<PairStatus> status() {
        List<PairStatus> result = new ArrayList<>();
        for (PairContext context : contexts.values()) {
            result.add(new PairStatus(context.pair, context.stateMachine.state(), context.stateMachine.entryPrice(),
                context.lastSignal, context.lastIndicators, positions.get(context.pair.symbol()),
                orderManager.liveOrder(context.pair).orElse(null)));
        }
        return result;
    }

    private PairContext context(PairKey pair) {
        PairContext context = contexts.get(pair);
        if (context == null) {
            throw new IllegalArgumentException("Unknown pair " + pair);
        }
        return context;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Routes order fills and terminal states back to the owning pair's state machine.
     */
    private final class StateMachineFeedback implements OrderEventListener {
        @Override
        public void onFill(Order order, FillEvent fill) {
            PairContext context = contexts.get(order.pair());
            if (context != null) {
                context.stateMachine.onOrderUpdate(order, positions.get(order.symbol()));
            }
        }

        @Override
        public void onTerminal(Order order) {
            metrics.orderTerminal(order.pair(), order.status());
            PairContext context = contexts.get(order.pair());
            if (context != null) {
                context.stateMachine.onOrderUpdate(order, positions.get(order.symbol()));
            }
        }
    }
}
