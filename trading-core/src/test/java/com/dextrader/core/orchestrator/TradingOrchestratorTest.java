package com.dextrader.core.orchestrator;

import com.dextrader.core.CandleFixtures;
import com.dextrader.core.exchange.ExchangeOrder;
import com.dextrader.core.exchange.ExchangePosition;
import com.dextrader.core.exchange.RetryPolicy;
import com.dextrader.core.exchange.RetrySettings;
import com.dextrader.core.execution.OrderManager;
import com.dextrader.core.metrics.EngineMetrics;
import com.dextrader.core.model.Candle;
import com.dextrader.core.model.Order;
import com.dextrader.core.model.OrderRequest;
import com.dextrader.core.model.OrderStatus;
import com.dextrader.core.model.OrderType;
import com.dextrader.core.model.PairKey;
import com.dextrader.core.model.Side;
import com.dextrader.core.model.Ticker;
import com.dextrader.core.model.Timeframe;
import com.dextrader.core.position.PositionTracker;
import com.dextrader.core.risk.EquityWatermark;
import com.dextrader.core.risk.RiskLimits;
import com.dextrader.core.risk.RiskManager;
import com.dextrader.core.strategy.PositionRules;
import com.dextrader.core.strategy.StrategyKind;
import com.dextrader.core.strategy.StrategyParameters;
import com.dextrader.core.strategy.StrategyState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Trading orchestrator")
class TradingOrchestratorTest {
    /** Just after the close of candle 30 (the golden cross). */
    private static final Instant NOW = CandleFixtures.openTime(31).plusSeconds(5);
    private static final PairKey BTC = new PairKey("BTC", "simple_ma");
    private static final PairKey ETH = new PairKey("ETH", "simple_ma");

    private final FakeExchange exchange = new FakeExchange();
    private final PositionTracker positions = new PositionTracker();
    private final EngineMetrics metrics = EngineMetrics.inMemory();
    private final InMemoryStateSink sink = new InMemoryStateSink();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private OrderManager orderManager;
    private EquityWatermark watermark;

    /** Golden cross on the last closed candle, plus the still-open candle 31. */
    private static List<Candle> goldenCross() {
        double[] closes = new double[32];
        for (int i = 0; i < 30; i++) {
            closes[i] = 130 - i;
        }
        closes[30] = 300;
        closes[31] = 305;
        return CandleFixtures.fromCloses(closes);
    }

    private TradingOrchestrator orchestrator(String... symbols) {
        return orchestrator(false, symbols);
    }

    private TradingOrchestrator orchestrator(boolean flattenOnShutdown, String... symbols) {
        EngineSettings settings = new EngineSettings(List.of(symbols), List.of(StrategyKind.SIMPLE_MA), Timeframe.H1,
            StrategyParameters.defaults(), PositionRules.defaults(), RiskLimits.defaults(), Duration.ofSeconds(5),
            Duration.ofMinutes(1), Duration.ofMinutes(5), flattenOnShutdown, Duration.ofSeconds(5), 1);
        orderManager = new OrderManager(exchange, new RetryPolicy("order-submit",
            new RetrySettings(2, Duration.ofMillis(1), 2.0)), positions, clock, settings.orderMaxAge());
        watermark = new EquityWatermark(exchange.equity);
        return new TradingOrchestrator(settings, exchange, orderManager, positions, new RiskManager(),
            watermark, metrics, sink, clock);
    }

    /** Runs {@code cycles} concurrently, released together, and returns their results. */
    private static List<CycleResult> runTogether(TradingOrchestrator orchestrator, List<PairKey> cycles)
        throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(cycles.size());
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<CycleResult>> futures = new ArrayList<>();
            for (PairKey pair : cycles) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return orchestrator.runCycle(pair);
                }));
            }
            start.countDown();
            List<CycleResult> results = new ArrayList<>();
            for (Future<CycleResult> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private void market(String symbol, List<Candle> candles) {
        exchange.candles.put(symbol, candles);
        exchange.tickers.put(symbol, new Ticker(symbol, 299, 301, NOW));
    }

    @Nested
    @DisplayName("Cycle")
    class Cycle {

        @Test
        @DisplayName("An entry signal becomes a post-only limit at the bid, sized from the position size")
        void submitsEntry() {
            market("BTC", goldenCross());
            TradingOrchestrator orchestrator = orchestrator("BTC");

            CycleResult result = orchestrator.runCycle(BTC);

            assertThat(result).isEqualTo(CycleResult.SUBMITTED);
            assertThat(exchange.submitted).hasSize(1);
            OrderRequest request = exchange.submitted.get(0);
            assertThat(request.side()).isEqualTo(Side.BUY);
            assertThat(request.type()).isEqualTo(OrderType.LIMIT);
            assertThat(request.postOnly()).isTrue();
            assertThat(request.price()).isEqualTo(299.0);
            assertThat(request.size()).isEqualTo(0.334);
            assertThat(orchestrator.stateMachine(BTC).state()).isEqualTo(StrategyState.ENTERING);
            assertThat(orderManager.liveOrder(BTC)).isPresent();
        }

        @Test
        @DisplayName("The same closed candle is evaluated once")
        void noNewCandle() {
            market("BTC", goldenCross());
            TradingOrchestrator orchestrator = orchestrator("BTC");

            orchestrator.runCycle(BTC);

            assertThat(orchestrator.runCycle(BTC)).isEqualTo(CycleResult.NO_NEW_CANDLE);
            assertThat(exchange.submitted).hasSize(1);
        }

        @Test
        @DisplayName("An immediate fill moves the pair into position")
        void fillFeedsStateMachine() {
            market("BTC", goldenCross());
            exchange.fillImmediately = true;
            TradingOrchestrator orchestrator = orchestrator("BTC");

            orchestrator.runCycle(BTC);

            assertThat(orchestrator.stateMachine(BTC).state()).isEqualTo(StrategyState.IN_POSITION);
            assertThat(orchestrator.stateMachine(BTC).entryPrice()).isCloseTo(299.0, within(1e-9));
            assertThat(positions.get("BTC").netSize()).isCloseTo(0.334, within(1e-12));
        }

        @Test
        @DisplayName("Too few candles skip the cycle")
        void insufficientHistory() {
            market("BTC", goldenCross().subList(0, 20));
            TradingOrchestrator orchestrator = orchestrator("BTC");

            assertThat(orchestrator.runCycle(BTC)).isEqualTo(CycleResult.INSUFFICIENT_HISTORY);
            assertThat(exchange.submitted).isEmpty();
        }

        @Test
        @DisplayName("No cycle runs on an unreconciled position")
        void stalePosition() {
            market("BTC", goldenCross());
            exchange.snapshotsUnavailable = true;
            TradingOrchestrator orchestrator = orchestrator("BTC");

            assertThat(orchestrator.runCycle(BTC)).isEqualTo(CycleResult.STALE_POSITION);
            assertThat(metrics.count("engine.cycle.skipped", "reason", "stale_position")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Risk rejection abandons the intent")
        void riskRejected() {
            market("BTC", goldenCross());
            exchange.equity = 0.0;
            TradingOrchestrator orchestrator = orchestrator("BTC");

            assertThat(orchestrator.runCycle(BTC)).isEqualTo(CycleResult.RISK_REJECTED);
            assertThat(orchestrator.stateMachine(BTC).state()).isEqualTo(StrategyState.FLAT);
            assertThat(metrics.count("engine.risk.rejections", "reason", "LEVERAGE")).isEqualTo(1.0);
            assertThat(exchange.submitted).isEmpty();
        }

        @Test
        @DisplayName("A working order for the pair blocks a new one")
        void orderBusy() {
            market("BTC", goldenCross());
            TradingOrchestrator orchestrator = orchestrator("BTC");
            OrderRequest working = OrderRequest.limit("dx:BTC:simple_ma:1:1", "BTC", "simple_ma", Side.SELL,
                320.0, 0.1, true);
            orderManager.restore(List.of(new Order(working, OrderStatus.OPEN, "x-0", 0, 0, NOW, NOW, null)));
            exchange.openOrders.add(new ExchangeOrder(working.clientOrderId(), "x-0", "BTC", Side.SELL,
                OrderType.LIMIT, 320.0, 0.1, 0.0));

            assertThat(orchestrator.runCycle(BTC)).isEqualTo(CycleResult.ORDER_BUSY);
            assertThat(orchestrator.stateMachine(BTC).state()).isEqualTo(StrategyState.FLAT);
            assertThat(exchange.submitted).isEmpty();
        }

        @Test
        @DisplayName("A failing pair does not affect the others")
        void failureIsolated() {
            market("BTC", goldenCross());
            market("ETH", goldenCross());
            exchange.failingSymbols.add("ETH");
            TradingOrchestrator orchestrator = orchestrator("BTC", "ETH");

            assertThat(orchestrator.runCycle(ETH)).isEqualTo(CycleResult.FAILED);
            assertThat(orchestrator.runCycle(BTC)).isEqualTo(CycleResult.SUBMITTED);
            assertThat(metrics.count("engine.cycle.failed", "symbol", "ETH")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Concurrent cycles for one pair run one at a time and submit once")
        void samePairSerialized() throws Exception {
            market("BTC", goldenCross());
            exchange.candleLatencyMillis = 20;
            TradingOrchestrator orchestrator = orchestrator("BTC");

            List<CycleResult> results = runTogether(orchestrator, List.of(BTC, BTC, BTC, BTC));

            assertThat(exchange.peakCandleFetches).containsEntry("BTC", 1);
            assertThat(results).containsOnlyOnce(CycleResult.SUBMITTED);
            assertThat(results).filteredOn(r -> r != CycleResult.SUBMITTED).containsOnly(CycleResult.NO_NEW_CANDLE);
            assertThat(exchange.submitted).hasSize(1);
        }

        @Test
        @DisplayName("Cycles for different pairs run concurrently")
        void differentPairsOverlap() throws Exception {
            market("BTC", goldenCross());
            market("ETH", goldenCross());
            exchange.candleRendezvous = new CountDownLatch(2);
            TradingOrchestrator orchestrator = orchestrator("BTC", "ETH");

            List<CycleResult> results = runTogether(orchestrator, List.of(BTC, ETH));

            assertThat(exchange.peakCandleFetchesAllSymbols.get()).isEqualTo(2);
            assertThat(results).containsOnly(CycleResult.SUBMITTED);
        }

        @Test
        @DisplayName("A gap in the candles fails the cycle")
        void gapFails() {
            List<Candle> gapped = new ArrayList<>(goldenCross());
            gapped.remove(10);
            market("BTC", gapped);
            TradingOrchestrator orchestrator = orchestrator("BTC");

            assertThat(orchestrator.runCycle(BTC)).isEqualTo(CycleResult.FAILED);
            assertThat(metrics.count("engine.cycle.failed", "error", "InvalidCandleSeriesException")).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Each cycle persists the pair")
        void persistsAfterCycle() {
            market("BTC", goldenCross());
            TradingOrchestrator orchestrator = orchestrator("BTC");

            orchestrator.runCycle(BTC);

            PairSnapshot saved = sink.snapshots.get(BTC);
            assertThat(saved.strategy().state()).isEqualTo(StrategyState.ENTERING);
            assertThat(saved.liveOrders()).hasSize(1);
        }

        @Test
        @DisplayName("Start restores today's realized PnL and shutdown stops all cycles")
        void startAndShutdown() {
            LocalDate today = NOW.atZone(ZoneOffset.UTC).toLocalDate();
            sink.realized.put(today, -42.0);
            TradingOrchestrator orchestrator = orchestrator("BTC");

            orchestrator.start();
            orchestrator.shutdown();

            assertThat(positions.realizedPnlToday(NOW)).isEqualTo(-42.0);
            assertThat(sink.realized).containsEntry(today, -42.0);
            assertThat(orchestrator.isCancelled()).isTrue();
            assertThat(orchestrator.runCycle(BTC)).isEqualTo(CycleResult.CANCELLED);
        }

        @Test
        @DisplayName("Flatten on shutdown exits open positions reduce-only, then reconciles and persists")
        void flattenOnShutdown() {
            market("BTC", goldenCross());
            exchange.fillImmediately = true;
            TradingOrchestrator orchestrator = orchestrator(true, "BTC");
            orchestrator.runCycle(BTC);
            assertThat(orchestrator.stateMachine(BTC).state()).isEqualTo(StrategyState.IN_POSITION);

            orchestrator.shutdown();

            assertThat(exchange.submitted).hasSize(2);
            OrderRequest exit = exchange.submitted.get(1);
            assertThat(exit.type()).isEqualTo(OrderType.MARKET);
            assertThat(exit.side()).isEqualTo(Side.SELL);
            assertThat(exit.reduceOnly()).isTrue();
            assertThat(exit.size()).isEqualTo(0.334);
            assertThat(exchange.positions).isEmpty();
            assertThat(positions.get("BTC").isFlat()).isTrue();
            assertThat(orderManager.liveOrders()).isEmpty();
            PairSnapshot saved = sink.snapshots.get(BTC);
            assertThat(saved.strategy().state()).isEqualTo(StrategyState.FLAT);
            assertThat(saved.position().isFlat()).isTrue();
        }

        @Test
        @DisplayName("Shutdown leaves positions open unless flattening is configured")
        void noFlattenByDefault() {
            market("BTC", goldenCross());
            exchange.fillImmediately = true;
            TradingOrchestrator orchestrator = orchestrator("BTC");
            orchestrator.runCycle(BTC);

            orchestrator.shutdown();

            assertThat(exchange.submitted).hasSize(1);
            assertThat(sink.snapshots.get(BTC).strategy().state()).isEqualTo(StrategyState.IN_POSITION);
        }

        @Test
        @DisplayName("Exit size is rounded down to the market's size decimals")
        void exitSizeRounded() {
            market("BTC", goldenCross());
            exchange.fillImmediately = true;
            TradingOrchestrator orchestrator = orchestrator(true, "BTC");
            orchestrator.runCycle(BTC);
            positions.reconcile(List.of(new ExchangePosition("BTC", 0.3347891, 299, 0, 299)), NOW);

            orchestrator.shutdown();

            assertThat(exchange.submitted).hasSize(2);
            assertThat(exchange.submitted.get(1).size()).isEqualTo(0.334);
        }

        @Test
        @DisplayName("The equity peak is restored at start and saved at shutdown")
        void peakEquitySurvivesRestart() {
            sink.peakEquity = 20_000.0;
            TradingOrchestrator orchestrator = orchestrator("BTC");

            orchestrator.start();
            assertThat(watermark.peak()).isEqualTo(20_000.0);
            orchestrator.shutdown();

            assertThat(sink.peakEquity).isEqualTo(20_000.0);
        }

        @Test
        @DisplayName("Status lists every configured pair")
        void status() {
            TradingOrchestrator orchestrator = orchestrator("BTC", "ETH");

            assertThat(orchestrator.pairs()).containsExactly(BTC, ETH);
            assertThat(orchestrator.status()).extracting(PairStatus::state)
                .containsOnly(StrategyState.FLAT);
        }
    }
}
