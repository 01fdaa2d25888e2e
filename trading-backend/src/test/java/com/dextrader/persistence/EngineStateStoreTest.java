package com.dextrader.persistence;

import com.dextrader.config.ObjectMappers;
import com.dextrader.core.model.Order;
import com.dextrader.core.model.OrderRequest;
import com.dextrader.core.model.OrderStatus;
import com.dextrader.core.model.PairKey;
import com.dextrader.core.model.Position;
import com.dextrader.core.model.Side;
import com.dextrader.core.orchestrator.PairSnapshot;
import com.dextrader.core.strategy.StrategySnapshot;
import com.dextrader.core.strategy.StrategyState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Engine state store")
class EngineStateStoreTest {
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private EngineStateStore store;

    @BeforeEach
    void setUp() {
        store = new EngineStateStore(tempDir.resolve("state.db").toString(), ObjectMappers.create());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static PairSnapshot entering(String symbol, String strategy) {
        OrderRequest request = OrderRequest.limit("cid-" + symbol, symbol, strategy, Side.BUY, 99.0, 1.0, true);
        Order order = Order.pending(request, NOW).transitionTo(OrderStatus.OPEN, NOW, null);
        StrategySnapshot strategySnapshot = new StrategySnapshot(StrategyState.ENTERING, 0.0, 0.0,
            request.clientOrderId(), 1, NOW, Set.of(101.5));
        return new PairSnapshot(new PairKey(symbol, strategy), strategySnapshot, List.of(order),
            Position.flat(symbol), NOW);
    }

    @Test
    @DisplayName("Snapshots survive a reopen of the database")
    void persistsAcrossReopen() {
        PairSnapshot snapshot = entering("BTC", "simple_ma");
        store.save(snapshot);
        store.close();

        store = new EngineStateStore(tempDir.resolve("state.db").toString(), ObjectMappers.create());
        Map<PairKey, PairSnapshot> loaded = store.loadAll();

        assertThat(loaded).containsOnlyKeys(new PairKey("BTC", "simple_ma"));
        PairSnapshot restored = loaded.get(new PairKey("BTC", "simple_ma"));
        assertThat(restored.strategy()).isEqualTo(snapshot.strategy());
        assertThat(restored.liveOrders()).singleElement().satisfies(order -> {
            assertThat(order.clientOrderId()).isEqualTo("cid-BTC");
            assertThat(order.status()).isEqualTo(OrderStatus.OPEN);
            assertThat(order.request().price()).isEqualTo(99.0);
        });
        assertThat(restored.position().isFlat()).isTrue();
        assertThat(restored.savedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Saving a pair twice keeps only the latest snapshot")
    void upserts() {
        store.save(entering("BTC", "simple_ma"));
        store.save(entering("ETH", "rsi"));

        StrategySnapshot inPosition = new StrategySnapshot(StrategyState.IN_POSITION, 99.0, 0.0, null, 0, null,
            Set.of());
        store.save(new PairSnapshot(new PairKey("BTC", "simple_ma"), inPosition, List.of(),
            new Position("BTC", 1.0, 99.0, 0.0, 0.0, 99.0, NOW), NOW.plusSeconds(60)));

        Map<PairKey, PairSnapshot> loaded = store.loadAll();

        assertThat(loaded).hasSize(2);
        PairSnapshot btc = loaded.get(new PairKey("BTC", "simple_ma"));
        assertThat(btc.strategy().state()).isEqualTo(StrategyState.IN_POSITION);
        assertThat(btc.liveOrders()).isEmpty();
        assertThat(btc.position().netSize()).isEqualTo(1.0);
        assertThat(loaded.get(new PairKey("ETH", "rsi")).strategy().state()).isEqualTo(StrategyState.ENTERING);
    }

    @Test
    @DisplayName("Realized PnL is stored per day")
    void dailyPnl() {
        LocalDate today = LocalDate.of(2024, 3, 1);

        assertThat(store.loadRealizedPnl(today)).isEmpty();

        store.saveRealizedPnl(today, -12.5);
        store.saveRealizedPnl(today, -20.0);
        store.saveRealizedPnl(today.minusDays(1), 40.0);

        assertThat(store.loadRealizedPnl(today)).hasValue(-20.0);
        assertThat(store.loadRealizedPnl(today.minusDays(1))).hasValue(40.0);
    }

    @Test
    @DisplayName("Peak equity keeps its latest value across a reopen")
    void peakEquity() {
        assertThat(store.loadPeakEquity()).isEmpty();

        store.savePeakEquity(10_000.0);
        store.savePeakEquity(12_500.0);
        store.close();
        store = new EngineStateStore(tempDir.resolve("state.db").toString(), ObjectMappers.create());

        assertThat(store.loadPeakEquity()).hasValue(12_500.0);
    }

    @Test
    @DisplayName("An empty database loads nothing")
    void emptyStore() {
        assertThat(store.loadAll()).isEmpty();
    }
}
