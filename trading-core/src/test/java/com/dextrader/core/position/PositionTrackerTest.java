package com.dextrader.core.position;

import com.dextrader.core.exchange.ExchangePosition;
import com.dextrader.core.execution.ReconciliationMismatch;
import com.dextrader.core.model.FillEvent;
import com.dextrader.core.model.Position;
import com.dextrader.core.model.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Position tracker")
class PositionTrackerTest {
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private PositionTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new PositionTracker();
    }

    private static FillEvent fill(Side side, double size, double price) {
        return new FillEvent("c-1", "BTC", side, size, price, NOW);
    }

    @Nested
    @DisplayName("Fills")
    class Fills {

        @Test
        @DisplayName("Adding to a position averages the entry price")
        void averagesEntry() {
            tracker.applyFill(fill(Side.BUY, 1, 100));
            tracker.applyFill(fill(Side.BUY, 1, 110));

            Position position = tracker.get("BTC");
            assertThat(position.netSize()).isEqualTo(2.0);
            assertThat(position.entryPrice()).isCloseTo(105.0, within(1e-9));
        }

        @Test
        @DisplayName("Reducing realizes PnL against the entry price")
        void realizesOnReduce() {
            tracker.applyFill(fill(Side.BUY, 2, 100));
            tracker.applyFill(fill(Side.SELL, 1, 120));

            Position position = tracker.get("BTC");
            assertThat(position.netSize()).isEqualTo(1.0);
            assertThat(position.entryPrice()).isEqualTo(100.0);
            assertThat(position.realizedPnl()).isCloseTo(20.0, within(1e-9));
            assertThat(tracker.realizedPnlToday(NOW)).isCloseTo(20.0, within(1e-9));
        }

        @Test
        @DisplayName("A fill larger than the position flips it at the fill price")
        void flips() {
            tracker.applyFill(fill(Side.SELL, 1, 100));
            tracker.applyFill(fill(Side.BUY, 3, 90));

            Position position = tracker.get("BTC");
            assertThat(position.netSize()).isEqualTo(2.0);
            assertThat(position.entryPrice()).isEqualTo(90.0);
            assertThat(position.realizedPnl()).isCloseTo(10.0, within(1e-9));
        }

        @Test
        @DisplayName("Unrealized PnL follows the mark price")
        void unrealizedFromMark() {
            tracker.applyFill(fill(Side.BUY, 2, 100));
            tracker.updateMark("BTC", 95);

            assertThat(tracker.get("BTC").unrealizedPnl()).isCloseTo(-10.0, within(1e-9));
            assertThat(tracker.totalNotional()).isCloseTo(190.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Reconciliation")
    class Reconciliation {

        @Test
        @DisplayName("Exchange positions overwrite local ones and mismatches are reported")
        void overwrites() {
            tracker.applyFill(fill(Side.BUY, 1, 100));

            List<ReconciliationMismatch> mismatches = tracker.reconcile(
                List.of(new ExchangePosition("BTC", 1.5, 102, 0, 103)), NOW);

            assertThat(mismatches).extracting(ReconciliationMismatch::kind)
                .containsExactly(ReconciliationMismatch.Kind.POSITION_SIZE);
            assertThat(tracker.get("BTC").netSize()).isEqualTo(1.5);
            assertThat(tracker.get("BTC").reconciledAt()).isEqualTo(NOW);
            assertThat(tracker.lastReconciledAt()).contains(NOW);
        }

        @Test
        @DisplayName("Symbols missing on the exchange become flat")
        void missingBecomesFlat() {
            tracker.applyFill(fill(Side.BUY, 1, 100));

            List<ReconciliationMismatch> mismatches = tracker.reconcile(List.of(), NOW);

            assertThat(mismatches).extracting(ReconciliationMismatch::kind)
                .containsExactly(ReconciliationMismatch.Kind.POSITION_MISSING);
            assertThat(tracker.get("BTC").isFlat()).isTrue();
        }

        @Test
        @DisplayName("Unknown exchange positions are adopted")
        void unknownAdopted() {
            List<ReconciliationMismatch> mismatches = tracker.reconcile(
                List.of(new ExchangePosition("ETH", -3, 2000, 0, 2000)), NOW);

            assertThat(mismatches).extracting(ReconciliationMismatch::kind)
                .containsExactly(ReconciliationMismatch.Kind.POSITION_UNKNOWN);
            assertThat(tracker.get("ETH").netSize()).isEqualTo(-3.0);
        }

        @Test
        @DisplayName("Matching positions produce no mismatch")
        void matching() {
            tracker.applyFill(fill(Side.BUY, 1, 100));

            assertThat(tracker.reconcile(List.of(new ExchangePosition("BTC", 1, 100, 0, 100)), NOW)).isEmpty();
        }

        @Test
        @DisplayName("Unsettled symbols keep their local position")
        void unsettledUntouched() {
            tracker.applyFill(fill(Side.BUY, 1, 100));

            List<ReconciliationMismatch> mismatches = tracker.reconcile(
                List.of(new ExchangePosition("ETH", 2, 2000, 0, 2000)), NOW, Set.of("BTC"));

            assertThat(mismatches).extracting(ReconciliationMismatch::symbol).containsExactly("ETH");
            assertThat(tracker.get("BTC").netSize()).isEqualTo(1.0);
            assertThat(tracker.get("ETH").netSize()).isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("Daily realized PnL")
    class DailyPnl {

        @Test
        @DisplayName("Resets at the UTC day boundary")
        void resetsOnNewDay() {
            tracker.applyFill(fill(Side.BUY, 1, 100));
            tracker.applyFill(fill(Side.SELL, 1, 90));

            assertThat(tracker.realizedPnlToday(NOW)).isCloseTo(-10.0, within(1e-9));
            assertThat(tracker.realizedPnlToday(Instant.parse("2024-03-02T00:00:01Z"))).isZero();
        }

        @Test
        @DisplayName("Restored value is the base for later fills")
        void restore() {
            tracker.restoreRealizedToday(-50, NOW);
            tracker.applyFill(fill(Side.BUY, 1, 100));
            tracker.applyFill(fill(Side.SELL, 1, 95));

            assertThat(tracker.realizedPnlToday(NOW)).isCloseTo(-55.0, within(1e-9));
        }
    }
}
