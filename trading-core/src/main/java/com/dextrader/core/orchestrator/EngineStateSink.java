package com.dextrader.core.orchestrator;

import com.dextrader.core.model.PairKey;

import java.time.LocalDate;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Persistence port for crash recovery. The last saved snapshot per pair is restored at start-up,
 * before the first reconciliation corrects it against the exchange.
 */
public interface EngineStateSink {

    EngineStateSink NONE = new EngineStateSink() {
        @Override
        public void save(PairSnapshot snapshot) {
        }

        @Override
        public Map<PairKey, PairSnapshot> loadAll() {
            return Map.of();
        }

        @Override
        public void saveRealizedPnl(LocalDate day, double realized) {
        }

        @Override
        public OptionalDouble loadRealizedPnl(LocalDate day) {
            return OptionalDouble.empty();
        }

        @Override
        public void savePeakEquity(double peak) {
        }

        @Override
        public OptionalDouble loadPeakEquity() {
            return OptionalDouble.empty();
        }
    };

    /** Overwrites the stored snapshot for the snapshot's pair. */
    void save(PairSnapshot snapshot);

    Map<PairKey, PairSnapshot> loadAll();

    /** Realized PnL of a UTC day, kept so the daily loss limit survives a restart. */
    void saveRealizedPnl(LocalDate day, double realized);

    OptionalDouble loadRealizedPnl(LocalDate day);

    /** Highest equity seen, so drawdown keeps its reference point across restarts. */
    void savePeakEquity(double peak);

    OptionalDouble loadPeakEquity();
}
