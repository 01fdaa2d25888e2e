package com.dextrader.core.orchestrator;

import com.dextrader.core.model.PairKey;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

class InMemoryStateSink implements EngineStateSink {
    final Map<PairKey, PairSnapshot> snapshots = new ConcurrentHashMap<>();
    final Map<LocalDate, Double> realized = new ConcurrentHashMap<>();
    volatile Double peakEquity;

    @Override
    public void save(PairSnapshot snapshot) {
        snapshots.put(snapshot.pair(), snapshot);
    }

    @Override
    public Map<PairKey, PairSnapshot> loadAll() {
        return new HashMap<>(snapshots);
    }

    @Override
    public void saveRealizedPnl(LocalDate day, double value) {
        realized.put(day, value);
    }

    @Override
    public OptionalDouble loadRealizedPnl(LocalDate day) {
        Double value = realized.get(day);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    @Override
    public void savePeakEquity(double peak) {
        peakEquity = peak;
    }

    @Override
    public OptionalDouble loadPeakEquity() {
        Double value = peakEquity;
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}
