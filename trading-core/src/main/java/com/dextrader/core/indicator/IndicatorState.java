package com.dextrader.core.indicator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Latest indicator readings of one strategy instance, as of the last evaluated candle.
 * Built fresh on each evaluation; earlier snapshots are never modified.
 */
public record IndicatorState(String strategyId, Instant asOf, Map<String, Double> values) {

    public IndicatorState {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public double get(String name) {
        return values.getOrDefault(name, Double.NaN);
    }

    public static Builder builder(String strategyId, Instant asOf) {
        return new Builder(strategyId, asOf);
    }

    public static final class Builder {
        private final String strategyId;
        private final Instant asOf;
        private final Map<String, Double> values = new LinkedHashMap<>();

        private Builder(String strategyId, Instant asOf) {
            this.strategyId = strategyId;
            this.asOf = asOf;
        }

        public Builder put(String name, double value) {
            values.put(name, value);
            return this;
        }

        public IndicatorState build() {
            return new IndicatorState(strategyId, asOf, values);
        }
    }
}
