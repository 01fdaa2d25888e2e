package com.dextrader.core.model;

import java.time.Instant;

/**
 * Directional opinion produced by a strategy from closed candles.
 * {@code evaluatedAt} is the open time of the last candle evaluated, never wall-clock time,
 * so identical candle input always yields an identical signal.
 *
 * @param levelPrice price level the signal refers to (grid level, breakout level), NaN when not applicable
 * @param levelAnchor open time of the candle the level set was derived from, null when not applicable
 * @param stopDistance suggested protective stop distance in price units, NaN when not applicable
 */
public record Signal(
    Direction direction,
    double strength,
    String sourceStrategyId,
    Instant evaluatedAt,
    String reason,
    double levelPrice,
    Instant levelAnchor,
    double stopDistance
) {
    public Signal {
        if (strength < 0.0 || strength > 1.0 || Double.isNaN(strength)) {
            throw new IllegalArgumentException("Signal strength must be in [0,1]: " + strength);
        }
    }

    public static Signal flat(String strategyId, Instant evaluatedAt, String reason) {
        return new Signal(Direction.FLAT, 0.0, strategyId, evaluatedAt, reason, Double.NaN, null, Double.NaN);
    }

    public static Signal of(Direction direction, double strength, String strategyId, Instant evaluatedAt, String reason) {
        return new Signal(direction, strength, strategyId, evaluatedAt, reason, Double.NaN, null, Double.NaN);
    }

    public Signal withLevel(double price, Instant anchor) {
        return new Signal(direction, strength, sourceStrategyId, evaluatedAt, reason, price, anchor, stopDistance);
    }

    public Signal withStopDistance(double distance) {
        return new Signal(direction, strength, sourceStrategyId, evaluatedAt, reason, levelPrice, levelAnchor, distance);
    }

    public boolean hasLevel() {
        return !Double.isNaN(levelPrice);
    }

    public boolean hasStopDistance() {
        return !Double.isNaN(stopDistance) && stopDistance > 0.0;
    }

    public boolean isFlat() {
        return direction == Direction.FLAT;
    }
}
