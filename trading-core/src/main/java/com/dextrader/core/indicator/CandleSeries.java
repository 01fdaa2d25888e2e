package com.dextrader.core.indicator;

import com.dextrader.core.error.InvalidCandleSeriesException;
import com.dextrader.core.model.Candle;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Precondition checks and column extraction for candle sequences.
 * Indicator math assumes strictly increasing open times with no gaps.
 */
public final class CandleSeries {

    private CandleSeries() {
    }

    /**
     * Verifies ordering and spacing. When {@code interval} is null the spacing of the first two
     * candles is used as the expected interval.
     *
     * @throws InvalidCandleSeriesException on out-of-order, duplicate or missing candles
     */
    public static void requireContiguous(List<Candle> candles, Duration interval) {
        if (candles.size() < 2) {
            return;
        }
        Duration expected = interval != null
            ? interval
            : Duration.between(candles.get(0).openTime(), candles.get(1).openTime());
        if (expected.isZero() || expected.isNegative()) {
            throw new InvalidCandleSeriesException("Candles are not in increasing open-time order");
        }
        for (int i = 1; i < candles.size(); i++) {
            Instant previous = candles.get(i - 1).openTime();
            Instant current = candles.get(i).openTime();
            if (!current.isAfter(previous)) {
                throw new InvalidCandleSeriesException(String.format(
                    "Candle %d at %s is not after %s", i, current, previous));
            }
            Duration step = Duration.between(previous, current);
            if (!step.equals(expected)) {
                throw new InvalidCandleSeriesException(String.format(
                    "Gap between %s and %s: expected %s, found %s", previous, current, expected, step));
            }
        }
    }

    public static double[] closes(List<Candle> candles) {
        return candles.stream().mapToDouble(Candle::close).toArray();
    }

    public static double[] highs(List<Candle> candles) {
        return candles.stream().mapToDouble(Candle::high).toArray();
    }

    public static double[] lows(List<Candle> candles) {
        return candles.stream().mapToDouble(Candle::low).toArray();
    }

    public static double[] volumes(List<Candle> candles) {
        return candles.stream().mapToDouble(Candle::volume).toArray();
    }

    public static Candle last(List<Candle> candles) {
        return candles.get(candles.size() - 1);
    }
}
