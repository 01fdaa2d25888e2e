package com.dextrader.core.indicator;

import com.dextrader.core.model.Candle;

import java.util.Arrays;
import java.util.List;

/**
 * Technical indicator series. Every method returns a fresh array aligned with its input;
 * positions without enough history hold {@link Double#NaN}. Only trailing data is ever used.
 */
public final class Indicators {

    private Indicators() {
    }

    /**
     * Simple moving average.
     */
    public static double[] sma(double[] values, int period) {
        requirePeriod(period);
        double[] out = nanArray(values.length);
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= period) {
                sum -= values[i - period];
            }
            if (i >= period - 1) {
                out[i] = sum / period;
            }
        }
        return out;
    }

    /**
     * Exponential moving average with {@code k = 2 / (period + 1)}, seeded with the SMA of the first
     * {@code period} defined values. Leading NaNs in the input are skipped.
     */
    public static double[] ema(double[] values, int period) {
        requirePeriod(period);
        double[] out = nanArray(values.length);
        int first = firstDefined(values);
        if (first < 0 || values.length - first < period) {
            return out;
        }
        int seedIndex = first + period - 1;
        double seed = 0.0;
        for (int i = first; i <= seedIndex; i++) {
            seed += values[i];
        }
        double k = 2.0 / (period + 1);
        double ema = seed / period;
        out[seedIndex] = ema;
        for (int i = seedIndex + 1; i < values.length; i++) {
            ema = values[i] * k + ema * (1.0 - k);
            out[i] = ema;
        }
        return out;
    }

    /**
     * Relative Strength Index with Wilder smoothing. The first value sits at index {@code period}.
     */
    public static double[] rsi(double[] closes, int period) {
        requirePeriod(period);
        double[] out = nanArray(closes.length);
        if (closes.length <= period) {
            return out;
        }
        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = closes[i] - closes[i - 1];
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss -= change;
            }
        }
        avgGain /= period;
        avgLoss /= period;
        out[period] = rsiValue(avgGain, avgLoss);

        for (int i = period + 1; i < closes.length; i++) {
            double change = closes[i] - closes[i - 1];
            double gain = change > 0 ? change : 0.0;
            double loss = change < 0 ? -change : 0.0;
            avgGain = (avgGain * (period - 1) + gain) / period;
            avgLoss = (avgLoss * (period - 1) + loss) / period;
            out[i] = rsiValue(avgGain, avgLoss);
        }
        return out;
    }

    private static double rsiValue(double avgGain, double avgLoss) {
        if (avgLoss == 0.0) {
            return avgGain == 0.0 ? 50.0 : 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    /**
     * Rolling sample standard deviation (n - 1 denominator). A period of one has no spread and yields 0.
     */
    public static double[] stdDev(double[] values, int period) {
        requirePeriod(period);
        double[] out = nanArray(values.length);
        double[] mean = sma(values, period);
        for (int i = period - 1; i < values.length; i++) {
            double sumSq = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                double diff = values[j] - mean[i];
                sumSq += diff * diff;
            }
            out[i] = period == 1 ? 0.0 : Math.sqrt(sumSq / (period - 1));
        }
        return out;
    }

    public static Bands bollinger(double[] closes, int period, double stdDevMultiplier) {
        double[] middle = sma(closes, period);
        double[] deviation = stdDev(closes, period);
        double[] upper = nanArray(closes.length);
        double[] lower = nanArray(closes.length);
        for (int i = 0; i < closes.length; i++) {
            if (!Double.isNaN(middle[i])) {
                upper[i] = middle[i] + deviation[i] * stdDevMultiplier;
                lower[i] = middle[i] - deviation[i] * stdDevMultiplier;
            }
        }
        return new Bands(middle, upper, lower);
    }

    public static Macd macd(double[] closes, int fastPeriod, int slowPeriod, int signalPeriod) {
        double[] fast = ema(closes, fastPeriod);
        double[] slow = ema(closes, slowPeriod);
        double[] line = nanArray(closes.length);
        for (int i = 0; i < closes.length; i++) {
            if (!Double.isNaN(fast[i]) && !Double.isNaN(slow[i])) {
                line[i] = fast[i] - slow[i];
            }
        }
        double[] signal = ema(line, signalPeriod);
        double[] histogram = nanArray(closes.length);
        for (int i = 0; i < closes.length; i++) {
            if (!Double.isNaN(signal[i])) {
                histogram[i] = line[i] - signal[i];
            }
        }
        return new Macd(line, signal, histogram);
    }

    /**
     * True range; the first candle has no previous close and uses high - low.
     */
    public static double[] trueRange(List<Candle> candles) {
        double[] out = new double[candles.size()];
        for (int i = 0; i < candles.size(); i++) {
            Candle c = candles.get(i);
            double range = c.high() - c.low();
            if (i > 0) {
                double prevClose = candles.get(i - 1).close();
                range = Math.max(range, Math.max(Math.abs(c.high() - prevClose), Math.abs(c.low() - prevClose)));
            }
            out[i] = range;
        }
        return out;
    }

    /**
     * Average true range as the simple mean of the last {@code period} true ranges.
     */
    public static double[] atr(List<Candle> candles, int period) {
        return sma(trueRange(candles), period);
    }

    /** Highest value in {@code values[from, to)}. */
    public static double highest(double[] values, int from, int to) {
        double max = Double.NEGATIVE_INFINITY;
        for (int i = Math.max(0, from); i < to; i++) {
            max = Math.max(max, values[i]);
        }
        return max;
    }

    /** Lowest value in {@code values[from, to)}. */
    public static double lowest(double[] values, int from, int to) {
        double min = Double.POSITIVE_INFINITY;
        for (int i = Math.max(0, from); i < to; i++) {
            min = Math.min(min, values[i]);
        }
        return min;
    }

    /** Mean of {@code values[from, to)}. */
    public static double mean(double[] values, int from, int to) {
        int start = Math.max(0, from);
        if (to <= start) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (int i = start; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - start);
    }

    public static double last(double[] values) {
        return values.length == 0 ? Double.NaN : values[values.length - 1];
    }

    public static double previous(double[] values) {
        return values.length < 2 ? Double.NaN : values[values.length - 2];
    }

    private static int firstDefined(double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (!Double.isNaN(values[i])) {
                return i;
            }
        }
        return -1;
    }

    private static double[] nanArray(int length) {
        double[] out = new double[length];
        Arrays.fill(out, Double.NaN);
        return out;
    }

    private static void requirePeriod(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
    }

    public record Bands(double[] middle, double[] upper, double[] lower) {
        /** (upper - lower) / middle at {@code index}. */
        public double width(int index) {
            return (upper[index] - lower[index]) / middle[index];
        }
    }

    public record Macd(double[] line, double[] signal, double[] histogram) {
    }
}
