package com.cycleindicators.engine.series;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pure calculation utilities over price and volume series.
 * Input series are oldest-first (last index = most recent bar). Rolling outputs are
 * aligned index-for-index with their input; positions before the window fills are NaN.
 */
public final class SeriesMath {

    private SeriesMath() {}

    // ── Scalars ──────────────────────────────────────────────────────────────

    public static double mean(List<Double> values) {
        if (values == null || values.isEmpty()) return Double.NaN;
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.size();
    }

    /** Sample standard deviation (divide by n − 1); NaN below two values. */
    public static double sampleStd(List<Double> values) {
        if (values == null || values.size() < 2) return Double.NaN;
        double mean = mean(values);
        double variance = 0;
        for (double v : values) {
            double diff = v - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / (values.size() - 1));
    }

    /** Population standard deviation (divide by n); NaN for an empty list. */
    public static double populationStd(List<Double> values) {
        if (values == null || values.isEmpty()) return Double.NaN;
        double mean = mean(values);
        double variance = 0;
        for (double v : values) {
            double diff = v - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / values.size());
    }

    public static double max(List<Double> values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) max = Math.max(max, v);
        return max;
    }

    public static double min(List<Double> values) {
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) min = Math.min(min, v);
        return min;
    }

    public static double last(List<Double> values) {
        return values.get(values.size() - 1);
    }

    /** Value {@code offset} bars back from the newest; {@code offset == 0} is the newest. */
    public static double back(List<Double> values, int offset) {
        return values.get(values.size() - 1 - offset);
    }

    /** The newest {@code count} values, or the whole series when it is shorter. */
    public static List<Double> tail(List<Double> values, int count) {
        int from = Math.max(0, values.size() - count);
        return values.subList(from, values.size());
    }

    /** Percent change from {@code periods} bars back to the newest; NaN when the series is too short. */
    public static double percentChange(List<Double> values, int periods) {
        if (values.size() <= periods) return Double.NaN;
        double past = back(values, periods);
        return (last(values) - past) / past * 100.0;
    }

    /** Bar-over-bar fractional changes; one fewer value than the input. */
    public static List<Double> returns(List<Double> values) {
        List<Double> out = new ArrayList<>(Math.max(0, values.size() - 1));
        for (int i = 1; i < values.size(); i++) {
            out.add(values.get(i) / values.get(i - 1) - 1.0);
        }
        return out;
    }

    /**
     * Sample std of the newest {@code recent} returns over that of the newest {@code historical};
     * NaN when the longer window has no spread.
     */
    public static double volatilityRatio(List<Double> closes, int recent, int historical) {
        List<Double> returns = returns(tail(closes, historical + 1));
        double longStd = sampleStd(returns);
        if (!(longStd > 0)) return Double.NaN;
        return sampleStd(tail(returns, recent)) / longStd;
    }

    /** Least-squares slope of the values against their index; NaN below two values. */
    public static double slope(List<Double> values) {
        int n = values.size();
        if (n < 2) return Double.NaN;
        double xMean = (n - 1) / 2.0;
        double yMean = mean(values);
        double num = 0;
        double den = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - xMean;
            num += dx * (values.get(i) - yMean);
            den += dx * dx;
        }
        return num / den;
    }

    public static List<Double> finite(List<Double> values) {
        List<Double> out = new ArrayList<>(values.size());
        for (double v : values) {
            if (Double.isFinite(v)) out.add(v);
        }
        return out;
    }

    // ── Rolling series ───────────────────────────────────────────────────────

    public static List<Double> rollingMean(List<Double> values, int period) {
        List<Double> out = nanSeries(values.size());
        if (period <= 0) return out;
        double sum = 0;
        for (int i = 0; i < values.size(); i++) {
            sum += values.get(i);
            if (i >= period) sum -= values.get(i - period);
            if (i >= period - 1) out.set(i, sum / period);
        }
        return out;
    }

    /** Rolling sample standard deviation. */
    public static List<Double> rollingStd(List<Double> values, int period) {
        List<Double> out = nanSeries(values.size());
        for (int i = period - 1; i < values.size(); i++) {
            out.set(i, sampleStd(values.subList(i - period + 1, i + 1)));
        }
        return out;
    }

    /**
     * Recursive EMA seeded with the first value, {@code k = 2 / (span + 1)}.
     * Defined from the first bar onwards.
     */
    public static List<Double> ema(List<Double> values, int span) {
        List<Double> out = nanSeries(values.size());
        if (values.isEmpty()) return out;
        double k = 2.0 / (span + 1);
        double ema = values.get(0);
        out.set(0, ema);
        for (int i = 1; i < values.size(); i++) {
            double v = values.get(i);
            if (Double.isNaN(v)) {
                out.set(i, ema);
                continue;
            }
            ema = Double.isNaN(ema) ? v : v * k + ema * (1 - k);
            out.set(i, ema);
        }
        return out;
    }

    /**
     * RSI with Wilder's smoothing. First value at index {@code period}.
     * A window with no losses reads 100.
     */
    public static List<Double> rsi(List<Double> closes, int period) {
        int n = closes.size();
        List<Double> out = nanSeries(n);
        if (n < period + 1) return out;

        double avgGain = 0;
        double avgLoss = 0;
        for (int i = 1; i <= period; i++) {
            double change = closes.get(i) - closes.get(i - 1);
            if (change > 0) avgGain += change;
            else avgLoss += Math.abs(change);
        }
        avgGain /= period;
        avgLoss /= period;
        out.set(period, rsiValue(avgGain, avgLoss));

        for (int i = period + 1; i < n; i++) {
            double change = closes.get(i) - closes.get(i - 1);
            double gain = Math.max(change, 0);
            double loss = Math.max(-change, 0);
            avgGain = (avgGain * (period - 1) + gain) / period;
            avgLoss = (avgLoss * (period - 1) + loss) / period;
            out.set(i, rsiValue(avgGain, avgLoss));
        }
        return out;
    }

    /** True range per bar; the first bar uses high − low only. */
    public static List<Double> trueRange(List<Double> highs, List<Double> lows, List<Double> closes) {
        List<Double> out = new ArrayList<>(closes.size());
        for (int i = 0; i < closes.size(); i++) {
            double range = highs.get(i) - lows.get(i);
            if (i > 0) {
                double prevClose = closes.get(i - 1);
                range = Math.max(range, Math.max(Math.abs(highs.get(i) - prevClose),
                                                 Math.abs(lows.get(i) - prevClose)));
            }
            out.add(range);
        }
        return out;
    }

    /** Average true range as a simple rolling mean of the true range. */
    public static List<Double> atr(List<Double> highs, List<Double> lows, List<Double> closes, int period) {
        return rollingMean(trueRange(highs, lows, closes), period);
    }

    public static List<Double> nanSeries(int size) {
        return new ArrayList<>(Collections.nCopies(size, Double.NaN));
    }

    private static double rsiValue(double avgGain, double avgLoss) {
        if (avgLoss == 0) return 100.0;
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }
}
