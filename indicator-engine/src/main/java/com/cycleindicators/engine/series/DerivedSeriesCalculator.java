package com.cycleindicators.engine.series;

import com.cycleindicators.common.model.TimeframeDataset;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attaches the derived series every roster indicator may ask for to a freshly fetched
 * {@link TimeframeDataset}. Each series is aligned with the bars; warm-up positions are NaN.
 *
 * <pre>
 *   rsi                                   14, Wilder smoothing
 *   macd, macd_signal, macd_histogram     EMA 12 / 26, signal 9
 *   bb_upper, bb_middle, bb_lower, bb_width   20 bars, 2 sample std, width = upper − lower
 *   atr                                   14
 *   supertrend, supertrend_trend          ATR 10, multiplier 3, trend +1 / −1
 *   volume_sma, volume_ratio              20 bars
 * </pre>
 */
@Component
public class DerivedSeriesCalculator {

    public static final String RSI              = "rsi";
    public static final String MACD             = "macd";
    public static final String MACD_SIGNAL      = "macd_signal";
    public static final String MACD_HISTOGRAM   = "macd_histogram";
    public static final String BB_UPPER         = "bb_upper";
    public static final String BB_MIDDLE        = "bb_middle";
    public static final String BB_LOWER         = "bb_lower";
    public static final String BB_WIDTH         = "bb_width";
    public static final String ATR              = "atr";
    public static final String SUPERTREND       = "supertrend";
    public static final String SUPERTREND_TREND = "supertrend_trend";
    public static final String VOLUME_SMA       = "volume_sma";
    public static final String VOLUME_RATIO     = "volume_ratio";

    private static final int RSI_PERIOD        = 14;
    private static final int MACD_FAST         = 12;
    private static final int MACD_SLOW         = 26;
    private static final int MACD_SIGNAL_SPAN  = 9;
    private static final int BB_PERIOD         = 20;
    private static final double BB_STD_DEV     = 2.0;
    private static final int ATR_PERIOD        = 14;
    private static final int SUPERTREND_PERIOD = 10;
    private static final double SUPERTREND_MULTIPLIER = 3.0;
    private static final int VOLUME_PERIOD     = 20;

    public TimeframeDataset enrich(TimeframeDataset dataset) {
        return dataset.withDerivedSeries(compute(dataset));
    }

    public Map<String, List<Double>> compute(TimeframeDataset dataset) {
        List<Double> closes  = dataset.closes();
        List<Double> highs   = dataset.highs();
        List<Double> lows    = dataset.lows();
        List<Double> volumes = dataset.volumes();

        Map<String, List<Double>> series = new LinkedHashMap<>();
        series.put(RSI, SeriesMath.rsi(closes, RSI_PERIOD));
        putMacd(series, closes);
        putBollinger(series, closes);
        series.put(ATR, SeriesMath.atr(highs, lows, closes, ATR_PERIOD));
        putSupertrend(series, highs, lows, closes);
        putVolume(series, volumes);
        return series;
    }

    private static void putMacd(Map<String, List<Double>> series, List<Double> closes) {
        List<Double> fast = SeriesMath.ema(closes, MACD_FAST);
        List<Double> slow = SeriesMath.ema(closes, MACD_SLOW);
        List<Double> macd = new ArrayList<>(closes.size());
        for (int i = 0; i < closes.size(); i++) {
            macd.add(fast.get(i) - slow.get(i));
        }
        List<Double> signal = SeriesMath.ema(macd, MACD_SIGNAL_SPAN);
        List<Double> histogram = new ArrayList<>(closes.size());
        for (int i = 0; i < closes.size(); i++) {
            histogram.add(macd.get(i) - signal.get(i));
        }
        series.put(MACD, macd);
        series.put(MACD_SIGNAL, signal);
        series.put(MACD_HISTOGRAM, histogram);
    }

    private static void putBollinger(Map<String, List<Double>> series, List<Double> closes) {
        List<Double> middle = SeriesMath.rollingMean(closes, BB_PERIOD);
        List<Double> std    = SeriesMath.rollingStd(closes, BB_PERIOD);
        List<Double> upper  = new ArrayList<>(closes.size());
        List<Double> lower  = new ArrayList<>(closes.size());
        List<Double> width  = new ArrayList<>(closes.size());
        for (int i = 0; i < closes.size(); i++) {
            double u = middle.get(i) + std.get(i) * BB_STD_DEV;
            double l = middle.get(i) - std.get(i) * BB_STD_DEV;
            upper.add(u);
            lower.add(l);
            width.add(u - l);
        }
        series.put(BB_UPPER, upper);
        series.put(BB_MIDDLE, middle);
        series.put(BB_LOWER, lower);
        series.put(BB_WIDTH, width);
    }

    /**
     * Band flip rule: a close at or below the previous lower band turns the trend down and
     * the line follows the upper band; a close at or above the previous upper band turns it
     * up and the line follows the lower band; otherwise both carry forward. NaN until the
     * first flip.
     */
    private static void putSupertrend(Map<String, List<Double>> series,
                                      List<Double> highs, List<Double> lows, List<Double> closes) {
        int n = closes.size();
        List<Double> atr = SeriesMath.atr(highs, lows, closes, SUPERTREND_PERIOD);
        List<Double> upperBand = new ArrayList<>(n);
        List<Double> lowerBand = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double hl2 = (highs.get(i) + lows.get(i)) / 2.0;
            upperBand.add(hl2 + SUPERTREND_MULTIPLIER * atr.get(i));
            lowerBand.add(hl2 - SUPERTREND_MULTIPLIER * atr.get(i));
        }

        List<Double> line  = SeriesMath.nanSeries(n);
        List<Double> trend = SeriesMath.nanSeries(n);
        for (int i = 1; i < n; i++) {
            double close = closes.get(i);
            if (close <= lowerBand.get(i - 1)) {
                line.set(i, upperBand.get(i));
                trend.set(i, -1.0);
            } else if (close >= upperBand.get(i - 1)) {
                line.set(i, lowerBand.get(i));
                trend.set(i, 1.0);
            } else {
                line.set(i, line.get(i - 1));
                trend.set(i, trend.get(i - 1));
            }
        }
        series.put(SUPERTREND, line);
        series.put(SUPERTREND_TREND, trend);
    }

    private static void putVolume(Map<String, List<Double>> series, List<Double> volumes) {
        List<Double> sma = SeriesMath.rollingMean(volumes, VOLUME_PERIOD);
        List<Double> ratio = new ArrayList<>(volumes.size());
        for (int i = 0; i < volumes.size(); i++) {
            double avg = sma.get(i);
            ratio.add(avg == 0 ? Double.NaN : volumes.get(i) / avg);
        }
        series.put(VOLUME_SMA, sma);
        series.put(VOLUME_RATIO, ratio);
    }
}
