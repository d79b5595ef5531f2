package com.cycleindicators.common.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Immutable snapshot of market data for one timeframe key ("1D", "1W", "1M", "3D", "5D").
 *
 * <p>{@code bars} are ordered oldest → newest. Every entry of {@code derivedSeries}
 * (moving averages, oscillators, volume ratios ...) is aligned index-for-index with
 * {@code bars}; positions where a window has not filled yet hold {@link Double#NaN}.
 *
 * <p>A dataset is never mutated after construction. A refresh produces a new instance.
 */
public record TimeframeDataset(
    String timeframe,
    List<OhlcvBar> bars,
    Map<String, List<Double>> derivedSeries,
    Instant asOf
) {

    public TimeframeDataset {
        Objects.requireNonNull(timeframe, "timeframe");
        Objects.requireNonNull(asOf, "asOf");
        bars = bars == null ? List.of() : List.copyOf(bars);

        Map<String, List<Double>> copy = new LinkedHashMap<>();
        if (derivedSeries != null) {
            for (Map.Entry<String, List<Double>> e : derivedSeries.entrySet()) {
                List<Double> series = e.getValue() == null ? List.of() : e.getValue();
                if (series.size() != bars.size()) {
                    throw new IllegalArgumentException(String.format(
                        "Derived series '%s' has %d values but dataset %s has %d bars",
                        e.getKey(), series.size(), timeframe, bars.size()));
                }
                copy.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(series)));
            }
        }
        derivedSeries = Collections.unmodifiableMap(copy);
    }

    public static TimeframeDataset of(String timeframe, List<OhlcvBar> bars, Instant asOf) {
        return new TimeframeDataset(timeframe, bars, Map.of(), asOf);
    }

    /** Returns a copy of this dataset with additional derived series merged in. */
    public TimeframeDataset withDerivedSeries(Map<String, List<Double>> extra) {
        Map<String, List<Double>> merged = new LinkedHashMap<>(derivedSeries);
        merged.putAll(extra);
        return new TimeframeDataset(timeframe, bars, merged, asOf);
    }

    public int size() { return bars.size(); }

    public boolean isEmpty() { return bars.isEmpty(); }

    public OhlcvBar latest() {
        if (bars.isEmpty()) {
            throw new IllegalStateException("Dataset " + timeframe + " has no bars");
        }
        return bars.get(bars.size() - 1);
    }

    public Optional<List<Double>> series(String name) {
        return Optional.ofNullable(derivedSeries.get(name));
    }

    public boolean hasSeries(String name) {
        return derivedSeries.containsKey(name);
    }

    public List<Double> highs()   { return column(OhlcvBar::high); }
    public List<Double> lows()    { return column(OhlcvBar::low); }
    public List<Double> closes()  { return column(OhlcvBar::close); }
    public List<Double> volumes() { return column(OhlcvBar::volume); }

    private List<Double> column(ToDoubleFunction<OhlcvBar> getter) {
        List<Double> values = new ArrayList<>(bars.size());
        for (OhlcvBar bar : bars) {
            values.add(getter.applyAsDouble(bar));
        }
        return Collections.unmodifiableList(values);
    }
}
