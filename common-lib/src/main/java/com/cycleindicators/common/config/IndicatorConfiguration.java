package com.cycleindicators.common.config;

import com.cycleindicators.common.exception.IndicatorConfigurationException;
import com.cycleindicators.common.model.Bounds;
import com.cycleindicators.common.model.IndicatorSpec;
import com.cycleindicators.common.model.Side;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup of normalization bounds and weights, keyed by side and indicator name.
 *
 * <p>Built once at start-up (see {@link IndicatorConfigurationLoader}) and handed to every
 * indicator and composer through its constructor. Instances are immutable and thread-safe.
 */
public final class IndicatorConfiguration {

    private final Map<Side, Map<String, IndicatorSpec>> specs;

    private IndicatorConfiguration(Map<Side, Map<String, IndicatorSpec>> specs) {
        this.specs = specs;
    }

    public static IndicatorConfiguration of(Collection<IndicatorSpec> specs) {
        Map<Side, Map<String, IndicatorSpec>> bySide = new EnumMap<>(Side.class);
        for (Side side : Side.values()) {
            bySide.put(side, new LinkedHashMap<>());
        }
        for (IndicatorSpec spec : specs) {
            IndicatorSpec previous = bySide.get(spec.side()).put(spec.name(), spec);
            if (previous != null) {
                throw new IndicatorConfigurationException(
                    "Duplicate indicator '" + spec.name() + "' for side " + spec.side().key());
            }
        }
        Map<Side, Map<String, IndicatorSpec>> frozen = new EnumMap<>(Side.class);
        bySide.forEach((side, map) -> frozen.put(side, Collections.unmodifiableMap(map)));
        return new IndicatorConfiguration(Collections.unmodifiableMap(frozen));
    }

    public Optional<IndicatorSpec> spec(Side side, String name) {
        return Optional.ofNullable(specs.get(side).get(name));
    }

    public Optional<Bounds> bounds(Side side, String name) {
        return spec(side, name).map(IndicatorSpec::bounds);
    }

    public Optional<Double> weight(Side side, String name) {
        return spec(side, name).map(IndicatorSpec::weight);
    }

    public List<IndicatorSpec> specs(Side side) {
        return List.copyOf(specs.get(side).values());
    }

    public int size() {
        return specs.values().stream().mapToInt(Map::size).sum();
    }
}
