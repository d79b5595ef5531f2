package com.cycleindicators.common.indicator;

import com.cycleindicators.common.config.IndicatorConfiguration;
import com.cycleindicators.common.exception.DataUnavailableException;
import com.cycleindicators.common.model.Bounds;
import com.cycleindicators.common.model.IndicatorResult;
import com.cycleindicators.common.model.IndicatorSpec;
import com.cycleindicators.common.model.Side;
import com.cycleindicators.common.scoring.Normalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Shared plumbing for concrete indicators: configuration lookup, normalization and
 * failure containment. Subclasses implement only {@link #calculate(DatasetReader)}.
 *
 * <p>Failure mapping in {@link #fullResult()}:
 * <pre>
 *   no configuration entry        → failed, weight 0, no bounds
 *   calculate() returns empty     → failed, no error text
 *   calculate() throws            → failed, exception message as error
 *   degenerate bounds             → raw value kept, no normalized score
 *   otherwise                     → valid
 * </pre>
 * Weight and bounds are reported on every failure that has a configuration entry.
 */
public abstract class AbstractIndicator implements Indicator {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final IndicatorConfiguration configuration;
    private final TimeframeDataSource dataSource;
    private final Clock clock;

    protected AbstractIndicator(IndicatorConfiguration configuration, TimeframeDataSource dataSource, Clock clock) {
        this.configuration = configuration;
        this.dataSource    = dataSource;
        this.clock         = clock;
    }

    /**
     * The formula. Pure function of the datasets read through {@code data}.
     * May throw; {@link DataUnavailableException} signals missing or short input.
     */
    protected abstract OptionalDouble calculate(DatasetReader data);

    @Override
    public final OptionalDouble rawValue() {
        if (spec().isEmpty()) {
            log.warn("Indicator {} has no {} configuration entry", name(), side().key());
            return OptionalDouble.empty();
        }
        try {
            return calculate(new DatasetReader(dataSource, name()));
        } catch (DataUnavailableException e) {
            log.warn("{}", e.getMessage());
            return OptionalDouble.empty();
        }
    }

    @Override
    public final IndicatorResult fullResult() {
        Optional<IndicatorSpec> spec = spec();
        if (spec.isEmpty()) {
            String error = "No bounds/weight configured for " + side().key() + " indicator '" + name() + "'";
            log.error("INDICATOR_FAILED name={} side={} error={}", name(), side().key(), error);
            return IndicatorResult.failed(name(), side(), 0.0, null, clock.instant(), error);
        }

        double weight = spec.get().weight();
        Bounds bounds = spec.get().bounds();
        DatasetReader reader = new DatasetReader(dataSource, name());

        OptionalDouble raw;
        try {
            raw = calculate(reader);
        } catch (RuntimeException e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("INDICATOR_FAILED name={} side={} error={}", name(), side().key(), error, e);
            return IndicatorResult.failed(name(), side(), weight, bounds, timestamp(reader), error);
        }

        Instant timestamp = timestamp(reader);
        if (raw.isEmpty()) {
            log.warn("INDICATOR_FAILED name={} side={} error=raw value unavailable", name(), side().key());
            return IndicatorResult.failed(name(), side(), weight, bounds, timestamp, null);
        }

        double rawValue = raw.getAsDouble();
        if (!Double.isFinite(rawValue)) {
            String error = "Non-finite raw value: " + rawValue;
            log.warn("INDICATOR_FAILED name={} side={} error={}", name(), side().key(), error);
            return IndicatorResult.failed(name(), side(), weight, bounds, timestamp, error);
        }

        OptionalDouble normalized = Normalizer.normalize(rawValue, bounds);
        if (normalized.isEmpty()) {
            String error = "Degenerate bounds lower == upper == " + bounds.lower();
            log.warn("INDICATOR_FAILED name={} side={} raw={} error={}", name(), side().key(), rawValue, error);
            return IndicatorResult.unnormalized(name(), side(), rawValue, weight, bounds, timestamp, error);
        }

        log.info("INDICATOR_COMPUTED name={} side={} raw={} normalized={} weight={}",
                 name(), side().key(), String.format("%.4f", rawValue),
                 String.format("%.4f", normalized.getAsDouble()), weight);
        return IndicatorResult.valid(name(), side(), rawValue, normalized.getAsDouble(), weight, bounds, timestamp);
    }

    /** Configured weight, or 0 when the indicator has no configuration entry. */
    public double weight() {
        return spec().map(IndicatorSpec::weight).orElse(0.0);
    }

    /** Configured bounds, or {@code null} when the indicator has no configuration entry. */
    public Bounds bounds() {
        return spec().map(IndicatorSpec::bounds).orElse(null);
    }

    protected Clock clock() {
        return clock;
    }

    private Optional<IndicatorSpec> spec() {
        return configuration.spec(side(), name());
    }

    private Instant timestamp(DatasetReader reader) {
        return reader.freshest().orElseGet(clock::instant);
    }
}
