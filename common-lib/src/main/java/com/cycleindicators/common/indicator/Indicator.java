package com.cycleindicators.common.indicator;

import com.cycleindicators.common.model.IndicatorResult;
import com.cycleindicators.common.model.Side;

import java.util.OptionalDouble;

/**
 * One scoring formula over cached market data.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Read-only</b>: never mutate the data source or the configuration</li>
 *   <li><b>Contained</b>: {@link #fullResult()} never throws; failures become a failed result</li>
 * </ul>
 */
public interface Indicator {

    /** Unique name, also the configuration key. */
    String name();

    Side side();

    /**
     * The formula's unnormalized output, or empty when the data it needs is missing,
     * too short for its lookback window, or the indicator has no configuration entry.
     */
    OptionalDouble rawValue();

    /** Raw value, normalized score, weight, bounds and timestamp bundled for the composite. */
    IndicatorResult fullResult();
}
