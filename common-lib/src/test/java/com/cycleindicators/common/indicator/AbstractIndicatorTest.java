package com.cycleindicators.common.indicator;

import com.cycleindicators.common.config.IndicatorConfiguration;
import com.cycleindicators.common.model.Bounds;
import com.cycleindicators.common.model.IndicatorResult;
import com.cycleindicators.common.model.IndicatorSpec;
import com.cycleindicators.common.model.OhlcvBar;
import com.cycleindicators.common.model.Side;
import com.cycleindicators.common.model.TimeframeDataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalDouble;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class AbstractIndicatorTest {

    private static final Instant NOW   = Instant.parse("2024-03-01T12:00:00Z");
    private static final Instant AS_OF = Instant.parse("2024-03-01T11:30:00Z");
    private static final Clock CLOCK   = Clock.fixed(NOW, ZoneOffset.UTC);

    private final IndicatorConfiguration configuration = IndicatorConfiguration.of(List.of(
        new IndicatorSpec("scaled", Side.BOTTOM, Bounds.of(0, 10), 6),
        new IndicatorSpec("flat", Side.BOTTOM, Bounds.of(3, 3), 4)));

    private final MapDataSource source = new MapDataSource().put(TimeframeDataset.of("1D", List.of(
        new OhlcvBar(AS_OF.minusSeconds(86_400), 1, 2, 0.5, 1.5, 100),
        new OhlcvBar(AS_OF, 1.5, 3, 1, 2.5, 200)), AS_OF));

    private FormulaIndicator indicator(String name, Function<DatasetReader, OptionalDouble> formula) {
        return new FormulaIndicator(name, Side.BOTTOM, formula, configuration, source, CLOCK);
    }

    private static OptionalDouble lastClose(DatasetReader data) {
        return OptionalDouble.of(data.require("1D").latest().close());
    }

    @Nested
    @DisplayName("fullResult(): success")
    class Success {

        @Test
        @DisplayName("raw 2.5 within [0,10] → normalized 0.25, weight and bounds reported")
        void valid() {
            IndicatorResult r = indicator("scaled", AbstractIndicatorTest::lastClose).fullResult();

            assertTrue(r.isValid());
            assertEquals(2.5, r.rawValue());
            assertEquals(0.25, r.normalizedScore(), 1e-9);
            assertEquals(6.0, r.weight());
            assertEquals(Bounds.of(0, 10), r.bounds());
            assertNull(r.error());
        }

        @Test
        @DisplayName("timestamp is the freshest dataset consulted, not the clock")
        void timestampFromDataset() {
            assertEquals(AS_OF, indicator("scaled", AbstractIndicatorTest::lastClose).fullResult().timestamp());
        }

        @Test
        @DisplayName("no dataset consulted → clock time")
        void timestampFromClock() {
            IndicatorResult r = indicator("scaled", data -> OptionalDouble.of(5.0)).fullResult();
            assertEquals(NOW, r.timestamp());
        }

        @Test
        @DisplayName("rawValue() agrees with fullResult()")
        void rawValueMatches() {
            assertEquals(2.5, indicator("scaled", AbstractIndicatorTest::lastClose).rawValue().getAsDouble());
        }
    }

    @Nested
    @DisplayName("fullResult(): contained failures")
    class Failures {

        @Test
        @DisplayName("formula throws → failed, message kept, weight still reported")
        void formulaThrows() {
            IndicatorResult r = indicator("scaled", data -> {
                throw new IllegalStateException("division by zero in ratio");
            }).fullResult();

            assertFalse(r.isValid());
            assertNull(r.rawValue());
            assertEquals("division by zero in ratio", r.error());
            assertEquals(6.0, r.weight());
            assertEquals(Bounds.of(0, 10), r.bounds());
        }

        @Test
        @DisplayName("missing timeframe → failed with data-unavailable message")
        void missingData() {
            IndicatorResult r = indicator("scaled", data ->
                OptionalDouble.of(data.require("1W").latest().close())).fullResult();

            assertFalse(r.isValid());
            assertTrue(r.error().contains("No 1W data available"));
        }

        @Test
        @DisplayName("rawValue() maps missing data to empty instead of throwing")
        void rawValueMissingData() {
            assertTrue(indicator("scaled", data ->
                OptionalDouble.of(data.require("1W").latest().close())).rawValue().isEmpty());
        }

        @Test
        @DisplayName("too few bars → failed")
        void insufficientBars() {
            IndicatorResult r = indicator("scaled", data ->
                OptionalDouble.of(data.require("1D", 50).latest().close())).fullResult();

            assertTrue(r.error().contains("need 50 bars, have 2"));
        }

        @Test
        @DisplayName("empty raw value → failed without error text")
        void emptyRaw() {
            IndicatorResult r = indicator("scaled", data -> OptionalDouble.empty()).fullResult();
            assertFalse(r.isValid());
            assertNull(r.rawValue());
            assertNull(r.error());
        }

        @Test
        @DisplayName("NaN raw value → failed")
        void nanRaw() {
            IndicatorResult r = indicator("scaled", data -> OptionalDouble.of(Double.NaN)).fullResult();
            assertFalse(r.isValid());
            assertNotNull(r.error());
        }

        @Test
        @DisplayName("degenerate bounds → raw kept, no score")
        void degenerateBounds() {
            IndicatorResult r = indicator("flat", data -> OptionalDouble.of(3.0)).fullResult();

            assertFalse(r.isValid());
            assertEquals(3.0, r.rawValue());
            assertNull(r.normalizedScore());
            assertTrue(r.error().startsWith("Degenerate bounds"));
        }

        @Test
        @DisplayName("no configuration entry → failed with weight 0 and no bounds")
        void unconfigured() {
            FormulaIndicator unknown = indicator("unknown", data -> OptionalDouble.of(1.0));
            IndicatorResult r = unknown.fullResult();

            assertFalse(r.isValid());
            assertEquals(0.0, r.weight());
            assertNull(r.bounds());
            assertTrue(r.error().contains("unknown"));
            assertTrue(unknown.rawValue().isEmpty());
        }
    }
}
