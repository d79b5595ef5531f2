package com.cycleindicators.engine.indicator;

import com.cycleindicators.common.config.IndicatorConfiguration;
import com.cycleindicators.common.model.IndicatorResult;
import com.cycleindicators.common.model.OhlcvBar;
import com.cycleindicators.common.model.Side;
import com.cycleindicators.common.model.TimeframeDataset;
import com.cycleindicators.engine.indicator.top.BbwpIndicator;
import com.cycleindicators.engine.indicator.top.MmdIndicator;
import com.cycleindicators.engine.indicator.top.PiCycleIndicator;
import com.cycleindicators.engine.indicator.top.TimedTopScoreIndicator;
import com.cycleindicators.engine.indicator.top.Volume3DIndicator;
import com.cycleindicators.engine.indicator.top.WavetrendOscillatorIndicator;
import com.cycleindicators.engine.series.DerivedSeriesCalculator;
import com.cycleindicators.engine.series.SeriesMath;
import com.cycleindicators.engine.support.Bars;
import com.cycleindicators.engine.support.RosterConfiguration;
import com.cycleindicators.engine.support.StaticDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.IntToDoubleFunction;

import static org.junit.jupiter.api.Assertions.*;

class TopIndicatorsTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T09:00:00Z"), ZoneOffset.UTC);
    private static final double EPS = 1e-9;

    private final IndicatorConfiguration configuration = RosterConfiguration.load();
    private final StaticDataSource source = new StaticDataSource();
    private final DerivedSeriesCalculator derived = new DerivedSeriesCalculator();

    // ── 3d_volume ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("3d_volume")
    class Volume3D {

        private final Volume3DIndicator indicator = new Volume3DIndicator(configuration, source, CLOCK);

        /** 29 bars alternating 90/110 then a 300 spike; z over the last 20 is 190.5 / sample std. */
        private final IntToDoubleFunction spike = i -> i == 29 ? 300.0 : (i % 2 == 0 ? 90.0 : 110.0);
        private final double z = 190.5 / Math.sqrt(40095.0 / 19.0);

        @Test
        @DisplayName("volume spike into a rising market → z/2, ×1.3 for the top daily percentile")
        void distributionInUptrend() {
            source.put(Bars.dataset("1D", Bars.of(30, i -> 100.0 + i, spike)));

            IndicatorResult result = indicator.fullResult();

            assertTrue(result.isValid());
            assertEquals(z / 2.0 * 1.3, result.rawValue(), EPS);
            assertEquals(Side.TOP, result.side());
        }

        @Test
        @DisplayName("volume spike into a falling market → z/1.5, ×1.3")
        void spikeInDowntrend() {
            source.put(Bars.dataset("1D", Bars.of(30, i -> 200.0 - i, spike)));

            assertEquals(z / 1.5 * 1.3, indicator.rawValue().getAsDouble(), EPS);
        }

        @Test
        @DisplayName("three identical timeframes weigh back to the single-timeframe score")
        void threeTimeframes() {
            List<OhlcvBar> bars = Bars.of(30, i -> 100.0 + i, spike);
            source.put(Bars.dataset("3D", bars)).put(Bars.dataset("1D", bars)).put(Bars.dataset("1W", bars));

            assertEquals(z / 2.0 * 1.3, indicator.rawValue().getAsDouble(), EPS);
        }

        @Test
        @DisplayName("constant volume everywhere → failed, no usable timeframe")
        void noSpread() {
            source.put(Bars.flat("1D", 30, 100.0, 500.0)).put(Bars.flat("3D", 30, 100.0, 500.0));

            assertEquals("No timeframe with enough volume history", indicator.fullResult().error());
        }

        @Test
        @DisplayName("timeframes under 20 bars are skipped")
        void shortTimeframesSkipped() {
            source.put(Bars.dataset("3D", Bars.of(19, i -> 100.0 + i, spike)));

            assertFalse(indicator.fullResult().isValid());
        }
    }

    // ── bbwp ─────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("bbwp")
    class Bbwp {

        private final BbwpIndicator indicator = new BbwpIndicator(configuration, source, CLOCK);

        /** {@code count} bars whose band width is NaN for 19 bars, then {@code width(k)} for k = 1, 2, … */
        private TimeframeDataset withWidths(int count, IntToDoubleFunction close, IntToDoubleFunction width) {
            List<Double> widths = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                widths.add(i < 19 ? Double.NaN : width.applyAsDouble(i - 18));
            }
            return Bars.dataset("1D", Bars.of(count, close, i -> 1_000.0))
                       .withDerivedSeries(Map.of(DerivedSeriesCalculator.BB_WIDTH, widths));
        }

        @Test
        @DisplayName("widest of the last 100 in an uptrend → 99 × 1.2, capped at 100")
        void widestInUptrend() {
            source.put(withWidths(130, i -> 100.0 + i, k -> k));

            IndicatorResult result = indicator.fullResult();

            assertEquals(100.0, result.rawValue(), EPS);
            assertEquals(1.0, result.normalizedScore(), EPS);
        }

        @Test
        @DisplayName("widest of the last 100 in a downtrend → 99 × 0.8")
        void widestInDowntrend() {
            source.put(withWidths(130, i -> 500.0 - i, k -> k));

            assertEquals(79.2, indicator.rawValue().getAsDouble(), EPS);
        }

        @Test
        @DisplayName("narrowest width → 0")
        void narrowest() {
            source.put(withWidths(130, i -> 100.0 + i, k -> 1_000.0 - k));

            assertEquals(0.0, indicator.rawValue().getAsDouble(), EPS);
        }

        @Test
        @DisplayName("21 widths → window shrinks to 20, current above 19 of them → 95 × 1.2 capped")
        void shortHistory() {
            source.put(withWidths(40, i -> 100.0 + i, k -> k));

            assertEquals(100.0, indicator.rawValue().getAsDouble(), EPS);
        }

        @Test
        @DisplayName("15 widths → failed")
        void tooFewWidths() {
            source.put(withWidths(34, i -> 100.0 + i, k -> k));

            assertTrue(indicator.fullResult().error().contains("need 20 values, have 15"));
        }
    }

    // ── pi_cycle ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("pi_cycle")
    class PiCycle {

        private final PiCycleIndicator indicator = new PiCycleIndicator(configuration, source, CLOCK);

        private IntToDoubleFunction jumpAt(int index) {
            return i -> i >= index ? 10_000.0 : 100.0;
        }

        @Test
        @DisplayName("flat history → no crossover, no position, confirmation floor 0.3 × 0.15")
        void flat() {
            source.put(Bars.flat("1D", 400, 100.0, 1_000.0));

            assertEquals(0.045, indicator.rawValue().getAsDouble(), EPS);
        }

        @Test
        @DisplayName("crossover 17 bars ago with signal above resistance → 0.6×13/30 + 0.25 + 0.15")
        void olderCrossover() {
            source.put(Bars.dataset("1D", Bars.of(400, jumpAt(380), i -> 1_000.0)));

            assertEquals(0.6 * 13.0 / 30.0 + 0.25 + 0.15, indicator.rawValue().getAsDouble(), EPS);
        }

        @Test
        @DisplayName("crossover 3 bars ago → ×1.5 bonus, clamped to 1")
        void recentCrossover() {
            source.put(Bars.dataset("1D", Bars.of(386, jumpAt(380), i -> 1_000.0)));

            assertEquals(1.0, indicator.rawValue().getAsDouble(), EPS);
        }

        @Test
        @DisplayName("120 bars → shortened windows still score")
        void shortenedWindows() {
            source.put(Bars.flat("1D", 120, 100.0, 1_000.0));

            assertEquals(0.045, indicator.rawValue().getAsDouble(), EPS);
        }

        @Test
        @DisplayName("100 bars → long window under 100 → failed")
        void tooShort() {
            source.put(Bars.flat("1D", 100, 100.0, 1_000.0));

            IndicatorResult result = indicator.fullResult();

            assertFalse(result.isValid());
            assertEquals(12.0, result.weight(), EPS);
        }
    }

    // ── m_timed_top_score ────────────────────────────────────────────────────

    @Nested
    @DisplayName("m_timed_top_score")
    class TimedTopScore {

        /** 09:00 UTC is an hour from the 08:00 slot. */
        private static final double HOUR_AFTER_SLOT = 1.0 - 60.0 / 360.0 * 0.3;

        private final TimedTopScoreIndicator indicator = new TimedTopScoreIndicator(configuration, source, CLOCK);

        @Test
        @DisplayName("flat daily data: momentum 0.6, RSI 100 → 1.0, volatility 0.5, renormalized over 0.7")
        void dailyOnly() {
            source.put(derived.enrich(Bars.flat("1D", 30, 100.0, 500.0)));

            double base = (0.6 * 0.3 + 1.0 * 0.25 + 0.5 * 0.15) / 0.7;
            assertEquals(base * HOUR_AFTER_SLOT, indicator.rawValue().getAsDouble(), EPS);
        }

        @Test
        @DisplayName("monthly rise on falling volume reads as distribution; weekly drop of 10% as exhaustion")
        void allComponents() {
            source.put(derived.enrich(Bars.flat("1D", 30, 100.0, 500.0)))
                  .put(Bars.dataset("1M", Bars.of(10, i -> 100.0 + i, i -> 1_000.0 - 10.0 * i)))
                  .put(Bars.dataset("1W", Bars.of(5, i -> i == 4 ? 90.0 : 100.0, i -> 1_000.0)));

            double momentum = (0.6 + 0.9) / 2;
            double base = 0.9 * 0.3 + momentum * 0.3 + 1.0 * 0.25 + 0.5 * 0.15;
            IndicatorResult result = indicator.fullResult();

            assertEquals(base * HOUR_AFTER_SLOT, result.rawValue(), EPS);
            assertEquals(Side.TOP, result.side());
        }

        @Test
        @DisplayName("nine monthly bars are too few for the distribution component")
        void shortMonthly() {
            source.put(derived.enrich(Bars.flat("1D", 30, 100.0, 500.0)))
                  .put(Bars.dataset("1M", Bars.of(9, i -> 100.0 + i, i -> 1_000.0 - 10.0 * i)));

            double base = (0.6 * 0.3 + 1.0 * 0.25 + 0.5 * 0.15) / 0.7;
            assertEquals(base * HOUR_AFTER_SLOT, indicator.rawValue().getAsDouble(), EPS);
        }

        @Test
        void noData() {
            assertEquals("No valid components for the timed top score", indicator.fullResult().error());
        }
    }

    // ── mmd ──────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("mmd")
    class Mmd {

        private final MmdIndicator indicator = new MmdIndicator(configuration, source, CLOCK);

        @Test
        @DisplayName("flat daily data: RSI-like strength 100 → momentum 15 → 1 + 5/40")
        void flatDaily() {
            source.put(Bars.flat("1D", 40, 100.0, 1_000.0));

            IndicatorResult result = indicator.fullResult();

            assertEquals(1.125, result.rawValue(), EPS);
            assertEquals((1.125 - 0.5) / 3.5, result.normalizedScore(), EPS);
        }

        @Test
        @DisplayName("three flat timeframes weigh back to the same momentum")
        void threeFlatTimeframes() {
            source.put(Bars.flat("1D", 40, 100.0, 1_000.0))
                  .put(Bars.flat("1W", 13, 100.0, 1_000.0))
                  .put(Bars.flat("1M", 9, 100.0, 1_000.0));

            assertEquals(1.125, indicator.rawValue().getAsDouble(), EPS);
        }

        @Test
        @DisplayName("strong daily climb → momentum above 20 → 0.5")
        void strongMomentum() {
            source.put(Bars.dataset("1D", Bars.of(19, i -> 100.0 + i, i -> 1_000.0)));

            assertEquals(0.5, indicator.rawValue().getAsDouble(), EPS);
        }

        @Test
        @DisplayName("daily drift up while weekly and monthly collapse → bearish divergence ×1.3")
        void bearishDivergence() {
            List<OhlcvBar> daily = Bars.of(40, i -> 100.0 + 0.01 * i, i -> 1_000.0);
            source.put(Bars.dataset("1D", daily))
                  .put(Bars.dataset("1W", Bars.of(13, i -> 100.0 * Math.pow(0.9, i), i -> 1_000.0)))
                  .put(Bars.dataset("1M", Bars.of(9, i -> 100.0 * Math.pow(0.9, i), i -> 1_000.0)));

            double d = 0.5 * SeriesMath.percentChange(Bars.dataset("1D", daily).closes(), 14) + 15;
            double w = 0.5 * (Math.pow(0.9, 8) - 1) * 100 - 15;
            double m = 0.5 * (Math.pow(0.9, 4) - 1) * 100 - 15;
            double adjusted = (0.6 * d + 0.3 * w + 0.1 * m) * 1.3;

            assertTrue(adjusted < -5 && adjusted > -20, String.valueOf(adjusted));
            assertEquals(2.0 + Math.abs(adjusted) / 20, indicator.rawValue().getAsDouble(), 1e-9);
        }

        @Test
        @DisplayName("18 daily bars and nothing else → failed")
        void tooShort() {
            source.put(Bars.flat("1D", 18, 100.0, 1_000.0));

            assertEquals("Failed to calculate momentum for any timeframe", indicator.fullResult().error());
        }
    }

    // ── wavetrend_oscillator ─────────────────────────────────────────────────

    @Nested
    @DisplayName("wavetrend_oscillator")
    class Wavetrend {

        private final WavetrendOscillatorIndicator indicator =
            new WavetrendOscillatorIndicator(configuration, source, CLOCK);

        @Test
        @DisplayName("flat closes → channel index 0 throughout → 0, normalized to the middle")
        void flat() {
            source.put(Bars.flat("1D", 60, 100.0, 1_000.0));

            IndicatorResult result = indicator.fullResult();

            assertEquals(0.0, result.rawValue(), EPS);
            assertEquals(0.5, result.normalizedScore(), EPS);
        }

        @Test
        @DisplayName("steady climb reads positive")
        void climb() {
            source.put(Bars.dataset("1D", Bars.of(60, i -> 100.0 + 2.0 * i, i -> 1_000.0)));

            assertTrue(indicator.rawValue().getAsDouble() > 0);
        }

        @Test
        @DisplayName("steady slide reads negative")
        void slide() {
            source.put(Bars.dataset("1D", Bars.of(60, i -> 300.0 - 2.0 * i, i -> 1_000.0)));

            assertTrue(indicator.rawValue().getAsDouble() < 0);
        }

        @Test
        void needsFiftyBars() {
            source.put(Bars.flat("1D", 49, 100.0, 1_000.0));

            assertTrue(indicator.fullResult().error().contains("need 50 bars, have 49"));
        }
    }
}
