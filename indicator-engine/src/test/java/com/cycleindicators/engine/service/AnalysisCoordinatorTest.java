package com.cycleindicators.engine.service;

import com.cycleindicators.common.composer.IndicatorComposer;
import com.cycleindicators.common.config.IndicatorConfiguration;
import com.cycleindicators.common.model.CompositeResult;
import com.cycleindicators.common.model.FailedWeightPolicy;
import com.cycleindicators.common.model.Side;
import com.cycleindicators.engine.cache.TimeframeCache;
import com.cycleindicators.engine.context.MarketContextBuilder;
import com.cycleindicators.engine.indicator.bottom.CmVixFixIndicator;
import com.cycleindicators.engine.indicator.bottom.VolumeBurst2DIndicator;
import com.cycleindicators.engine.indicator.top.BbwpIndicator;
import com.cycleindicators.engine.support.Bars;
import com.cycleindicators.engine.support.FakeMarketDataProvider;
import com.cycleindicators.engine.support.MutableClock;
import com.cycleindicators.engine.support.RosterConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AnalysisCoordinatorTest {

    private static final double EPS = 1e-9;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T08:00:00Z"));
    private final FakeMarketDataProvider provider = new FakeMarketDataProvider();
    private final IndicatorConfiguration configuration = RosterConfiguration.load();

    private TimeframeCache cache;
    private IndicatorComposer bottom;
    private IndicatorComposer top;

    @BeforeEach
    void setUp() {
        cache = new TimeframeCache(provider, clock, List.of("1D", "3D"), Duration.ofMinutes(60), 300,
                                   Duration.ofSeconds(5));
        bottom = new IndicatorComposer(Side.BOTTOM, List.of(
            new VolumeBurst2DIndicator(configuration, cache, clock),
            new CmVixFixIndicator(configuration, cache, clock)), configuration,
            FailedWeightPolicy.COUNT_AS_FAILURE, clock);
        top = new IndicatorComposer(Side.TOP, List.of(new BbwpIndicator(configuration, cache, clock)),
                                    configuration, FailedWeightPolicy.COUNT_AS_FAILURE, clock);
    }

    private AnalysisCoordinator coordinator(MarketContextBuilder contextBuilder) {
        return new AnalysisCoordinator(cache, bottom, top, contextBuilder, clock);
    }

    private AnalysisCoordinator coordinator() {
        return coordinator(new MarketContextBuilder(cache, provider, clock, 30, Duration.ofSeconds(5)));
    }

    // ── successful runs ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("run(): packaging")
    class Packaging {

        @Test
        @DisplayName("both sides, market context and cache status in one run")
        void fullRun() {
            provider.serve(Bars.flat("1D", 30, 100.0, 1_000.0)).price(65_000.0);

            AnalysisRun run = coordinator().run(true);

            assertTrue(run.isSuccessful());
            assertNotNull(run.runId());

            CompositeResult b = run.bottomIndicators();
            assertTrue(b.isScored());
            assertEquals((0.25 * 8 + (1.0 / 30.0) * 10) / 18.0, b.compositeScore(), EPS);

            CompositeResult t = run.topIndicators();
            assertTrue(t.hasNoValidIndicators());
            assertEquals(List.of("bbwp"), t.failedIndicatorNames());

            assertEquals(65_000.0, run.marketContext().currentPrice(), EPS);
            assertTrue(run.cacheStatus().get("1D").cached());
            assertFalse(run.cacheStatus().get("3D").cached());
        }

        @Test
        @DisplayName("refresh report lists the timeframe that failed; the run still completes")
        void partialRefresh() {
            provider.serve(Bars.flat("1D", 30, 100.0, 1_000.0));

            AnalysisRun run = coordinator().run(true);

            CalculationInfo info = run.calculationInfo();
            assertTrue(info.dataRefreshed());
            assertEquals(List.of("1D"), info.refreshReport().refreshed());
            assertEquals(List.of("3D"), info.refreshReport().failed());
            assertTrue(run.isSuccessful());
        }

        @Test
        @DisplayName("refreshData=false → cached data used, no refresh report")
        void noRefresh() {
            provider.serve(Bars.flat("1D", 30, 100.0, 1_000.0));
            cache.get("1D");

            AnalysisRun run = coordinator().run(false);

            assertFalse(run.calculationInfo().dataRefreshed());
            assertNull(run.calculationInfo().refreshReport());
            assertEquals(1, provider.calls("1D"));
        }

        @Test
        @DisplayName("runId is in the MDC only while the run executes")
        void mdcCleared() {
            coordinator().run(false);
            assertNull(MDC.get("runId"));
        }

        @Test
        @DisplayName("each run gets its own id")
        void distinctIds() {
            AnalysisCoordinator coordinator = coordinator();
            assertNotEquals(coordinator.run(false).runId(), coordinator.run(false).runId());
        }
    }

    // ── failures ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("run(): top-level failure")
    class TopLevelFailure {

        @Test
        @DisplayName("unexpected exception → error-only run with timing, never thrown")
        void errorRun() {
            MarketContextBuilder broken = mock(MarketContextBuilder.class);
            when(broken.build()).thenAnswer(inv -> {
                clock.advance(Duration.ofMillis(1500));
                throw new IllegalStateException("context exploded");
            });

            AnalysisRun run = coordinator(broken).run(false);

            assertFalse(run.isSuccessful());
            assertEquals("context exploded", run.error());
            assertNull(run.bottomIndicators());
            assertNull(run.topIndicators());
            assertEquals(1.5, run.calculationInfo().durationSeconds(), EPS);
            assertNull(MDC.get("runId"));
        }

        @Test
        @DisplayName("no data at all → both sides report no valid indicators, run still succeeds")
        void noData() {
            AnalysisRun run = coordinator().run(true);

            assertTrue(run.isSuccessful());
            assertTrue(run.bottomIndicators().hasNoValidIndicators());
            assertTrue(run.topIndicators().hasNoValidIndicators());
            assertFalse(run.calculationInfo().refreshReport().allSucceeded());
        }
    }
}
