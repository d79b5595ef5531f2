package com.cycleindicators.engine.service;

import com.cycleindicators.common.composer.IndicatorComposer;
import com.cycleindicators.common.model.CompositeResult;
import com.cycleindicators.engine.cache.CacheRefreshReport;
import com.cycleindicators.engine.cache.TimeframeCache;
import com.cycleindicators.engine.context.MarketContext;
import com.cycleindicators.engine.context.MarketContextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Single entry point for a full calculation: optional cache refresh, bottom then top composer,
 * market context and cache snapshot, packaged as one {@link AnalysisRun}.
 *
 * <p>Runs synchronously on the calling thread and never throws.
 */
@Service
public class AnalysisCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AnalysisCoordinator.class);

    private final TimeframeCache cache;
    private final IndicatorComposer bottomComposer;
    private final IndicatorComposer topComposer;
    private final MarketContextBuilder marketContextBuilder;
    private final Clock clock;

    public AnalysisCoordinator(TimeframeCache cache,
                               IndicatorComposer bottomComposer,
                               IndicatorComposer topComposer,
                               MarketContextBuilder marketContextBuilder,
                               Clock clock) {
        this.cache                = cache;
        this.bottomComposer       = bottomComposer;
        this.topComposer          = topComposer;
        this.marketContextBuilder = marketContextBuilder;
        this.clock                = clock;
    }

    public AnalysisRun run(boolean refreshData) {
        String runId = UUID.randomUUID().toString();
        Instant start = clock.instant();
        MDC.put("runId", runId);
        log.info("RUN_STARTED runId={} refreshData={}", runId, refreshData);
        try {
            CacheRefreshReport report = null;
            if (refreshData) {
                report = refresh();
            }

            CompositeResult bottom = bottomComposer.calculateCompleteAnalysis();
            CompositeResult top    = topComposer.calculateCompleteAnalysis();
            MarketContext context  = marketContextBuilder.build();

            CalculationInfo info = CalculationInfo.of(start, clock.instant(), refreshData, report);
            AnalysisRun run = new AnalysisRun(runId, info, bottom, top, context, cache.status(), null);
            logSummary(run);
            return run;
        } catch (RuntimeException e) {
            CalculationInfo info = CalculationInfo.of(start, clock.instant(), refreshData, null);
            log.error("RUN_FAILED runId={} durationSeconds={}", runId, info.durationSeconds(), e);
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return AnalysisRun.failed(runId, info, error);
        } finally {
            MDC.remove("runId");
        }
    }

    private CacheRefreshReport refresh() {
        try {
            CacheRefreshReport report = cache.refreshAll();
            if (!report.allSucceeded()) {
                log.warn("Continuing with cached data for timeframes {}", report.failed());
            }
            return report;
        } catch (RuntimeException e) {
            log.warn("Cache refresh failed, continuing with cached data: {}", e.getMessage());
            return null;
        }
    }

    private void logSummary(AnalysisRun run) {
        CompositeResult bottom = run.bottomIndicators();
        CompositeResult top    = run.topIndicators();
        log.info("RUN_COMPLETED runId={} bottomScore={} bottomStrength={} topScore={} topStrength={} price={} durationSeconds={}",
                 run.runId(),
                 format(bottom.compositeScore()), strength(bottom),
                 format(top.compositeScore()), strength(top),
                 run.marketContext().currentPrice(),
                 run.calculationInfo().durationSeconds());
    }

    private static String format(Double score) {
        return score == null ? "n/a" : String.format("%.4f", score);
    }

    private static String strength(CompositeResult result) {
        return result.interpretation() == null ? "n/a" : result.interpretation().strength().label();
    }
}
