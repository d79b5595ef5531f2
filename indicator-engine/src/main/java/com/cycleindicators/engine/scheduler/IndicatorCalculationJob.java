package com.cycleindicators.engine.scheduler;

import com.cycleindicators.engine.export.JsonRunExporter;
import com.cycleindicators.engine.history.AnalysisHistoryStore;
import com.cycleindicators.engine.service.AnalysisCoordinator;
import com.cycleindicators.engine.service.AnalysisRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Triggers a refreshing analysis run on the configured cron (twice a day, UTC, by default),
 * then stores and exports the result. The outcome is reported as a boolean; nothing is rethrown.
 * With {@code history.retention-days} above zero, runs older than that are purged after each save.
 */
@Component
public class IndicatorCalculationJob {

    private static final Logger log = LoggerFactory.getLogger(IndicatorCalculationJob.class);

    private final AnalysisCoordinator coordinator;
    private final AnalysisHistoryStore historyStore;
    private final JsonRunExporter exporter;
    private final boolean enabled;
    private final int retentionDays;

    public IndicatorCalculationJob(AnalysisCoordinator coordinator,
                                   AnalysisHistoryStore historyStore,
                                   JsonRunExporter exporter,
                                   @Value("${scheduler.enabled:true}") boolean enabled,
                                   @Value("${history.retention-days:0}") int retentionDays) {
        this.coordinator   = coordinator;
        this.historyStore  = historyStore;
        this.exporter      = exporter;
        this.enabled       = enabled;
        this.retentionDays = retentionDays;
    }

    @Scheduled(cron = "${scheduler.cron:0 0 8,20 * * *}", zone = "UTC")
    public void scheduledCalculation() {
        if (!enabled) {
            log.debug("Scheduled calculation skipped: scheduler disabled");
            return;
        }
        log.info("Scheduled indicator calculation triggered");
        execute("scheduled");
    }

    public boolean runManualCalculation() {
        log.info("Manual indicator calculation triggered");
        return execute("manual");
    }

    private boolean execute(String trigger) {
        try {
            AnalysisRun run = coordinator.run(true);
            historyStore.save(run);
            if (retentionDays > 0) {
                historyStore.purgeOlderThan(Duration.ofDays(retentionDays));
            }
            if (!run.isSuccessful()) {
                log.error("Indicator calculation failed. trigger={} runId={} error={}",
                          trigger, run.runId(), run.error());
                return false;
            }
            exporter.export(run);
            log.info("Indicator calculation completed. trigger={} runId={} durationSeconds={}",
                     trigger, run.runId(), run.calculationInfo().durationSeconds());
            return true;
        } catch (RuntimeException e) {
            log.error("Indicator calculation job failed. trigger={}", trigger, e);
            return false;
        }
    }
}
