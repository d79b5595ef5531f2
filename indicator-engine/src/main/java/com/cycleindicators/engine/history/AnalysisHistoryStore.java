package com.cycleindicators.engine.history;

import com.cycleindicators.engine.service.AnalysisRun;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/** Keeps past analysis runs and the flat indicator rows derived from them. */
public interface AnalysisHistoryStore {

    void save(AnalysisRun run);

    /** Newest first, at most {@code limit} runs. */
    List<AnalysisRun> recent(int limit);

    Optional<AnalysisRun> find(String runId);

    /** Bottom rows then top rows, valid before failed within a side; empty for an unknown run. */
    List<IndicatorResultRow> indicatorRows(String runId);

    /** Rows for one indicator from runs started within {@code window}, newest run first. */
    List<IndicatorResultRow> indicatorHistory(String name, Duration window);

    /** @return number of runs removed */
    int purgeOlderThan(Duration age);

    HistoryStats stats();
}
