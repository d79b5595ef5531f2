package com.cycleindicators.engine.history;

import com.cycleindicators.common.model.CompositeResult;
import com.cycleindicators.engine.service.AnalysisRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Bounded in-memory history. Once {@code history.max-runs} runs are held the oldest is evicted.
 */
@Component
public class InMemoryAnalysisHistoryStore implements AnalysisHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAnalysisHistoryStore.class);

    private final Deque<AnalysisRun> runs = new ArrayDeque<>();
    private final int maxRuns;
    private final Clock clock;

    public InMemoryAnalysisHistoryStore(@Value("${history.max-runs:500}") int maxRuns, Clock clock) {
        if (maxRuns < 1) {
            throw new IllegalArgumentException("history.max-runs must be positive, got " + maxRuns);
        }
        this.maxRuns = maxRuns;
        this.clock   = clock;
    }

    @Override
    public synchronized void save(AnalysisRun run) {
        runs.addFirst(run);
        while (runs.size() > maxRuns) {
            AnalysisRun evicted = runs.removeLast();
            log.debug("Evicted run from history. runId={}", evicted.runId());
        }
        log.info("Run saved to history. runId={} successful={} size={}", run.runId(), run.isSuccessful(), runs.size());
    }

    @Override
    public synchronized List<AnalysisRun> recent(int limit) {
        List<AnalysisRun> out = new ArrayList<>(Math.min(Math.max(limit, 0), runs.size()));
        Iterator<AnalysisRun> it = runs.iterator();
        while (it.hasNext() && out.size() < limit) {
            out.add(it.next());
        }
        return out;
    }

    @Override
    public synchronized Optional<AnalysisRun> find(String runId) {
        return runs.stream().filter(r -> r.runId().equals(runId)).findFirst();
    }

    @Override
    public List<IndicatorResultRow> indicatorRows(String runId) {
        return find(runId).map(InMemoryAnalysisHistoryStore::rows).orElse(List.of());
    }

    @Override
    public synchronized List<IndicatorResultRow> indicatorHistory(String name, Duration window) {
        Instant cutoff = clock.instant().minus(window);
        List<IndicatorResultRow> out = new ArrayList<>();
        for (AnalysisRun run : runs) {
            if (startedAt(run).isBefore(cutoff)) continue;
            rows(run).stream().filter(row -> row.name().equals(name)).forEach(out::add);
        }
        return out;
    }

    @Override
    public synchronized int purgeOlderThan(Duration age) {
        Instant cutoff = clock.instant().minus(age);
        int before = runs.size();
        runs.removeIf(r -> startedAt(r).isBefore(cutoff));
        int removed = before - runs.size();
        if (removed > 0) {
            log.info("Purged runs from history. removed={} cutoff={}", removed, cutoff);
        }
        return removed;
    }

    @Override
    public synchronized HistoryStats stats() {
        int successful = 0;
        int rows = 0;
        for (AnalysisRun run : runs) {
            if (run.isSuccessful()) successful++;
            rows += rows(run).size();
        }
        Instant newest = runs.isEmpty() ? null : startedAt(runs.peekFirst());
        Instant oldest = runs.isEmpty() ? null : startedAt(runs.peekLast());
        return new HistoryStats(runs.size(), successful, runs.size() - successful, rows, oldest, newest);
    }

    private static List<IndicatorResultRow> rows(AnalysisRun run) {
        List<IndicatorResultRow> rows = new ArrayList<>();
        addRows(rows, run.runId(), run.bottomIndicators());
        addRows(rows, run.runId(), run.topIndicators());
        return rows;
    }

    private static void addRows(List<IndicatorResultRow> rows, String runId, CompositeResult composite) {
        if (composite == null) return;
        composite.allIndicators().forEach(r -> rows.add(IndicatorResultRow.of(runId, r)));
    }

    private static Instant startedAt(AnalysisRun run) {
        return run.calculationInfo().startTime();
    }
}
