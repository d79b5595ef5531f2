package com.cycleindicators.engine.controller;

import com.cycleindicators.engine.cache.TimeframeCache;
import com.cycleindicators.engine.cache.TimeframeCacheStatus;
import com.cycleindicators.engine.history.AnalysisHistoryStore;
import com.cycleindicators.engine.history.IndicatorResultRow;
import com.cycleindicators.engine.service.AnalysisCoordinator;
import com.cycleindicators.engine.service.AnalysisRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/analysis")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisCoordinator coordinator;
    private final TimeframeCache cache;
    private final AnalysisHistoryStore historyStore;
    private final Clock clock;

    public AnalysisController(AnalysisCoordinator coordinator, TimeframeCache cache,
                              AnalysisHistoryStore historyStore, Clock clock) {
        this.coordinator  = coordinator;
        this.cache        = cache;
        this.historyStore = historyStore;
        this.clock        = clock;
    }

    /** Runs a full calculation; an error run still answers 200 with its {@code error} field set. */
    @PostMapping("/run")
    public Mono<ResponseEntity<AnalysisRun>> run(@RequestParam(defaultValue = "true") boolean refresh) {
        return Mono.fromCallable(() -> {
                AnalysisRun run = coordinator.run(refresh);
                historyStore.save(run);
                return run;
            })
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok)
            .onErrorResume(e -> {
                log.error("Manual analysis run failed", e);
                return Mono.just(ResponseEntity.internalServerError().build());
            });
    }

    @GetMapping("/cache/status")
    public Mono<ResponseEntity<Map<String, TimeframeCacheStatus>>> cacheStatus() {
        return Mono.fromCallable(cache::status)
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/history")
    public Mono<ResponseEntity<List<AnalysisRun>>> history(@RequestParam(defaultValue = "10") int limit) {
        return Mono.fromCallable(() -> historyStore.recent(limit))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/history/{runId}/indicators")
    public Mono<ResponseEntity<List<IndicatorResultRow>>> indicators(@PathVariable String runId) {
        return Mono.fromCallable(() -> historyStore.find(runId))
            .map(run -> run.isPresent()
                ? ResponseEntity.ok(historyStore.indicatorRows(runId))
                : ResponseEntity.notFound().<List<IndicatorResultRow>>build());
    }

    @GetMapping("/history/indicators/{name}")
    public Mono<ResponseEntity<List<IndicatorResultRow>>> indicatorHistory(@PathVariable String name,
                                                                           @RequestParam(defaultValue = "30") int days) {
        if (days < 1) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return Mono.fromCallable(() -> historyStore.indicatorHistory(name, Duration.ofDays(days)))
            .map(ResponseEntity::ok);
    }

    /** Drops runs started more than {@code olderThanDays} ago and answers with the count removed. */
    @DeleteMapping("/history")
    public Mono<ResponseEntity<Map<String, Integer>>> purgeHistory(@RequestParam int olderThanDays) {
        if (olderThanDays < 1) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return Mono.fromCallable(() -> historyStore.purgeOlderThan(Duration.ofDays(olderThanDays)))
            .map(removed -> {
                log.info("History purge requested. olderThanDays={} removed={}", olderThanDays, removed);
                return ResponseEntity.ok(Map.of("removed", removed));
            });
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<Map<String, Object>>> status() {
        return Mono.fromCallable(() -> {
                Map<String, Object> status = new LinkedHashMap<>();
                status.put("serverTime", clock.instant());
                status.put("timeframes", cache.timeframes());
                status.put("cache", cache.status());
                status.put("history", historyStore.stats());
                return status;
            })
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok)
            .onErrorResume(e -> {
                log.error("Status lookup failed", e);
                return Mono.just(ResponseEntity.internalServerError().build());
            });
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
