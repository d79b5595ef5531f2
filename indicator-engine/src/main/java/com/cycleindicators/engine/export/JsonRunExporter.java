package com.cycleindicators.engine.export;

import com.cycleindicators.engine.service.AnalysisRun;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Writes one pretty-printed JSON snapshot per successful run to
 * {@code <export.directory>/cycle_indicators_yyyyMMdd_HHmmss_<runId>.json}, stamped with the run start
 * in UTC. Characters outside {@code [A-Za-z0-9-]} in the run id become {@code _}.
 */
@Component
public class JsonRunExporter {

    private static final Logger log = LoggerFactory.getLogger(JsonRunExporter.class);

    private static final DateTimeFormatter FILE_STAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final Path directory;

    public JsonRunExporter(ObjectMapper objectMapper,
                           @Value("${export.enabled:false}") boolean enabled,
                           @Value("${export.directory:./exports}") Path directory) {
        this.objectMapper = objectMapper;
        this.enabled      = enabled;
        this.directory    = directory;
    }

    /** @return the written file; empty when disabled, the run failed, or writing failed */
    public Optional<Path> export(AnalysisRun run) {
        if (!enabled) {
            return Optional.empty();
        }
        if (!run.isSuccessful()) {
            log.info("Skipping export of failed run. runId={}", run.runId());
            return Optional.empty();
        }
        Path file = directory.resolve(fileName(run));
        try {
            Files.createDirectories(directory);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), run);
            log.info("Run exported. runId={} file={}", run.runId(), file);
            return Optional.of(file);
        } catch (IOException e) {
            log.error("Run export failed. runId={} file={}", run.runId(), file, e);
            return Optional.empty();
        }
    }

    static String fileName(AnalysisRun run) {
        return "cycle_indicators_" + FILE_STAMP.format(run.calculationInfo().startTime())
            + "_" + run.runId().replaceAll("[^A-Za-z0-9-]", "_") + ".json";
    }
}
