package com.cycleindicators.engine;

import com.cycleindicators.common.composer.IndicatorComposer;
import com.cycleindicators.common.config.IndicatorConfiguration;
import com.cycleindicators.common.indicator.Indicator;
import com.cycleindicators.common.model.Side;
import com.cycleindicators.engine.cache.TimeframeCache;
import com.cycleindicators.engine.series.DerivedSeriesCalculator;
import com.cycleindicators.engine.support.Bars;
import com.cycleindicators.engine.support.RecordingDataSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "scheduler.enabled=false")
class IndicatorEngineApplicationTest {

    @TestConfiguration
    static class RecordingSourceConfig {

        /** Indicators read through this source; every timeframe the client can serve is present. */
        @Bean
        @Primary
        RecordingDataSource recordingDataSource() {
            DerivedSeriesCalculator derived = new DerivedSeriesCalculator();
            RecordingDataSource source = new RecordingDataSource();
            for (String timeframe : List.of("1D", "3D", "5D", "1W", "1M")) {
                source.put(derived.enrich(Bars.dataset(timeframe, Bars.of(400,
                    i -> 100.0 + 10.0 * Math.sin(i / 7.0), i -> 1_000.0 + (i % 5) * 100.0))));
            }
            return source;
        }
    }

    @Autowired
    @Qualifier("bottomComposer")
    private IndicatorComposer bottomComposer;

    @Autowired
    @Qualifier("topComposer")
    private IndicatorComposer topComposer;

    @Autowired
    private IndicatorConfiguration configuration;

    @Autowired
    private TimeframeCache cache;

    @Autowired
    private RecordingDataSource recordingDataSource;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("rosters are wired per side in declaration order")
    void rosters() {
        assertEquals(List.of("m_timed_bottom_score", "2d_volume_burst", "cm_vix_fix", "gaussian_channel",
                             "3d_mmd", "w_wavefront", "supertrend", "pi_cycle_low"),
                     bottomComposer.roster().stream().map(Indicator::name).toList());
        assertEquals(List.of("m_timed_top_score", "3d_volume", "bbwp", "mmd", "wavetrend_oscillator", "pi_cycle"),
                     topComposer.roster().stream().map(Indicator::name).toList());
    }

    @Test
    @DisplayName("every roster member has a configuration entry")
    void everyIndicatorConfigured() {
        for (IndicatorComposer composer : List.of(bottomComposer, topComposer)) {
            for (Indicator indicator : composer.roster()) {
                assertTrue(configuration.spec(indicator.side(), indicator.name()).isPresent(), indicator.name());
            }
        }
        assertEquals(Side.TOP, topComposer.side());
    }

    @Test
    @DisplayName("the cache refreshes exactly the timeframes the rosters read")
    void cachedTimeframesAreRead() {
        recordingDataSource.clear();

        bottomComposer.calculateIndividualScores();
        topComposer.calculateIndividualScores();

        assertEquals(Set.copyOf(cache.timeframes()), recordingDataSource.requested());
        assertFalse(cache.timeframes().contains("5D"));
    }

    @Test
    @DisplayName("the engine's ObjectMapper writes instants as ISO-8601 text")
    void instantsSerializeAsText() throws JsonProcessingException {
        assertEquals("\"2024-03-01T08:00:00Z\"", objectMapper.writeValueAsString(Instant.parse("2024-03-01T08:00:00Z")));
    }
}
