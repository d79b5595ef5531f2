package com.cycleindicators.engine.config;

import com.cycleindicators.common.composer.IndicatorComposer;
import com.cycleindicators.common.config.IndicatorConfiguration;
import com.cycleindicators.common.config.IndicatorConfigurationLoader;
import com.cycleindicators.common.exception.IndicatorConfigurationException;
import com.cycleindicators.common.indicator.Indicator;
import com.cycleindicators.common.model.FailedWeightPolicy;
import com.cycleindicators.common.model.Side;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.List;

@Configuration
public class EngineConfig {

    @Value("${indicators.config-location:classpath:indicator-config.json}")
    private Resource indicatorConfigResource;

    @Value("${analysis.failed-zero-weight-policy:COUNT_AS_FAILURE}")
    private FailedWeightPolicy failedWeightPolicy;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IndicatorConfiguration indicatorConfiguration(ObjectMapper objectMapper) {
        try (InputStream in = indicatorConfigResource.getInputStream()) {
            return new IndicatorConfigurationLoader(objectMapper).load(in, indicatorConfigResource.getDescription());
        } catch (IOException e) {
            throw new IndicatorConfigurationException(
                "Cannot open indicator configuration " + indicatorConfigResource.getDescription(), e);
        }
    }

    @Bean
    public IndicatorComposer bottomComposer(List<Indicator> indicators, IndicatorConfiguration configuration,
                                            Clock clock) {
        return new IndicatorComposer(Side.BOTTOM, roster(indicators, Side.BOTTOM), configuration,
                                     failedWeightPolicy, clock);
    }

    @Bean
    public IndicatorComposer topComposer(List<Indicator> indicators, IndicatorConfiguration configuration,
                                         Clock clock) {
        return new IndicatorComposer(Side.TOP, roster(indicators, Side.TOP), configuration,
                                     failedWeightPolicy, clock);
    }

    /** Indicators arrive sorted by {@code @Order}; that order is the roster order. */
    private static List<Indicator> roster(List<Indicator> indicators, Side side) {
        return indicators.stream().filter(i -> i.side() == side).toList();
    }
}
