package com.safetyrisk.riskservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.safetyrisk.common.cache.EvaluationCache;
import com.safetyrisk.common.config.EngineSettings;
import com.safetyrisk.common.engine.RiskEvaluationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RiskServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(RiskServiceConfig.class);

    @Bean
    public EngineSettings engineSettings(RiskEngineProperties properties) {
        EngineSettings settings = properties.toSettings();
        log.info("Risk engine configured: tierBounds={} horizon={} aggregationWindow={} denominator={}",
                 settings.tiers().lowerBounds(), settings.forecast().horizon(),
                 settings.aggregationWindow(), settings.effectiveness().denominator());
        return settings;
    }

    @Bean
    public RiskEvaluationEngine riskEvaluationEngine(EngineSettings settings) {
        return new RiskEvaluationEngine(settings);
    }

    @Bean
    public EvaluationCache evaluationCache(RiskEngineProperties properties) {
        return new EvaluationCache(properties.getCache().getMaxEntries());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
