package com.wellbeingplatform.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wellbeingplatform.common.integration.DefaultWeightedIntegrator;
import com.wellbeingplatform.common.integration.WeightedIntegrator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

@Configuration
@ComponentScan("com.wellbeingplatform")
@PropertySource("classpath:wellbeing-orchestrator.properties")
public class OrchestratorConfig {

    @Value("${analysis.orchestrator.interval-ms:5000}")
    private long intervalMs;

    @Value("${analysis.orchestrator.realtime-budget-ms:250}")
    private long realtimeBudgetMs;

    @Value("${analysis.orchestrator.history-limit:500}")
    private int historyLimit;

    @Value("${analysis.orchestrator.risk-threshold:0.7}")
    private double riskThreshold;

    @Value("${analysis.orchestrator.acute-signal-threshold:0.8}")
    private double acuteSignalThreshold;

    @Value("${analysis.orchestrator.opportunity-threshold:0.7}")
    private double opportunityThreshold;

    @Value("${analysis.orchestrator.trend-tolerance:0.05}")
    private double trendTolerance;

    @Value("${analysis.family-share.emotional:0.6}")
    private double emotionalShare;

    @Value("${analysis.family-share.neuroplasticity:0.4}")
    private double neuroplasticityShare;

    @Bean
    public OrchestratorSettings orchestratorSettings() {
        return new OrchestratorSettings(intervalMs, realtimeBudgetMs, historyLimit,
            riskThreshold, acuteSignalThreshold, opportunityThreshold, trendTolerance,
            emotionalShare, neuroplasticityShare);
    }

    @Bean
    public WeightedIntegrator weightedIntegrator() {
        return new DefaultWeightedIntegrator();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
