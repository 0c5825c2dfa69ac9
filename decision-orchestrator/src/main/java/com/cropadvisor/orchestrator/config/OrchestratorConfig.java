package com.cropadvisor.orchestrator.config;

import com.cropadvisor.common.phenology.CropKnowledgeBase;
import com.cropadvisor.common.risk.RiskRuleTable;
import com.cropadvisor.evaluator.weather.FarmingImpactAssessor;
import com.cropadvisor.orchestrator.pipeline.ConfidenceScorer;
import com.cropadvisor.orchestrator.pipeline.PrecedenceTable;
import com.cropadvisor.orchestrator.pipeline.RecommendationRules;
import com.cropadvisor.orchestrator.routing.IntentRoutingTable;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class OrchestratorConfig {

    @Value("${advisor.knowledge-base:" + CropKnowledgeBase.DEFAULT_RESOURCE + "}")
    private String knowledgeBaseResource;

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
    public CropKnowledgeBase cropKnowledgeBase(ObjectMapper objectMapper) {
        return CropKnowledgeBase.fromClasspath(objectMapper, knowledgeBaseResource);
    }

    @Bean
    public RiskRuleTable riskRuleTable() {
        return RiskRuleTable.defaults();
    }

    @Bean
    public FarmingImpactAssessor farmingImpactAssessor(AdvisorProperties properties) {
        return new FarmingImpactAssessor(properties.getWeather().toThresholds());
    }

    @Bean
    public IntentRoutingTable intentRoutingTable() {
        return IntentRoutingTable.defaults();
    }

    @Bean
    public PrecedenceTable precedenceTable(AdvisorProperties properties) {
        return PrecedenceTable.withOverrides(properties.getPrecedence());
    }

    @Bean
    public RecommendationRules recommendationRules() {
        return RecommendationRules.defaults();
    }

    @Bean
    public ConfidenceScorer confidenceScorer(AdvisorProperties properties) {
        return ConfidenceScorer.from(properties.getConfidence());
    }
}
