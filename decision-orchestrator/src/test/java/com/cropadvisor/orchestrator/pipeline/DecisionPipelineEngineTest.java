package com.cropadvisor.orchestrator.pipeline;

import com.cropadvisor.common.model.Decision;
import com.cropadvisor.common.model.EvaluatorId;
import com.cropadvisor.common.model.Intent;
import com.cropadvisor.common.model.RecommendedAction;
import com.cropadvisor.common.model.Severity;
import com.cropadvisor.common.model.ThreatKind;
import com.cropadvisor.common.risk.RiskRuleTable;
import com.cropadvisor.orchestrator.routing.PrecedenceClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.cropadvisor.orchestrator.OrchestratorFixtures.NOW;
import static com.cropadvisor.orchestrator.pipeline.Bundles.*;
import static org.junit.jupiter.api.Assertions.*;

class DecisionPipelineEngineTest {

    private final DecisionPipelineEngine engine = engine(PrecedenceTable.defaults());

    private static DecisionPipelineEngine engine(PrecedenceTable precedence) {
        return new DecisionPipelineEngine(precedence, RecommendationRules.defaults(),
                                          ConfidenceScorer.defaults(), RiskRuleTable.defaults());
    }

    private Decision decide(EvaluationBundle bundle) {
        return engine.buildDecision(bundle, "trace-1", NOW);
    }

    @Nested
    @DisplayName("merge")
    class Merge {

        @Test
        @DisplayName("weather's no-irrigation wins, yet the water-stress finding still surfaces as an alert")
        void weatherBeatsRiskButAlertSurvives() {
            EvaluationBundle bundle = forIntent(Intent.IRRIGATION_QUERY)
                .weather(rainExpected())
                .cropStage(600)
                .risk(finding("critical-water-stress", ThreatKind.WATER_STRESS, Severity.HIGH))
                .context()
                .build();

            Decision decision = decide(bundle);

            assertEquals(RecommendedAction.DO_NOT_IRRIGATE, decision.action());
            assertEquals(EvaluatorId.WEATHER, decision.primarySource());
            assertEquals("Do not irrigate today - rain is expected.", decision.recommendation());
            assertTrue(decision.alerts().get(0).contains("water-stress"));
            assertEquals(1, decision.findings().size());
        }

        @Test
        @DisplayName("without weather the water-stress finding drives irrigation")
        void riskWhenWeatherMissing() {
            EvaluationBundle bundle = forIntent(Intent.IRRIGATION_QUERY)
                .unavailable(EvaluatorId.WEATHER, "timed out after 4000ms")
                .cropStage(600)
                .risk(finding("critical-water-stress", ThreatKind.WATER_STRESS, Severity.HIGH))
                .context()
                .build();

            Decision decision = decide(bundle);

            assertEquals(EvaluatorId.RISK, decision.primarySource());
            assertEquals(RecommendedAction.IRRIGATE, decision.action());
            assertEquals("critical-water-stress action.", decision.recommendation());
        }

        @Test
        @DisplayName("status intents follow crop stage first")
        void statusPrecedence() {
            EvaluationBundle bundle = forIntent(Intent.CROP_STATUS_QUERY)
                .weather(dryAndCalm())
                .cropStage(600)
                .risk()
                .context()
                .build();

            Decision decision = decide(bundle);

            assertEquals(EvaluatorId.CROP_STAGE, decision.primarySource());
            assertEquals(RecommendedAction.INFORM, decision.action());
            assertTrue(decision.recommendation().contains("panicle_initiation"));
        }

        @Test
        @DisplayName("configured precedence override changes the winner")
        void precedenceOverride() {
            PrecedenceTable cropFirst = PrecedenceTable.withOverrides(Map.of(
                "irrigation", List.of(EvaluatorId.CROP_STAGE, EvaluatorId.WEATHER, EvaluatorId.RISK, EvaluatorId.CONTEXT)));
            EvaluationBundle bundle = forIntent(Intent.IRRIGATION_QUERY)
                .weather(rainExpected())
                .cropStage(600)
                .risk()
                .context()
                .build();

            Decision decision = engine(cropFirst).buildDecision(bundle, "trace-1", NOW);

            assertEquals(EvaluatorId.CROP_STAGE, decision.primarySource());
            assertEquals(RecommendedAction.IRRIGATE, decision.action());
            assertEquals(List.of(EvaluatorId.CROP_STAGE, EvaluatorId.WEATHER, EvaluatorId.RISK, EvaluatorId.CONTEXT),
                         cropFirst.order(PrecedenceClass.IRRIGATION));
        }

        @Test
        @DisplayName("harvest intent near maturity recommends preparing the harvest")
        void harvestNearMaturity() {
            EvaluationBundle bundle = forIntent(Intent.HARVEST_TIMING_QUERY)
                .cropStage(1700)
                .risk()
                .context()
                .build();

            Decision decision = decide(bundle);

            assertEquals(RecommendedAction.PREPARE_HARVEST, decision.action());
            assertEquals("Crop nearly ready. Prepare for harvest in 1-2 weeks.", decision.recommendation());
        }
    }

    @Nested
    @DisplayName("alerts")
    class Alerts {

        @Test
        @DisplayName("sorted by severity, then by rule-table order")
        void ordering() {
            EvaluationBundle bundle = forIntent(Intent.IRRIGATION_QUERY)
                .weather(dryAndCalm())
                .cropStage(600)
                .risk(finding("early-pest-window", ThreatKind.PEST, Severity.LOW),
                      finding("rainfed-drought", ThreatKind.WATER_STRESS, Severity.MEDIUM),
                      finding("general-heat", ThreatKind.HEAT_STRESS, Severity.MEDIUM),
                      finding("flowering-heat", ThreatKind.HEAT_STRESS, Severity.HIGH))
                .context()
                .build();

            Decision decision = decide(bundle);

            assertEquals(List.of("flowering-heat", "general-heat", "rainfed-drought", "early-pest-window"),
                         decision.findings().stream().map(f -> f.ruleId()).toList());
            assertTrue(decision.alerts().get(0).startsWith("[HIGH] heat-stress"));
        }

        @Test
        @DisplayName("stale weather adds a notice and the cache data source")
        void staleWeather() {
            EvaluationBundle bundle = forIntent(Intent.IRRIGATION_QUERY)
                .staleWeather(dryAndCalm())
                .cropStage(600)
                .risk()
                .context()
                .build();

            Decision decision = decide(bundle);

            assertTrue(decision.alerts().contains("Using weather from 60 minutes ago; conditions may have changed."));
            assertEquals("open-meteo-cache", decision.dataSources().get(0));
            assertEquals(0.80, decision.confidence(), 1e-9);
            assertTrue(decision.degraded());
        }
    }

    @Test
    @DisplayName("result does not depend on the order outcomes arrived in")
    void arrivalOrderIndependent() {
        EvaluationBundle first = forIntent(Intent.IRRIGATION_QUERY)
            .context().risk(finding("spray-unsafe", ThreatKind.SPRAY_UNSAFE, Severity.LOW)).cropStage(600)
            .weather(rainExpected()).build();
        EvaluationBundle second = forIntent(Intent.IRRIGATION_QUERY)
            .weather(rainExpected()).cropStage(600)
            .risk(finding("spray-unsafe", ThreatKind.SPRAY_UNSAFE, Severity.LOW)).context().build();

        Decision a = decide(first);
        Decision b = decide(second);

        assertEquals(a.reasoning(), b.reasoning());
        assertEquals(a.alerts(), b.alerts());
        assertEquals(a.dataSources(), b.dataSources());
        assertEquals(a.evaluatorsRun(), b.evaluatorsRun());
    }

    @Test
    @DisplayName("reasoning lists penalties with their amounts")
    void reasoningPenalties() {
        EvaluationBundle bundle = forIntent(Intent.IRRIGATION_QUERY)
            .unavailable(EvaluatorId.WEATHER, "timed out after 4000ms")
            .cropStage(600, true, false)
            .risk()
            .context()
            .build();

        Decision decision = decide(bundle);

        assertEquals(0.60, decision.confidence(), 1e-9);
        assertTrue(decision.reasoning().contains(
            "Confidence penalties: weather unavailable -0.20, temperature history unavailable -0.10; confidence 0.60."));
        assertTrue(decision.reasoning().contains("WeatherEvaluator: unavailable (timed out after 4000ms)"));
    }
}
