package com.cropadvisor.orchestrator.pipeline;

import com.cropadvisor.common.model.Decision;
import com.cropadvisor.common.model.EvaluatorId;
import com.cropadvisor.common.model.RecommendedAction;
import com.cropadvisor.common.model.RiskFinding;
import com.cropadvisor.common.risk.RiskRuleTable;
import com.cropadvisor.evaluator.EvaluatorOutcome;
import com.cropadvisor.evaluator.cropstage.CropStageReport;
import com.cropadvisor.evaluator.weather.WeatherReport;
import com.cropadvisor.orchestrator.routing.IntentRoute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Merges the outcomes of one run into a {@link Decision}.
 *
 * <h3>Merge order</h3>
 * <ol>
 *   <li>Confidence: route ceiling minus penalties, floored</li>
 *   <li>Primary recommendation: first available candidate in precedence order</li>
 *   <li>Alerts: every risk finding, severity high to low then rule-table order, followed by
 *       degradation notices</li>
 *   <li>Reasoning trace and data sources</li>
 * </ol>
 *
 * Pure function of its inputs; no I/O.
 */
@Component
public class DecisionPipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionPipelineEngine.class);

    public static final String INSUFFICIENT_DATA_TEXT =
        "I don't have enough information right now to give a reliable answer. Please try again shortly.";

    static final String SOURCE_GDD = "gdd_calculation";
    static final String SOURCE_KNOWLEDGE_BASE = "crop_knowledge_base";
    static final String SOURCE_RISK_RULES = "risk_rules";
    static final String SOURCE_DATABASE = "database";

    private final PrecedenceTable precedenceTable;
    private final RecommendationRules recommendationRules;
    private final ConfidenceScorer confidenceScorer;
    private final RiskRuleTable riskRuleTable;

    public DecisionPipelineEngine(PrecedenceTable precedenceTable, RecommendationRules recommendationRules,
                                  ConfidenceScorer confidenceScorer, RiskRuleTable riskRuleTable) {
        this.precedenceTable = precedenceTable;
        this.recommendationRules = recommendationRules;
        this.confidenceScorer = confidenceScorer;
        this.riskRuleTable = riskRuleTable;
    }

    public Decision buildDecision(EvaluationBundle bundle, String traceId, Instant decidedAt) {
        IntentRoute route = bundle.route();
        List<EvaluatorId> order = precedenceTable.order(route.precedenceClass());

        ConfidenceAssessment assessment = confidenceScorer.score(route.ceiling(), bundle);

        Optional<Recommendation> primary = Optional.empty();
        if (!assessment.insufficientData()) {
            for (EvaluatorId id : order) {
                if (!bundle.dispatched(id)) continue;
                primary = recommendationRules.candidate(route.intent(), id, bundle);
                if (primary.isPresent()) break;
            }
        }

        List<RiskFinding> findings = sortedFindings(bundle);
        List<String> alerts = new ArrayList<>();
        findings.forEach(f -> alerts.add(f.alertText()));
        alerts.addAll(degradationAlerts(bundle, decidedAt));

        List<String> dataSources = dataSources(bundle);
        List<EvaluatorId> evaluatorsRun = new ArrayList<>(bundle.dispatchedIds());

        RecommendedAction action = primary.map(Recommendation::action).orElse(RecommendedAction.INSUFFICIENT_DATA);
        String text = primary.map(Recommendation::text).orElse(INSUFFICIENT_DATA_TEXT);
        EvaluatorId primarySource = primary.map(Recommendation::source).orElse(null);

        List<String> reasoning = reasoning(bundle, order, primarySource, assessment, findings, dataSources);
        boolean degraded = assessment.insufficientData() || !assessment.penalties().isEmpty();

        log.info("Decision merged. intent={} action={} primary={} confidence={} findings={} degraded={} traceId={}",
                 route.intent().wireName(), action, primarySource, assessment.confidence(),
                 findings.size(), degraded, traceId);

        return new Decision(traceId, bundle.snapshot().farmerId(), route.intent().wireName(), action, text,
                            primarySource, assessment.confidence(), findings, alerts, dataSources,
                            evaluatorsRun, reasoning, degraded, decidedAt);
    }

    private List<RiskFinding> sortedFindings(EvaluationBundle bundle) {
        if (!bundle.available(EvaluatorId.RISK)) return List.of();
        return bundle.riskReport().findings().stream()
            .sorted(Comparator.comparing(RiskFinding::severity).reversed()
                        .thenComparingInt(f -> riskRuleTable.orderOf(f.ruleId())))
            .collect(Collectors.toList());
    }

    private List<String> degradationAlerts(EvaluationBundle bundle, Instant decidedAt) {
        List<String> alerts = new ArrayList<>();
        if (bundle.dispatched(EvaluatorId.WEATHER)) {
            EvaluatorOutcome<WeatherReport> weather = bundle.weather();
            if (!weather.isAvailable()) {
                alerts.add("Live weather is unavailable; this advice does not account for current conditions.");
            } else if (weather.report().stale()) {
                Duration age = weather.report().snapshot().ageAt(decidedAt);
                alerts.add(String.format(Locale.ROOT,
                    "Using weather from %d minutes ago; conditions may have changed.", Math.max(0, age.toMinutes())));
            }
        }
        if (bundle.dispatched(EvaluatorId.CROP_STAGE)) {
            EvaluatorOutcome<CropStageReport> stage = bundle.cropStage();
            if (!stage.isAvailable()) {
                boolean incomplete = bundle.snapshot().activeCrop() != null
                                     && !bundle.snapshot().activeCrop().isComplete();
                alerts.add(incomplete
                    ? "Sowing date is missing; add it to get stage-based advice."
                    : "Crop stage could not be determined right now.");
            } else {
                if (stage.report().gddStale()) {
                    alerts.add("Temperature history is unavailable; crop stage was not updated today.");
                }
                if (stage.report().genericFallback()) {
                    alerts.add("No growth data for this crop; stage estimated from a generic curve.");
                }
            }
        }
        if (bundle.dispatched(EvaluatorId.RISK) && !bundle.risk().isAvailable()) {
            alerts.add("Crop risk check is unavailable.");
        } else if (bundle.available(EvaluatorId.RISK) && !bundle.riskReport().weatherConsidered()) {
            alerts.add("Weather-dependent risks were not checked.");
        }
        return alerts;
    }

    private List<String> dataSources(EvaluationBundle bundle) {
        List<String> sources = new ArrayList<>();
        if (bundle.available(EvaluatorId.WEATHER)) {
            sources.add(bundle.weatherReport().source());
        }
        if (bundle.available(EvaluatorId.CROP_STAGE)) {
            sources.add(SOURCE_GDD);
            sources.add(SOURCE_KNOWLEDGE_BASE);
        }
        if (bundle.available(EvaluatorId.RISK)) {
            sources.add(SOURCE_RISK_RULES);
        }
        if (bundle.available(EvaluatorId.CONTEXT)) {
            sources.add(SOURCE_DATABASE);
        }
        return sources;
    }

    private List<String> reasoning(EvaluationBundle bundle, List<EvaluatorId> order, EvaluatorId primarySource,
                                   ConfidenceAssessment assessment, List<RiskFinding> findings,
                                   List<String> dataSources) {
        IntentRoute route = bundle.route();
        List<String> lines = new ArrayList<>();
        lines.add(String.format(Locale.ROOT, "Intent %s routed to %s precedence (ceiling %.2f).",
                                route.intent().wireName(), route.precedenceClass(), route.ceiling()));
        lines.add("Evaluators run: " + bundle.dispatchedIds().stream()
            .map(EvaluatorId::displayName).collect(Collectors.joining(", ")) + ".");

        for (EvaluatorId id : bundle.dispatchedIds()) {
            EvaluatorOutcome<?> outcome = bundle.outcome(id);
            lines.add(outcome.isAvailable()
                ? id.displayName() + ": " + justification(bundle, id)
                : id.displayName() + ": unavailable (" + outcome.unavailableReason() + ")");
        }
        for (RiskFinding finding : findings) {
            lines.add("Rule " + finding.ruleId() + " fired: " + finding.triggeringCondition());
        }

        String orderText = order.stream().map(EvaluatorId::displayName).collect(Collectors.joining(" > "));
        lines.add(primarySource != null
            ? "Precedence " + orderText + "; recommendation from " + primarySource.displayName() + "."
            : "Precedence " + orderText + "; no evaluator produced a recommendation.");

        if (assessment.insufficientData()) {
            lines.add(String.format(Locale.ROOT, "Insufficient data: confidence set to floor %.2f.",
                                    assessment.confidence()));
        } else if (assessment.penalties().isEmpty()) {
            lines.add(String.format(Locale.ROOT, "No confidence penalties; confidence %.2f.", assessment.confidence()));
        } else {
            lines.add("Confidence penalties: " + assessment.penalties().stream()
                .map(p -> String.format(Locale.ROOT, "%s -%.2f", p.penalty().label(), p.amount()))
                .collect(Collectors.joining(", "))
                + String.format(Locale.ROOT, "; confidence %.2f.", assessment.confidence()));
        }
        lines.add("Data sources: " + (dataSources.isEmpty() ? "none" : String.join(", ", dataSources)) + ".");
        return lines;
    }

    private static String justification(EvaluationBundle bundle, EvaluatorId id) {
        switch (id) {
            case WEATHER:    return bundle.weatherReport().justification();
            case CROP_STAGE: return bundle.cropStageReport().justification();
            case RISK:       return bundle.riskReport().justification();
            default:         return bundle.contextReport().justification();
        }
    }
}
