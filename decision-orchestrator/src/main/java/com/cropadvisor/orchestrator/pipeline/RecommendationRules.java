package com.cropadvisor.orchestrator.pipeline;

import com.cropadvisor.common.model.EvaluatorId;
import com.cropadvisor.common.model.FarmingImpact;
import com.cropadvisor.common.model.Intent;
import com.cropadvisor.common.model.RecommendedAction;
import com.cropadvisor.common.model.RiskFinding;
import com.cropadvisor.common.model.ThreatKind;
import com.cropadvisor.common.model.WaterNeed;
import com.cropadvisor.evaluator.context.ContextReport;
import com.cropadvisor.evaluator.cropstage.CropStageReport;
import com.cropadvisor.evaluator.risk.RiskReport;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Declares, per intent and per evaluator, the candidate recommendation that evaluator's
 * report supports. A candidate is consulted only when its evaluator produced a report, and
 * may still decline by returning empty.
 */
public final class RecommendationRules {

    /** Candidate for one (intent, evaluator) pair. */
    @FunctionalInterface
    public interface Candidate extends Function<EvaluationBundle, Optional<Recommendation>> {}

    static final double RAIN_RISK_NO_IRRIGATION = 0.5;
    static final double HEAT_PROTECTION_RISK = 0.6;
    static final double NEAR_HARVEST_PROGRESS = 0.9;

    private final Map<Intent, Map<EvaluatorId, Candidate>> rules;

    public RecommendationRules(Map<Intent, Map<EvaluatorId, Candidate>> rules) {
        EnumMap<Intent, Map<EvaluatorId, Candidate>> copy = new EnumMap<>(Intent.class);
        rules.forEach((intent, byEvaluator) -> copy.put(intent, Collections.unmodifiableMap(new EnumMap<>(byEvaluator))));
        this.rules = copy;
    }

    public Optional<Recommendation> candidate(Intent intent, EvaluatorId evaluator, EvaluationBundle bundle) {
        if (!bundle.available(evaluator)) return Optional.empty();
        Candidate candidate = rules.getOrDefault(intent, Map.of()).get(evaluator);
        return candidate == null ? Optional.empty() : candidate.apply(bundle);
    }

    public static RecommendationRules defaults() {
        Map<Intent, Map<EvaluatorId, Candidate>> rules = new EnumMap<>(Intent.class);

        rules.put(Intent.IRRIGATION_QUERY, Map.of(
            EvaluatorId.WEATHER,    RecommendationRules::irrigationFromWeather,
            EvaluatorId.RISK,       RecommendationRules::irrigationFromRisk,
            EvaluatorId.CROP_STAGE, RecommendationRules::irrigationFromStage,
            EvaluatorId.CONTEXT,    b -> Optional.of(new Recommendation(EvaluatorId.CONTEXT, RecommendedAction.MONITOR,
                "Check soil moisture before irrigating."))
        ));
        rules.put(Intent.WEATHER_QUERY, Map.of(
            EvaluatorId.WEATHER, RecommendationRules::fieldWorkFromWeather,
            EvaluatorId.CONTEXT, RecommendationRules::summaryFromContext
        ));
        rules.put(Intent.CROP_STATUS_QUERY, Map.of(
            EvaluatorId.CROP_STAGE, RecommendationRules::statusFromStage,
            EvaluatorId.RISK,       RecommendationRules::topFinding,
            EvaluatorId.WEATHER,    b -> Optional.of(new Recommendation(EvaluatorId.WEATHER, RecommendedAction.INFORM,
                "Current weather: " + b.weatherReport().impact().reasoning() + ".")),
            EvaluatorId.CONTEXT,    RecommendationRules::summaryFromContext
        ));
        rules.put(Intent.HARVEST_TIMING_QUERY, Map.of(
            EvaluatorId.CROP_STAGE, RecommendationRules::harvestFromStage,
            EvaluatorId.RISK,       RecommendationRules::topFinding,
            EvaluatorId.WEATHER,    RecommendationRules::harvestFromWeather,
            EvaluatorId.CONTEXT,    RecommendationRules::summaryFromContext
        ));
        rules.put(Intent.GENERAL_QUERY, Map.of(
            EvaluatorId.CONTEXT, RecommendationRules::summaryFromContext
        ));
        rules.put(Intent.CROP_ONBOARDING_INTENT, Map.of(
            EvaluatorId.CONTEXT, RecommendationRules::onboardingFromContext
        ));
        return new RecommendationRules(rules);
    }

    private static Optional<Recommendation> irrigationFromWeather(EvaluationBundle bundle) {
        FarmingImpact impact = bundle.weatherReport().impact();
        if (impact.rainRisk() >= RAIN_RISK_NO_IRRIGATION) {
            return Optional.of(new Recommendation(EvaluatorId.WEATHER, RecommendedAction.DO_NOT_IRRIGATE,
                "Do not irrigate today - rain is expected."));
        }
        if (impact.irrigationNeeded()) {
            return Optional.of(new Recommendation(EvaluatorId.WEATHER, RecommendedAction.IRRIGATE,
                "Irrigation recommended today."));
        }
        return Optional.of(new Recommendation(EvaluatorId.WEATHER, RecommendedAction.IRRIGATE_IF_DRY,
            "Irrigate only if the topsoil is dry."));
    }

    private static Optional<Recommendation> irrigationFromRisk(EvaluationBundle bundle) {
        return bundle.riskReport().findings().stream()
            .filter(f -> f.kind() == ThreatKind.WATER_STRESS)
            .findFirst()
            .map(f -> new Recommendation(EvaluatorId.RISK, RecommendedAction.IRRIGATE, f.action()));
    }

    private static Optional<Recommendation> irrigationFromStage(EvaluationBundle bundle) {
        CropStageReport report = bundle.cropStageReport();
        WaterNeed need = report.waterNeed();
        String stage = report.stage();
        if (need.atLeast(WaterNeed.HIGH)) {
            return Optional.of(new Recommendation(EvaluatorId.CROP_STAGE, RecommendedAction.IRRIGATE,
                "Crop is at " + stage + " with " + need.key() + " water need; keep the field moist."));
        }
        if (need == WaterNeed.MEDIUM) {
            return Optional.of(new Recommendation(EvaluatorId.CROP_STAGE, RecommendedAction.IRRIGATE_IF_DRY,
                "Crop is at " + stage + "; irrigate if the topsoil is dry."));
        }
        return Optional.of(new Recommendation(EvaluatorId.CROP_STAGE, RecommendedAction.DO_NOT_IRRIGATE,
            "Crop is at " + stage + " with " + need.key() + " water need; irrigation not required."));
    }

    private static Optional<Recommendation> fieldWorkFromWeather(EvaluationBundle bundle) {
        FarmingImpact impact = bundle.weatherReport().impact();
        if (impact.heatStressRisk() >= HEAT_PROTECTION_RISK) {
            return Optional.of(new Recommendation(EvaluatorId.WEATHER, RecommendedAction.PROTECT_FROM_HEAT,
                "High heat expected. Irrigate in the evening and avoid midday field work."));
        }
        if (!impact.fieldWorkSafe()) {
            return Optional.of(new Recommendation(EvaluatorId.WEATHER, RecommendedAction.AVOID_FIELD_WORK,
                "Avoid field work today: " + impact.reasoning() + "."));
        }
        String text = impact.spraySafe()
            ? "Good conditions for field work and spraying."
            : "Field work is fine today, but postpone spraying.";
        return Optional.of(new Recommendation(EvaluatorId.WEATHER, RecommendedAction.FIELD_WORK_OK, text));
    }

    private static Optional<Recommendation> statusFromStage(EvaluationBundle bundle) {
        CropStageReport report = bundle.cropStageReport();
        String text = String.format(Locale.ROOT, "Your %s is at the %s stage (%.0f%% of the stage, %.0f%% to maturity), day %d after sowing.",
            report.cropKind().key(), report.stage(), report.position().stageProgress() * 100,
            report.position().overallProgress() * 100, report.daysSinceSowing());
        return Optional.of(new Recommendation(EvaluatorId.CROP_STAGE, RecommendedAction.INFORM, text));
    }

    private static Optional<Recommendation> harvestFromStage(EvaluationBundle bundle) {
        CropStageReport report = bundle.cropStageReport();
        double overall = report.position().overallProgress();
        if (overall >= 1.0) {
            return Optional.of(new Recommendation(EvaluatorId.CROP_STAGE, RecommendedAction.PREPARE_HARVEST,
                "Your crop has reached maturity. Plan the harvest on the next dry day."));
        }
        if (overall >= NEAR_HARVEST_PROGRESS) {
            return Optional.of(new Recommendation(EvaluatorId.CROP_STAGE, RecommendedAction.PREPARE_HARVEST,
                "Crop nearly ready. Prepare for harvest in 1-2 weeks."));
        }
        String text = report.estimatedDaysToMaturity() != null
            ? String.format(Locale.ROOT, "Not ready for harvest. About %d days to maturity (%s stage).",
                            report.estimatedDaysToMaturity(), report.stage())
            : "Not ready for harvest. Crop is at the " + report.stage() + " stage.";
        return Optional.of(new Recommendation(EvaluatorId.CROP_STAGE, RecommendedAction.HARVEST_NOT_READY, text));
    }

    private static Optional<Recommendation> harvestFromWeather(EvaluationBundle bundle) {
        FarmingImpact impact = bundle.weatherReport().impact();
        if (!impact.fieldWorkSafe()) {
            return Optional.of(new Recommendation(EvaluatorId.WEATHER, RecommendedAction.AVOID_FIELD_WORK,
                "Weather is not suitable for harvesting today: " + impact.reasoning() + "."));
        }
        return Optional.of(new Recommendation(EvaluatorId.WEATHER, RecommendedAction.INFORM,
            "Weather is suitable for field work today."));
    }

    private static Optional<Recommendation> topFinding(EvaluationBundle bundle) {
        RiskReport report = bundle.riskReport();
        Optional<RiskFinding> top = Optional.empty();
        for (RiskFinding finding : report.findings()) {
            if (top.isEmpty() || finding.severity().compareTo(top.get().severity()) > 0) {
                top = Optional.of(finding);
            }
        }
        return top.map(f -> new Recommendation(EvaluatorId.RISK, RecommendedAction.MONITOR, f.message() + " " + f.action()));
    }

    private static Optional<Recommendation> summaryFromContext(EvaluationBundle bundle) {
        ContextReport report = bundle.contextReport();
        return Optional.of(new Recommendation(EvaluatorId.CONTEXT, RecommendedAction.INFORM,
            "Your farm: " + report.summary() + "."));
    }

    private static Optional<Recommendation> onboardingFromContext(EvaluationBundle bundle) {
        ContextReport report = bundle.contextReport();
        if (report.hasRegistration()) {
            return Optional.of(new Recommendation(EvaluatorId.CONTEXT, RecommendedAction.REGISTER_CROP,
                String.format(Locale.ROOT, "Registered your %s crop sown on %s. I will track its growth from now on.",
                    report.proposedRegistration().cropKind().key(), report.proposedRegistration().sowingDate())));
        }
        String problem = report.registrationProblem() != null ? report.registrationProblem() : "crop details missing";
        return Optional.of(new Recommendation(EvaluatorId.CONTEXT, RecommendedAction.COMPLETE_PROFILE,
            "Could not register your crop: " + problem + ". Please tell me the crop and sowing date."));
    }
}
