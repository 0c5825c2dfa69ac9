package com.cropadvisor.orchestrator.pipeline;

import com.cropadvisor.common.model.EvaluatorId;
import com.cropadvisor.evaluator.EvaluatorOutcome;
import com.cropadvisor.evaluator.cropstage.CropStageReport;
import com.cropadvisor.evaluator.weather.WeatherReport;
import com.cropadvisor.orchestrator.config.AdvisorProperties;
import com.cropadvisor.orchestrator.pipeline.ConfidenceAssessment.AppliedPenalty;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Intent ceiling minus one fixed penalty per missing or degraded input, floored.
 *
 * <p>"Data evaluators" are the dispatched evaluators other than Context; for a run that
 * dispatched only Context, Context itself. When none of them produced a report the run
 * has insufficient data and the confidence is exactly the floor.
 */
public final class ConfidenceScorer {

    private final Map<ConfidencePenalty, Double> amounts;
    private final double floor;

    public ConfidenceScorer(Map<ConfidencePenalty, Double> amounts, double floor) {
        if (floor <= 0 || floor >= 1) {
            throw new IllegalArgumentException("confidence floor outside (0, 1): " + floor);
        }
        EnumMap<ConfidencePenalty, Double> resolved = new EnumMap<>(ConfidencePenalty.class);
        for (ConfidencePenalty penalty : ConfidencePenalty.values()) {
            resolved.put(penalty, amounts.getOrDefault(penalty, penalty.defaultAmount()));
        }
        this.amounts = resolved;
        this.floor = floor;
    }

    public static ConfidenceScorer defaults() {
        return new ConfidenceScorer(Map.of(), 0.1);
    }

    public static ConfidenceScorer from(AdvisorProperties.Confidence config) {
        EnumMap<ConfidencePenalty, Double> configured = new EnumMap<>(ConfidencePenalty.class);
        for (ConfidencePenalty penalty : ConfidencePenalty.values()) {
            configured.put(penalty, config.amountOf(penalty));
        }
        return new ConfidenceScorer(configured, config.getFloor());
    }

    public double floor() {
        return floor;
    }

    public ConfidenceAssessment score(double ceiling, EvaluationBundle bundle) {
        List<AppliedPenalty> applied = new ArrayList<>();

        if (bundle.dispatched(EvaluatorId.WEATHER)) {
            EvaluatorOutcome<WeatherReport> weather = bundle.weather();
            if (!weather.isAvailable()) {
                applied.add(penalty(ConfidencePenalty.WEATHER_UNAVAILABLE));
            } else if (weather.report().stale()) {
                applied.add(penalty(ConfidencePenalty.WEATHER_STALE));
            }
        }
        if (bundle.dispatched(EvaluatorId.CROP_STAGE)) {
            EvaluatorOutcome<CropStageReport> stage = bundle.cropStage();
            if (!stage.isAvailable()) {
                boolean incomplete = bundle.snapshot().activeCrop() != null
                                     && !bundle.snapshot().activeCrop().isComplete();
                applied.add(penalty(incomplete ? ConfidencePenalty.CROP_RECORD_INCOMPLETE
                                               : ConfidencePenalty.CROP_STAGE_UNAVAILABLE));
            } else {
                if (stage.report().gddStale()) {
                    applied.add(penalty(ConfidencePenalty.TEMPERATURE_HISTORY_UNAVAILABLE));
                }
                if (stage.report().genericFallback()) {
                    applied.add(penalty(ConfidencePenalty.GENERIC_PHENOLOGY));
                }
            }
        }
        if (bundle.dispatched(EvaluatorId.RISK) && !bundle.risk().isAvailable()) {
            applied.add(penalty(ConfidencePenalty.RISK_UNAVAILABLE));
        }

        boolean insufficient = bundle.dataEvaluators().stream()
            .noneMatch(id -> bundle.outcome(id).isAvailable());
        if (insufficient) {
            return new ConfidenceAssessment(floor, ceiling, applied, true);
        }

        double total = applied.stream().mapToDouble(AppliedPenalty::amount).sum();
        double confidence = Math.max(floor, round2(ceiling - total));
        return new ConfidenceAssessment(confidence, ceiling, applied, false);
    }

    private AppliedPenalty penalty(ConfidencePenalty penalty) {
        return new AppliedPenalty(penalty, amounts.get(penalty));
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
