package com.cropadvisor.orchestrator.pipeline;

import com.cropadvisor.common.model.EvaluatorId;
import com.cropadvisor.evaluator.EvaluatorOutcome;
import com.cropadvisor.evaluator.context.ContextReport;
import com.cropadvisor.evaluator.context.FarmSnapshot;
import com.cropadvisor.evaluator.cropstage.CropStageReport;
import com.cropadvisor.evaluator.risk.RiskReport;
import com.cropadvisor.evaluator.weather.WeatherReport;
import com.cropadvisor.orchestrator.routing.IntentRoute;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Outcomes of one run keyed by evaluator identity. Iteration order is the enum order,
 * never arrival order. Evaluators the route skipped have no entry and report
 * {@code dispatched == false}.
 */
public final class EvaluationBundle {

    private final FarmSnapshot snapshot;
    private final IntentRoute route;
    private final EnumMap<EvaluatorId, EvaluatorOutcome<?>> outcomes;

    public EvaluationBundle(FarmSnapshot snapshot, IntentRoute route, Map<EvaluatorId, EvaluatorOutcome<?>> outcomes) {
        this.snapshot = snapshot;
        this.route = route;
        this.outcomes = outcomes.isEmpty() ? new EnumMap<>(EvaluatorId.class) : new EnumMap<>(outcomes);
    }

    /** Copy with one outcome added or replaced. */
    public EvaluationBundle with(EvaluatorOutcome<?> outcome) {
        EnumMap<EvaluatorId, EvaluatorOutcome<?>> next = new EnumMap<>(EvaluatorId.class);
        next.putAll(outcomes);
        next.put(outcome.id(), outcome);
        return new EvaluationBundle(snapshot, route, next);
    }

    public FarmSnapshot snapshot() {
        return snapshot;
    }

    public IntentRoute route() {
        return route;
    }

    public boolean dispatched(EvaluatorId id) {
        return outcomes.containsKey(id);
    }

    public Set<EvaluatorId> dispatchedIds() {
        return outcomes.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(outcomes.keySet()));
    }

    /**
     * Dispatched evaluators that carry farm data: everything except Context, or Context
     * itself when it was the only one dispatched.
     */
    public Set<EvaluatorId> dataEvaluators() {
        EnumSet<EvaluatorId> data = EnumSet.noneOf(EvaluatorId.class);
        data.addAll(outcomes.keySet());
        data.remove(EvaluatorId.CONTEXT);
        if (data.isEmpty() && outcomes.containsKey(EvaluatorId.CONTEXT)) {
            data.add(EvaluatorId.CONTEXT);
        }
        return data;
    }

    public boolean available(EvaluatorId id) {
        EvaluatorOutcome<?> outcome = outcomes.get(id);
        return outcome != null && outcome.isAvailable();
    }

    /** Outcome of a dispatched evaluator, or an unavailable one when the route skipped it. */
    public EvaluatorOutcome<?> outcome(EvaluatorId id) {
        EvaluatorOutcome<?> outcome = outcomes.get(id);
        return outcome != null ? outcome : EvaluatorOutcome.unavailable(id, "not dispatched", Duration.ZERO);
    }

    @SuppressWarnings("unchecked")
    public EvaluatorOutcome<WeatherReport> weather() {
        return (EvaluatorOutcome<WeatherReport>) outcome(EvaluatorId.WEATHER);
    }

    @SuppressWarnings("unchecked")
    public EvaluatorOutcome<CropStageReport> cropStage() {
        return (EvaluatorOutcome<CropStageReport>) outcome(EvaluatorId.CROP_STAGE);
    }

    @SuppressWarnings("unchecked")
    public EvaluatorOutcome<RiskReport> risk() {
        return (EvaluatorOutcome<RiskReport>) outcome(EvaluatorId.RISK);
    }

    @SuppressWarnings("unchecked")
    public EvaluatorOutcome<ContextReport> context() {
        return (EvaluatorOutcome<ContextReport>) outcome(EvaluatorId.CONTEXT);
    }

    public WeatherReport weatherReport() {
        return weather().report();
    }

    public CropStageReport cropStageReport() {
        return cropStage().report();
    }

    public RiskReport riskReport() {
        return risk().report();
    }

    public ContextReport contextReport() {
        return context().report();
    }
}
