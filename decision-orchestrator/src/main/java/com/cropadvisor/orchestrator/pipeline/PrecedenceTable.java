package com.cropadvisor.orchestrator.pipeline;

import com.cropadvisor.common.model.EvaluatorId;
import com.cropadvisor.orchestrator.routing.PrecedenceClass;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.cropadvisor.common.model.EvaluatorId.CONTEXT;
import static com.cropadvisor.common.model.EvaluatorId.CROP_STAGE;
import static com.cropadvisor.common.model.EvaluatorId.RISK;
import static com.cropadvisor.common.model.EvaluatorId.WEATHER;

/**
 * Which evaluator's recommendation wins, per precedence class. Earlier entries win.
 */
public final class PrecedenceTable {

    private static final Map<PrecedenceClass, List<EvaluatorId>> DEFAULT_ORDER = Map.of(
        PrecedenceClass.IRRIGATION, List.of(WEATHER, RISK, CROP_STAGE, CONTEXT),
        PrecedenceClass.STATUS,     List.of(CROP_STAGE, RISK, WEATHER, CONTEXT),
        PrecedenceClass.CONTEXT,    List.of(CONTEXT)
    );

    private final Map<PrecedenceClass, List<EvaluatorId>> order;

    public PrecedenceTable(Map<PrecedenceClass, List<EvaluatorId>> order) {
        EnumMap<PrecedenceClass, List<EvaluatorId>> copy = new EnumMap<>(PrecedenceClass.class);
        for (PrecedenceClass precedenceClass : PrecedenceClass.values()) {
            List<EvaluatorId> evaluators = order.get(precedenceClass);
            if (evaluators == null || evaluators.isEmpty()) {
                throw new IllegalArgumentException("no precedence declared for " + precedenceClass);
            }
            EnumSet<EvaluatorId> seen = EnumSet.noneOf(EvaluatorId.class);
            for (EvaluatorId id : evaluators) {
                if (!seen.add(id)) {
                    throw new IllegalArgumentException("evaluator " + id + " listed twice for " + precedenceClass);
                }
            }
            copy.put(precedenceClass, List.copyOf(evaluators));
        }
        this.order = copy;
    }

    public static PrecedenceTable defaults() {
        return new PrecedenceTable(DEFAULT_ORDER);
    }

    /**
     * Built-in order with the given classes replaced. Keys are class names, case-insensitive.
     */
    public static PrecedenceTable withOverrides(Map<String, List<EvaluatorId>> overrides) {
        EnumMap<PrecedenceClass, List<EvaluatorId>> merged = new EnumMap<>(DEFAULT_ORDER);
        if (overrides != null) {
            overrides.forEach((name, evaluators) ->
                merged.put(PrecedenceClass.valueOf(name.trim().toUpperCase(Locale.ROOT)), evaluators));
        }
        return new PrecedenceTable(merged);
    }

    public List<EvaluatorId> order(PrecedenceClass precedenceClass) {
        return order.get(precedenceClass);
    }
}
