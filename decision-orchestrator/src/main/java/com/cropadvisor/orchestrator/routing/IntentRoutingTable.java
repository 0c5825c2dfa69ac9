package com.cropadvisor.orchestrator.routing;

import com.cropadvisor.common.model.EvaluatorId;
import com.cropadvisor.common.model.Intent;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static com.cropadvisor.common.model.EvaluatorId.CONTEXT;
import static com.cropadvisor.common.model.EvaluatorId.CROP_STAGE;
import static com.cropadvisor.common.model.EvaluatorId.RISK;
import static com.cropadvisor.common.model.EvaluatorId.WEATHER;

/**
 * Declared mapping from intent to the evaluators it needs, its precedence class and its
 * confidence ceiling. Every intent must have exactly one route.
 */
public final class IntentRoutingTable {

    private final Map<Intent, IntentRoute> routes;

    public IntentRoutingTable(List<IntentRoute> routes) {
        EnumMap<Intent, IntentRoute> byIntent = new EnumMap<>(Intent.class);
        for (IntentRoute route : routes) {
            if (byIntent.put(route.intent(), route) != null) {
                throw new IllegalArgumentException("duplicate route for " + route.intent());
            }
        }
        for (Intent intent : Intent.values()) {
            if (!byIntent.containsKey(intent)) {
                throw new IllegalArgumentException("no route for " + intent);
            }
        }
        this.routes = byIntent;
    }

    public IntentRoute route(Intent intent) {
        return routes.get(intent);
    }

    public static IntentRoutingTable defaults() {
        return new IntentRoutingTable(List.of(
            new IntentRoute(Intent.IRRIGATION_QUERY,       EnumSet.of(WEATHER, CROP_STAGE, RISK, CONTEXT),
                            PrecedenceClass.IRRIGATION, 0.90, true,  true),
            new IntentRoute(Intent.WEATHER_QUERY,          EnumSet.of(WEATHER, CONTEXT),
                            PrecedenceClass.IRRIGATION, 0.85, false, true),
            new IntentRoute(Intent.CROP_STATUS_QUERY,      EnumSet.of(CROP_STAGE, WEATHER, RISK, CONTEXT),
                            PrecedenceClass.STATUS,     0.90, true,  false),
            new IntentRoute(Intent.HARVEST_TIMING_QUERY,   EnumSet.of(CROP_STAGE, WEATHER, RISK, CONTEXT),
                            PrecedenceClass.STATUS,     0.85, true,  false),
            new IntentRoute(Intent.GENERAL_QUERY,          EnumSet.of(CONTEXT),
                            PrecedenceClass.CONTEXT,    0.70, false, false),
            new IntentRoute(Intent.CROP_ONBOARDING_INTENT, EnumSet.of(CONTEXT),
                            PrecedenceClass.CONTEXT,    0.80, false, false)
        ));
    }
}
