package com.cropadvisor.orchestrator.routing;

import com.cropadvisor.common.model.EvaluatorId;
import com.cropadvisor.common.model.Intent;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * One row of the routing table.
 *
 * @param ceiling       confidence before any penalty
 * @param needsCrop     the run cannot proceed without an active crop
 * @param needsLocation the run cannot proceed without a farm location
 */
public record IntentRoute(
    Intent intent,
    Set<EvaluatorId> evaluators,
    PrecedenceClass precedenceClass,
    double ceiling,
    boolean needsCrop,
    boolean needsLocation
) {
    public IntentRoute {
        if (evaluators.isEmpty()) {
            throw new IllegalArgumentException("route for " + intent + " has no evaluators");
        }
        if (ceiling <= 0 || ceiling > 1) {
            throw new IllegalArgumentException("ceiling outside (0, 1]: " + ceiling);
        }
        evaluators = Collections.unmodifiableSet(EnumSet.copyOf(evaluators));
    }

    public boolean includes(EvaluatorId id) {
        return evaluators.contains(id);
    }
}
