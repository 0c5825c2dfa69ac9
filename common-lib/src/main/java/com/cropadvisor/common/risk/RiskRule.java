package com.cropadvisor.common.risk;

import com.cropadvisor.common.model.RiskFinding;
import com.cropadvisor.common.model.Severity;
import com.cropadvisor.common.model.ThreatKind;

import java.time.Duration;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One row of the risk rule table.
 *
 * @param requiresWeather rule is skipped when the input carries no {@code FarmingImpact}
 * @param describer       renders the triggering condition with the actual compared values
 */
public record RiskRule(
    String id,
    ThreatKind kind,
    Severity severity,
    Duration validity,
    boolean requiresWeather,
    Predicate<RiskInput> condition,
    Function<RiskInput, String> describer,
    String message,
    String action
) {
    public boolean matches(RiskInput input) {
        if (requiresWeather && !input.hasWeather()) return false;
        return condition.test(input);
    }

    public RiskFinding fire(RiskInput input) {
        return new RiskFinding(kind, severity, id, describer.apply(input), message, action,
                               input.asOf().plus(validity));
    }
}
