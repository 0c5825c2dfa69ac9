package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A threat surfaced by one risk rule. {@code ruleId} and {@code triggeringCondition}
 * name the rule that fired and the threshold it compared, for the audit trail.
 */
public record RiskFinding(
    @JsonProperty("kind")                ThreatKind kind,
    @JsonProperty("severity")            Severity severity,
    @JsonProperty("ruleId")              String ruleId,
    @JsonProperty("triggeringCondition") String triggeringCondition,
    @JsonProperty("message")             String message,
    @JsonProperty("action")              String action,
    @JsonProperty("validUntil")          Instant validUntil
) {
    public String alertText() {
        return String.format("[%s] %s: %s %s", severity.name(), kind.label(), message, action);
    }
}
