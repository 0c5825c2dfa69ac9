package com.cropadvisor.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable outcome of one decision run. Built only by the orchestrator; also the shape
 * of the audit record written at the end of every run.
 */
public record Decision(
    @JsonProperty("traceId")        String traceId,
    @JsonProperty("farmerId")       Long farmerId,
    @JsonProperty("intent")         String intent,
    @JsonProperty("action")         RecommendedAction action,
    @JsonProperty("recommendation") String recommendation,
    @JsonProperty("primarySource")  EvaluatorId primarySource,
    @JsonProperty("confidence")     double confidence,
    @JsonProperty("findings")       List<RiskFinding> findings,
    @JsonProperty("alerts")         List<String> alerts,
    @JsonProperty("dataSources")    List<String> dataSources,
    @JsonProperty("evaluatorsRun")  List<EvaluatorId> evaluatorsRun,
    @JsonProperty("reasoning")      List<String> reasoning,
    @JsonProperty("degraded")       boolean degraded,
    @JsonProperty("decidedAt")      Instant decidedAt
) {
    public static final double CONFIDENCE_FLOOR = 0.1;

    public Decision {
        if (confidence < CONFIDENCE_FLOOR || confidence > 1.0) {
            throw new IllegalArgumentException("confidence outside [0.1, 1.0]: " + confidence);
        }
        findings      = findings      == null ? List.of() : List.copyOf(findings);
        alerts        = alerts        == null ? List.of() : List.copyOf(alerts);
        dataSources   = dataSources   == null ? List.of() : List.copyOf(dataSources);
        evaluatorsRun = evaluatorsRun == null ? List.of() : List.copyOf(evaluatorsRun);
        reasoning     = reasoning     == null ? List.of() : List.copyOf(reasoning);
    }

    /** Copy with one more alert appended, used when a post-finalize step reports a problem. */
    public Decision withExtraAlert(String alert) {
        List<String> extended = new ArrayList<>(alerts);
        extended.add(alert);
        return new Decision(traceId, farmerId, intent, action, recommendation, primarySource,
                            confidence, findings, extended, dataSources, evaluatorsRun,
                            reasoning, degraded, decidedAt);
    }
}
