package com.cropadvisor.common.model;

/**
 * Identity of each evaluator. Declaration order is the order evaluators are listed in
 * reasoning traces and audit records; it carries no precedence meaning.
 */
public enum EvaluatorId {
    WEATHER("WeatherEvaluator"),
    CROP_STAGE("CropStageEvaluator"),
    RISK("RiskEvaluator"),
    CONTEXT("ContextEvaluator");

    private final String displayName;

    EvaluatorId(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
