package com.cropadvisor.orchestrator.pipeline;

import com.cropadvisor.common.model.EvaluatorId;
import com.cropadvisor.common.model.RecommendedAction;

/** A candidate recommendation supported by one evaluator's report. */
public record Recommendation(EvaluatorId source, RecommendedAction action, String text) {}
