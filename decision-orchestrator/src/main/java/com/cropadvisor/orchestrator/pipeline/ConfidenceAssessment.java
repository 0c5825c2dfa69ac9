package com.cropadvisor.orchestrator.pipeline;

import java.util.List;

/**
 * @param insufficientData every data evaluator of the run was unavailable
 */
public record ConfidenceAssessment(double confidence, double ceiling, List<AppliedPenalty> penalties,
                                   boolean insufficientData) {

    public record AppliedPenalty(ConfidencePenalty penalty, double amount) {}

    public ConfidenceAssessment {
        penalties = List.copyOf(penalties);
    }
}
