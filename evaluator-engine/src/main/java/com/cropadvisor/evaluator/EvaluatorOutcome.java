package com.cropadvisor.evaluator;

import com.cropadvisor.common.model.EvaluatorId;

import java.time.Duration;

/**
 * What came back from one evaluator in a run: either a report or the reason there is none.
 */
public record EvaluatorOutcome<T>(EvaluatorId id, T report, String unavailableReason, Duration elapsed) {

    public static <T> EvaluatorOutcome<T> available(EvaluatorId id, T report, Duration elapsed) {
        return new EvaluatorOutcome<>(id, report, null, elapsed);
    }

    public static <T> EvaluatorOutcome<T> unavailable(EvaluatorId id, String reason, Duration elapsed) {
        return new EvaluatorOutcome<>(id, null, reason, elapsed);
    }

    public boolean isAvailable() {
        return report != null;
    }
}
