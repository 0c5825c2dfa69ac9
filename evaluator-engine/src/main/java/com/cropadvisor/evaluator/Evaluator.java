package com.cropadvisor.evaluator;

import com.cropadvisor.common.model.EvaluatorId;
import reactor.core.publisher.Mono;

/**
 * A specialist that turns one slice of the farm's situation into a report.
 *
 * <p>Evaluators never call each other and never write to the context store: anything
 * they want persisted is returned as a proposal for the orchestrator to commit.
 * Recoverable problems are signalled with {@code DataUnavailableException}.
 *
 * @param <I> input the orchestrator assembles for this evaluator
 * @param <O> report type
 */
public interface Evaluator<I, O> {

    Mono<O> evaluate(I input);

    EvaluatorId id();
}
